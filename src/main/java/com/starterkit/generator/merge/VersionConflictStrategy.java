package com.starterkit.generator.merge;

/**
 * Strategies for choosing a version constraint when two declarations of the same package differ.
 */
public enum VersionConflictStrategy {
    /**
     * Keep the constraint declared last in resolution order.
     */
    LAST_WINS {
        @Override
        public String choose(String current, String incoming) {
            return incoming;
        }
    },

    /**
     * Keep the constraint declared first, normally the base template's.
     */
    FIRST_WINS {
        @Override
        public String choose(String current, String incoming) {
            return current;
        }
    },

    /**
     * Keep the constraint with the higher semantic version; ties keep the current one.
     */
    HIGHEST_VERSION {
        @Override
        public String choose(String current, String incoming) {
            return VersionComparator.compare(incoming, current) > 0 ? incoming : current;
        }
    };

    /**
     * Picks the constraint to keep.
     *
     * @param current  the constraint selected so far
     * @param incoming the newly declared constraint
     */
    public abstract String choose(String current, String incoming);
}
