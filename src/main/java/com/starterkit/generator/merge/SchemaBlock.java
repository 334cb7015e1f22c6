package com.starterkit.generator.merge;

import java.util.Objects;

/**
 * One top-level block of a Prisma schema, such as {@code model User { ... }}.
 *
 * @param kind the block keyword
 * @param name the declared name
 * @param text the block source, from keyword to closing brace
 */
public record SchemaBlock(Kind kind, String name, String text) {

    public SchemaBlock {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(text, "text is required");
    }

    public boolean isPreamble() {
        return kind == Kind.GENERATOR || kind == Kind.DATASOURCE;
    }

    /**
     * Block keywords recognised by {@link SchemaParser}.
     */
    public enum Kind {
        GENERATOR("generator"),
        DATASOURCE("datasource"),
        MODEL("model"),
        VIEW("view"),
        TYPE("type"),
        ENUM("enum");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        static Kind fromKeyword(String keyword) {
            for (Kind kind : values()) {
                if (kind.keyword.equals(keyword)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Unknown schema block keyword: " + keyword);
        }
    }
}
