package com.starterkit.generator.merge;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Orders npm-style version constraints by the version they name.
 * Range operators ({@code ^}, {@code ~}, {@code >=}, {@code v}) are ignored and missing
 * minor or patch parts count as zero. A release sorts above its pre-releases, and pre-release
 * identifiers compare numerically when both are digits ({@code beta.10} above {@code beta.2}).
 * Constraints without a version number ({@code latest}, {@code *}, URLs) sort below all others.
 */
public final class VersionComparator {

    private static final Pattern VERSION = Pattern.compile(
            "^[\\^~>=<v\\s]*(\\d+)(?:\\.(\\d+|[xX*]))?(?:\\.(\\d+|[xX*]))?(?:-([0-9A-Za-z.-]+))?");

    private VersionComparator() {
        // utility class
    }

    public static int compare(String a, String b) {
        long[] left = parse(a);
        long[] right = parse(b);
        if (left == null || right == null) {
            return Boolean.compare(left != null, right != null);
        }
        for (int i = 0; i < 3; i++) {
            int cmp = Long.compare(left[i], right[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return comparePreRelease(preRelease(a), preRelease(b));
    }

    private static long[] parse(String constraint) {
        if (constraint == null) {
            return null;
        }
        Matcher m = VERSION.matcher(constraint.trim());
        if (!m.find()) {
            return null;
        }
        return new long[]{number(m.group(1)), number(m.group(2)), number(m.group(3))};
    }

    private static String preRelease(String constraint) {
        Matcher m = VERSION.matcher(constraint.trim());
        return m.find() ? m.group(4) : null;
    }

    private static long number(String part) {
        if (part == null || !Character.isDigit(part.charAt(0))) {
            return 0;
        }
        try {
            return Long.parseLong(part);
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }

    private static int comparePreRelease(String a, String b) {
        if (a == null || b == null) {
            // No pre-release tag is the higher of the two
            return Boolean.compare(a == null, b == null);
        }
        String[] left = a.split("\\.");
        String[] right = b.split("\\.");
        for (int i = 0; i < Math.min(left.length, right.length); i++) {
            int cmp = compareIdentifier(left[i], right[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.length, right.length);
    }

    // Numeric identifiers sort below alphanumeric ones
    private static int compareIdentifier(String a, String b) {
        boolean leftNumeric = isNumeric(a);
        boolean rightNumeric = isNumeric(b);
        if (leftNumeric && rightNumeric) {
            String left = stripLeadingZeros(a);
            String right = stripLeadingZeros(b);
            int cmp = Integer.compare(left.length(), right.length());
            return cmp != 0 ? cmp : left.compareTo(right);
        }
        if (leftNumeric != rightNumeric) {
            return leftNumeric ? -1 : 1;
        }
        return a.compareTo(b);
    }

    private static boolean isNumeric(String identifier) {
        return !identifier.isEmpty() && identifier.chars().allMatch(Character::isDigit);
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }
}
