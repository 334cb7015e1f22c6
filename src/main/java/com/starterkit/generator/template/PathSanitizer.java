package com.starterkit.generator.template;

import java.nio.file.Path;

/**
 * Validation of the relative paths that come from catalog data: mapping sources
 * and archive destinations. Rejects anything that would escape its root.
 */
public final class PathSanitizer {

    /** Maximum allowed length for a relative path. */
    public static final int MAX_PATH_LENGTH = 1024;

    private PathSanitizer() {
        // utility class
    }

    /**
     * Resolves {@code relative} against {@code root} and checks the result stays under it.
     *
     * @param root     the directory the path must stay within
     * @param relative the relative path from catalog or configuration data
     * @param label    what the path is, used in the error message
     * @return the normalized absolute path
     * @throws BaseTemplateException if the path is blank, absolute or escapes the root
     */
    public static Path resolveWithin(Path root, String relative, String label) {
        validateRelative(relative, label);
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path resolved = normalizedRoot.resolve(relative).normalize();
        if (!resolved.startsWith(normalizedRoot)) {
            throw new BaseTemplateException(
                    "Path traversal detected in " + label + ": '" + relative + "'");
        }
        return resolved;
    }

    /**
     * Normalizes an archive destination to a forward-slash relative entry name.
     * Leading slashes and {@code .} segments are dropped; {@code ..} segments are rejected.
     *
     * @throws BaseTemplateException if the destination is blank or contains a parent reference
     */
    public static String normalizeEntryName(String destination, String label) {
        validateRelative(destination.replace('\\', '/').replaceAll("^/+", ""), label);
        StringBuilder sb = new StringBuilder();
        for (String segment : destination.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                throw new BaseTemplateException(
                        "Path traversal detected in " + label + ": '" + destination + "'");
            }
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(segment);
        }
        if (sb.length() == 0) {
            throw new BaseTemplateException(label + " must name a file: '" + destination + "'");
        }
        return sb.toString();
    }

    private static void validateRelative(String path, String label) {
        if (path == null || path.isBlank()) {
            throw new BaseTemplateException(label + " must not be null or blank");
        }
        if (path.length() > MAX_PATH_LENGTH) {
            throw new BaseTemplateException(
                    label + " exceeds maximum length of " + MAX_PATH_LENGTH +
                            " characters (was " + path.length() + ")");
        }
        if (containsControlCharacters(path)) {
            throw new BaseTemplateException(label + " must not contain control characters");
        }
        if (path.startsWith("/") || path.startsWith("\\") || path.matches("^[A-Za-z]:.*")) {
            throw new BaseTemplateException(label + " must be relative: '" + path + "'");
        }
    }

    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
