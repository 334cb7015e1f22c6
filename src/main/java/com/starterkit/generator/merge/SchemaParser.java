package com.starterkit.generator.merge;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits Prisma schema text into its top-level blocks.
 * Documentation comments ({@code ///}) directly above a block header belong to that block;
 * any other text between blocks is not retained.
 */
public final class SchemaParser {

    private static final Pattern BLOCK_HEADER = Pattern.compile(
            "^\\s*(generator|datasource|model|view|type|enum)\\s+(\\w+)\\s*\\{");

    private static final String DOC_COMMENT = "///";

    private SchemaParser() {
        // utility class
    }

    /**
     * Parses the schema into blocks, in source order.
     *
     * @throws IllegalArgumentException if a block is not closed before the end of the text
     */
    public static List<SchemaBlock> parse(String schema) {
        List<SchemaBlock> blocks = new ArrayList<>();
        if (schema == null || schema.isBlank()) {
            return blocks;
        }

        String[] lines = schema.split("\\r?\\n", -1);
        List<String> docComment = new ArrayList<>();
        int i = 0;
        while (i < lines.length) {
            Matcher header = BLOCK_HEADER.matcher(lines[i]);
            if (!header.find()) {
                if (lines[i].strip().startsWith(DOC_COMMENT)) {
                    docComment.add(lines[i].strip());
                } else {
                    docComment.clear();
                }
                i++;
                continue;
            }
            SchemaBlock.Kind kind = SchemaBlock.Kind.fromKeyword(header.group(1));
            String name = header.group(2);

            StringBuilder text = new StringBuilder();
            for (String comment : docComment) {
                text.append(comment).append('\n');
            }
            docComment.clear();
            int depth = 0;
            int start = i;
            do {
                if (i >= lines.length) {
                    throw new IllegalArgumentException(
                            "Unterminated " + kind.keyword() + " block '" + name + "' starting at line " + (start + 1));
                }
                if (i > start) {
                    text.append('\n');
                }
                text.append(stripTrailing(lines[i]));
                depth += braceDelta(lines[i]);
                i++;
            } while (depth > 0);

            blocks.add(new SchemaBlock(kind, name, text.toString().strip()));
        }
        return blocks;
    }

    // Braces inside string literals and line comments do not count
    private static int braceDelta(String line) {
        int delta = 0;
        boolean inString = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
            } else if (c == '"') {
                inString = true;
            } else if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                break;
            } else if (c == '{') {
                delta++;
            } else if (c == '}') {
                delta--;
            }
        }
        return delta;
    }

    private static String stripTrailing(String line) {
        return line.stripTrailing();
    }
}
