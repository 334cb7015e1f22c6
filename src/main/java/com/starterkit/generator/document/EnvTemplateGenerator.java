package com.starterkit.generator.document;

import com.starterkit.generator.merge.MergedEnvVar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders the merged environment specification as a {@code .env.example} file:
 * core variables grouped under their headings, then one block per contributing feature.
 */
public class EnvTemplateGenerator implements DocumentGenerator {

    public static final String DEFAULT_PATH = "backend/.env.example";
    private static final String RULE = "# ======================";

    private final String path;

    public EnvTemplateGenerator() {
        this(DEFAULT_PATH);
    }

    public EnvTemplateGenerator(String path) {
        this.path = Objects.requireNonNull(path, "path is required");
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public GeneratedDocument generate(DocumentContext context) {
        List<String> lines = new ArrayList<>();
        lines.add("# Environment Variables");
        lines.add("# Generated by " + context.productName());
        lines.add("");
        lines.add(RULE);
        lines.add("# Core Configuration");
        lines.add(RULE);
        lines.add("");

        String heading = null;
        for (MergedEnvVar variable : context.merged().env().baseVariables()) {
            if (!variable.description().equals(heading)) {
                if (heading != null) {
                    lines.add("");
                }
                heading = variable.description();
                if (!heading.isBlank()) {
                    lines.add("# " + heading);
                }
            }
            lines.add(assignment(variable));
        }
        if (heading != null) {
            lines.add("");
        }

        Map<String, List<MergedEnvVar>> byFeature = new LinkedHashMap<>();
        for (MergedEnvVar variable : context.merged().env().featureVariables()) {
            byFeature.computeIfAbsent(variable.owningFeature(), k -> new ArrayList<>()).add(variable);
        }
        if (!byFeature.isEmpty()) {
            lines.add(RULE);
            lines.add("# Feature Configuration");
            lines.add(RULE);
            lines.add("");
            byFeature.forEach((feature, variables) -> {
                lines.add("# " + feature);
                for (MergedEnvVar variable : variables) {
                    String comment = variable.description() + (variable.required() ? " (required)" : "");
                    if (!comment.isBlank()) {
                        lines.add("# " + comment.strip());
                    }
                    lines.add(assignment(variable));
                }
                lines.add("");
            });
        }

        return new GeneratedDocument(path, String.join("\n", lines));
    }

    private static String assignment(MergedEnvVar variable) {
        return variable.key() + "=" + (variable.defaultValue() != null ? variable.defaultValue() : "");
    }
}
