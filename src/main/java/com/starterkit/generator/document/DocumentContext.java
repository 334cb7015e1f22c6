package com.starterkit.generator.document;

import com.starterkit.generator.core.model.Order;
import com.starterkit.generator.merge.MergedArtifacts;
import com.starterkit.generator.resolve.ResolvedFeatureSet;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Inputs shared by all document generators for one generation.
 *
 * @param order       the order being fulfilled
 * @param resolved    the resolved feature set
 * @param merged      the merged manifest, schema and environment
 * @param projectName the project root folder name
 * @param productName the product name printed in headers and footers
 * @param generatedAt generation timestamp, taken once per generation
 */
public record DocumentContext(
        Order order,
        ResolvedFeatureSet resolved,
        MergedArtifacts merged,
        String projectName,
        String productName,
        Instant generatedAt
) {
    public DocumentContext {
        Objects.requireNonNull(order, "order is required");
        Objects.requireNonNull(resolved, "resolved is required");
        Objects.requireNonNull(merged, "merged is required");
        Objects.requireNonNull(projectName, "projectName is required");
        Objects.requireNonNull(productName, "productName is required");
        Objects.requireNonNull(generatedAt, "generatedAt is required");
    }

    /**
     * Tier with its first letter upper-cased, e.g. {@code Pro}.
     */
    public String tierDisplayName() {
        return capitalize(order.getTier());
    }

    /**
     * Generation date as ISO {@code yyyy-MM-dd} in UTC.
     */
    public String issueDate() {
        return DateTimeFormatter.ISO_LOCAL_DATE.format(generatedAt.atOffset(ZoneOffset.UTC));
    }

    static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }
}
