package com.starterkit.generator.merge;

import java.util.ArrayList;
import java.util.List;

/**
 * The merged database schema.
 *
 * @param text              the full schema text, ending with a newline
 * @param models            model names, in output order
 * @param enums             enum names, in output order
 * @param skippedFragments  fragment sources that could not be read or parsed
 * @param duplicateBlocks   blocks dropped because an earlier declaration of the same name won
 */
public record MergedSchema(
        String text,
        List<String> models,
        List<String> enums,
        List<String> skippedFragments,
        List<String> duplicateBlocks
) {
    public MergedSchema {
        models = models != null ? List.copyOf(models) : List.of();
        enums = enums != null ? List.copyOf(enums) : List.of();
        skippedFragments = skippedFragments != null ? List.copyOf(skippedFragments) : List.of();
        duplicateBlocks = duplicateBlocks != null ? List.copyOf(duplicateBlocks) : List.of();
    }

    /**
     * Returns the required model names that the merged schema does not declare.
     */
    public List<String> validateCompleteness(List<String> requiredModels) {
        List<String> missing = new ArrayList<>();
        if (requiredModels == null) {
            return missing;
        }
        for (String model : requiredModels) {
            if (!models.contains(model) && !missing.contains(model)) {
                missing.add(model);
            }
        }
        return missing;
    }
}
