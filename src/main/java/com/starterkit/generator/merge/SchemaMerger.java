package com.starterkit.generator.merge;

import com.starterkit.generator.core.model.Feature;
import com.starterkit.generator.core.model.SchemaMapping;
import com.starterkit.generator.template.BaseTemplate;
import com.starterkit.generator.template.BaseTemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Merges feature schema fragments into the base template's Prisma schema.
 *
 * <p>The base schema's {@code generator} and {@code datasource} blocks form the preamble and
 * appear once. Models and enums from the base come first, followed by those of each feature's
 * fragments in resolution order. The first declaration of a name wins; models and enums are
 * tracked separately. Fragments that are missing or malformed are skipped with a warning.</p>
 */
public class SchemaMerger {
    private static final Logger log = LoggerFactory.getLogger(SchemaMerger.class);

    static final String SECTION_RULE = "// ==========================================";

    private final BaseTemplate template;

    public SchemaMerger(BaseTemplate template) {
        this.template = Objects.requireNonNull(template, "template is required");
    }

    /**
     * Merges the base schema with the fragments referenced by the features' schema mappings.
     *
     * @param baseSchema the base schema text
     * @param features   resolved features, in resolution order
     * @throws BaseTemplateException if the base schema cannot be parsed
     */
    public MergedSchema merge(String baseSchema, List<Feature> features) {
        List<SchemaBlock> baseBlocks;
        try {
            baseBlocks = SchemaParser.parse(baseSchema);
        } catch (IllegalArgumentException e) {
            throw new BaseTemplateException("Could not parse base schema: " + e.getMessage(), e);
        }

        Accumulator acc = new Accumulator();
        for (SchemaBlock block : baseBlocks) {
            acc.add(block, true, "base");
        }

        // Several mappings may point at the same fragment file
        Set<String> readSources = new HashSet<>();
        for (Feature feature : features) {
            for (SchemaMapping mapping : feature.getSchemaMappings()) {
                if (!readSources.add(mapping.source())) {
                    continue;
                }
                for (SchemaBlock block : readFragment(feature, mapping, acc)) {
                    acc.add(block, false, feature.getSlug());
                }
            }
        }

        log.debug("schema.merged models={} enums={} skipped={} duplicates={}",
                acc.models.size(), acc.enums.size(), acc.skipped.size(), acc.duplicates.size());

        return new MergedSchema(render(acc), new ArrayList<>(acc.models.keySet()),
                new ArrayList<>(acc.enums.keySet()), acc.skipped, acc.duplicates);
    }

    private List<SchemaBlock> readFragment(Feature feature, SchemaMapping mapping, Accumulator acc) {
        Optional<String> content = template.readSource(mapping.source());
        if (content.isEmpty()) {
            log.warn("schema.fragmentMissing feature={} model={} source={}",
                    feature.getSlug(), mapping.model(), mapping.source());
            acc.skipped.add(mapping.source());
            return List.of();
        }
        try {
            return SchemaParser.parse(content.get());
        } catch (IllegalArgumentException e) {
            log.warn("schema.fragmentInvalid feature={} source={} reason={}",
                    feature.getSlug(), mapping.source(), e.getMessage());
            acc.skipped.add(mapping.source());
            return List.of();
        }
    }

    private static String render(Accumulator acc) {
        StringBuilder sb = new StringBuilder();
        appendBlocks(sb, acc.preamble.values());
        sb.append("\n\n");
        appendSection(sb, "MODELS");
        List<SchemaBlock> modelSection = new ArrayList<>(acc.models.values());
        // Views and composite types share the model section
        modelSection.addAll(acc.otherTypes.values());
        appendBlocks(sb, modelSection);
        sb.append("\n\n");
        appendSection(sb, "ENUMS");
        appendBlocks(sb, acc.enums.values());
        return sb.toString().stripTrailing() + "\n";
    }

    private static void appendSection(StringBuilder sb, String title) {
        sb.append(SECTION_RULE).append('\n')
                .append("// ").append(title).append('\n')
                .append(SECTION_RULE).append("\n\n");
    }

    private static void appendBlocks(StringBuilder sb, Collection<SchemaBlock> blocks) {
        sb.append(blocks.stream().map(SchemaBlock::text).collect(Collectors.joining("\n\n")));
    }

    /**
     * First-wins collection of blocks by kind and name.
     */
    private static final class Accumulator {
        final Map<String, SchemaBlock> preamble = new LinkedHashMap<>();
        final Map<String, SchemaBlock> models = new LinkedHashMap<>();
        final Map<String, SchemaBlock> enums = new LinkedHashMap<>();
        final Map<String, SchemaBlock> otherTypes = new LinkedHashMap<>();
        final List<String> skipped = new ArrayList<>();
        final List<String> duplicates = new ArrayList<>();

        void add(SchemaBlock block, boolean fromBase, String origin) {
            if (block.isPreamble()) {
                if (fromBase) {
                    putFirst(preamble, block.kind().keyword() + " " + block.name(), block, origin);
                }
                return;
            }
            switch (block.kind()) {
                case ENUM -> putFirst(enums, block.name(), block, origin);
                case MODEL -> putFirst(models, block.name(), block, origin);
                default -> putFirst(otherTypes, block.kind().keyword() + " " + block.name(), block, origin);
            }
        }

        private void putFirst(Map<String, SchemaBlock> target, String key, SchemaBlock block, String origin) {
            if (target.containsKey(key)) {
                duplicates.add(block.kind().keyword() + " " + block.name());
                log.debug("schema.duplicateDropped block={} {} origin={}",
                        block.kind().keyword(), block.name(), origin);
                return;
            }
            target.put(key, block);
        }
    }
}
