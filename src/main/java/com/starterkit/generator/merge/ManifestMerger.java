package com.starterkit.generator.merge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.starterkit.generator.core.JsonSupport;
import com.starterkit.generator.core.model.Feature;
import com.starterkit.generator.core.model.PackageDependency;
import com.starterkit.generator.template.BaseTemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Merges feature package dependencies into the base template's {@code package.json}.
 *
 * <p>Base dependencies are applied first, then each feature's in resolution order.
 * When a package is declared again with a different constraint, the configured
 * {@link VersionConflictStrategy} picks the one to keep and the disagreement is recorded as a
 * {@link VersionConflict}. Fields of the base manifest other than the name, dependency maps and
 * scripts are carried over unchanged and in their original order.</p>
 */
public class ManifestMerger {
    private static final Logger log = LoggerFactory.getLogger(ManifestMerger.class);

    private final VersionConflictStrategy strategy;

    public ManifestMerger() {
        this(VersionConflictStrategy.LAST_WINS);
    }

    public ManifestMerger(VersionConflictStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy is required");
    }

    /**
     * Merges the features' dependencies into the base manifest.
     *
     * @param baseManifest the base {@code package.json} content
     * @param projectName  the name written into the manifest
     * @param features     resolved features, in resolution order
     * @throws BaseTemplateException if the base manifest is not a JSON object
     */
    public ProjectManifest merge(String baseManifest, String projectName, List<Feature> features) {
        return merge(baseManifest, projectName, features, true);
    }

    /**
     * Renames a companion manifest and sorts its dependency maps. No packages or scripts are added.
     *
     * @param baseManifest the companion {@code package.json} content, such as the web app's
     * @param name         the name written into the manifest
     * @throws BaseTemplateException if the manifest is not a JSON object
     */
    public ProjectManifest rename(String baseManifest, String name) {
        return merge(baseManifest, name, List.of(), false);
    }

    private ProjectManifest merge(String baseManifest, String projectName, List<Feature> features,
                                  boolean withDefaultScripts) {
        ObjectNode base = parse(baseManifest);

        Bucket runtime = new Bucket(readStringMap(base, "dependencies"));
        Bucket dev = new Bucket(readStringMap(base, "devDependencies"));

        for (Feature feature : features) {
            for (PackageDependency dependency : feature.getPackageDependencies()) {
                Bucket bucket = dependency.dev() ? dev : runtime;
                bucket.declare(dependency.name(), dependency.version(), strategy);
            }
        }

        Map<String, String> scripts = withDefaultScripts
                ? ScriptDefaults.applyTo(readStringMap(base, "scripts"))
                : readStringMap(base, "scripts");

        List<VersionConflict> conflicts = new ArrayList<>(runtime.conflicts(false));
        conflicts.addAll(dev.conflicts(true));
        for (VersionConflict conflict : conflicts) {
            log.warn("manifest.versionConflict package={} selected={} alternatives={} dev={} strategy={}",
                    conflict.packageName(), conflict.selected(), conflict.alternatives(),
                    conflict.dev(), strategy);
        }

        ObjectNode output = render(base, projectName, runtime.selected, dev.selected, scripts);
        log.debug("manifest.merged dependencies={} devDependencies={} conflicts={}",
                runtime.selected.size(), dev.selected.size(), conflicts.size());

        return new ProjectManifest(projectName, runtime.selected, dev.selected, scripts, conflicts,
                runtime.added(), dev.added(), JsonSupport.toPrettyJson(output));
    }

    private static ObjectNode parse(String baseManifest) {
        try {
            JsonNode node = baseManifest == null ? null : JsonSupport.mapper().readTree(baseManifest);
            if (node instanceof ObjectNode object) {
                return object;
            }
            throw new BaseTemplateException("Could not read base package.json: not a JSON object");
        } catch (JsonProcessingException e) {
            throw new BaseTemplateException("Could not read base package.json: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, String> readStringMap(ObjectNode base, String field) {
        Map<String, String> values = new LinkedHashMap<>();
        JsonNode node = base.get(field);
        if (node != null && node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                values.put(entry.getKey(), entry.getValue().asText());
            }
        }
        return values;
    }

    private static ObjectNode render(ObjectNode base, String projectName, Map<String, String> dependencies,
                                     Map<String, String> devDependencies, Map<String, String> scripts) {
        ObjectNode output = JsonSupport.mapper().createObjectNode();
        if (!base.has("name")) {
            output.put("name", projectName);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = base.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            switch (entry.getKey()) {
                case "name" -> output.put("name", projectName);
                case "scripts" -> output.set("scripts", toObject(scripts));
                case "dependencies" -> output.set("dependencies", toObject(dependencies));
                case "devDependencies" -> output.set("devDependencies", toObject(devDependencies));
                default -> output.set(entry.getKey(), entry.getValue());
            }
        }
        if (!output.has("scripts") && !scripts.isEmpty()) {
            output.set("scripts", toObject(scripts));
        }
        if (!output.has("dependencies")) {
            output.set("dependencies", toObject(dependencies));
        }
        if (!output.has("devDependencies") && !devDependencies.isEmpty()) {
            output.set("devDependencies", toObject(devDependencies));
        }
        return output;
    }

    private static ObjectNode toObject(Map<String, String> values) {
        ObjectNode node = JsonSupport.mapper().createObjectNode();
        values.forEach(node::put);
        return node;
    }

    /**
     * Dependencies of one kind, with every constraint seen per package.
     */
    private static final class Bucket {
        private final Set<String> baseNames;
        private final TreeMap<String, String> selected = new TreeMap<>();
        private final Map<String, Set<String>> declared = new LinkedHashMap<>();

        Bucket(Map<String, String> base) {
            this.baseNames = new LinkedHashSet<>(base.keySet());
            base.forEach((name, version) -> {
                selected.put(name, version);
                declared.computeIfAbsent(name, k -> new LinkedHashSet<>()).add(version);
            });
        }

        void declare(String name, String version, VersionConflictStrategy strategy) {
            declared.computeIfAbsent(name, k -> new LinkedHashSet<>()).add(version);
            String current = selected.get(name);
            if (current == null) {
                selected.put(name, version);
            } else if (!current.equals(version)) {
                selected.put(name, strategy.choose(current, version));
            }
        }

        List<VersionConflict> conflicts(boolean dev) {
            List<VersionConflict> conflicts = new ArrayList<>();
            for (Map.Entry<String, String> entry : selected.entrySet()) {
                Set<String> versions = declared.get(entry.getKey());
                if (versions.size() > 1) {
                    List<String> alternatives = new ArrayList<>(versions);
                    alternatives.remove(entry.getValue());
                    conflicts.add(new VersionConflict(entry.getKey(), entry.getValue(), alternatives, dev));
                }
            }
            return conflicts;
        }

        List<String> added() {
            List<String> added = new ArrayList<>();
            for (String name : selected.keySet()) {
                if (!baseNames.contains(name)) {
                    added.add(name);
                }
            }
            return added;
        }
    }
}
