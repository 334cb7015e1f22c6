package com.starterkit.generator.merge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scripts every generated backend manifest carries. Added only when the base manifest
 * does not already define a script with the same name.
 */
public final class ScriptDefaults {

    public static final Map<String, String> DEFAULTS;

    static {
        Map<String, String> scripts = new LinkedHashMap<>();
        scripts.put("dev", "tsx watch src/app.ts");
        scripts.put("build", "tsc");
        scripts.put("start", "node dist/app.js");
        scripts.put("lint", "eslint src");
        scripts.put("db:migrate", "prisma migrate dev");
        scripts.put("db:push", "prisma db push");
        scripts.put("db:generate", "prisma generate");
        scripts.put("db:seed", "tsx prisma/seed.ts");
        DEFAULTS = Collections.unmodifiableMap(scripts);
    }

    private ScriptDefaults() {
        // utility class
    }

    /**
     * Returns the base scripts in their original order followed by any missing defaults.
     */
    public static Map<String, String> applyTo(Map<String, String> baseScripts) {
        Map<String, String> merged = new LinkedHashMap<>(baseScripts);
        DEFAULTS.forEach(merged::putIfAbsent);
        return merged;
    }
}
