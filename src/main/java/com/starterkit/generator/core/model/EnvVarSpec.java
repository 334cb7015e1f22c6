package com.starterkit.generator.core.model;

import java.util.Objects;

/**
 * Environment variable declared by a feature or by the base template.
 *
 * @param key          variable name
 * @param description  human description rendered as a comment
 * @param required     whether the generated project needs a value to start
 * @param defaultValue default value, or null when none is supplied
 */
public record EnvVarSpec(String key, String description, boolean required, String defaultValue) {

    public EnvVarSpec {
        Objects.requireNonNull(key, "key is required");
        description = description != null ? description : "";
    }

    public static EnvVarSpec required(String key, String description) {
        return new EnvVarSpec(key, description, true, null);
    }

    public static EnvVarSpec optional(String key, String description, String defaultValue) {
        return new EnvVarSpec(key, description, false, defaultValue);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
