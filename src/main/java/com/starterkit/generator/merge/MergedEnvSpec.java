package com.starterkit.generator.merge;

import java.util.List;
import java.util.Optional;

/**
 * The merged environment variable specification, base variables first.
 */
public record MergedEnvSpec(List<MergedEnvVar> variables) {

    public MergedEnvSpec {
        variables = variables != null ? List.copyOf(variables) : List.of();
    }

    public Optional<MergedEnvVar> get(String key) {
        return variables.stream().filter(v -> v.key().equals(key)).findFirst();
    }

    public List<String> keys() {
        return variables.stream().map(MergedEnvVar::key).toList();
    }

    public List<String> requiredKeys() {
        return variables.stream().filter(MergedEnvVar::required).map(MergedEnvVar::key).toList();
    }

    public List<MergedEnvVar> baseVariables() {
        return variables.stream().filter(MergedEnvVar::fromBase).toList();
    }

    public List<MergedEnvVar> featureVariables() {
        return variables.stream().filter(v -> !v.fromBase()).toList();
    }
}
