package com.starterkit.generator.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Independently purchasable capability. Contributes file overlays, schema fragments,
 * environment variables and package dependencies to a generated project.
 * Catalog-owned and immutable; the generator never modifies a feature.
 */
public final class Feature {
    private final String slug;
    private final String name;
    private final String description;
    private final Module module;
    private final boolean active;
    private final List<String> requires;
    private final List<FileMapping> fileMappings;
    private final List<SchemaMapping> schemaMappings;
    private final List<EnvVarSpec> envVars;
    private final List<PackageDependency> packageDependencies;

    private Feature(Builder builder) {
        this.slug = builder.slug;
        this.name = builder.name != null ? builder.name : builder.slug;
        this.description = builder.description != null ? builder.description : "";
        this.module = builder.module;
        this.active = builder.active;
        this.requires = List.copyOf(builder.requires);
        this.fileMappings = List.copyOf(builder.fileMappings);
        this.schemaMappings = List.copyOf(builder.schemaMappings);
        this.envVars = List.copyOf(builder.envVars);
        this.packageDependencies = List.copyOf(builder.packageDependencies);
    }

    public String getSlug() {
        return slug;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Module getModule() {
        return module;
    }

    public boolean isActive() {
        return active;
    }

    public List<String> getRequires() {
        return requires;
    }

    public List<FileMapping> getFileMappings() {
        return fileMappings;
    }

    public List<SchemaMapping> getSchemaMappings() {
        return schemaMappings;
    }

    public List<EnvVarSpec> getEnvVars() {
        return envVars;
    }

    public List<PackageDependency> getPackageDependencies() {
        return packageDependencies;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Feature feature = (Feature) o;
        return Objects.equals(slug, feature.slug);
    }

    @Override
    public int hashCode() {
        return Objects.hash(slug);
    }

    @Override
    public String toString() {
        return "Feature{" +
                "slug='" + slug + '\'' +
                ", module=" + module.slug() +
                ", active=" + active +
                ", requires=" + requires +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String slug;
        private String name;
        private String description;
        private Module module;
        private boolean active = true;
        private final List<String> requires = new ArrayList<>();
        private final List<FileMapping> fileMappings = new ArrayList<>();
        private final List<SchemaMapping> schemaMappings = new ArrayList<>();
        private final List<EnvVarSpec> envVars = new ArrayList<>();
        private final List<PackageDependency> packageDependencies = new ArrayList<>();

        public Builder slug(String slug) {
            this.slug = slug;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder module(Module module) {
            this.module = module;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder requires(String... slugs) {
            return requires(List.of(slugs));
        }

        public Builder requires(List<String> slugs) {
            if (slugs != null) {
                this.requires.addAll(slugs);
            }
            return this;
        }

        public Builder fileMapping(String source, String destination) {
            this.fileMappings.add(new FileMapping(source, destination));
            return this;
        }

        public Builder fileMappings(List<FileMapping> mappings) {
            if (mappings != null) {
                this.fileMappings.addAll(mappings);
            }
            return this;
        }

        public Builder schemaMapping(String model, String source) {
            this.schemaMappings.add(new SchemaMapping(model, source));
            return this;
        }

        public Builder schemaMappings(List<SchemaMapping> mappings) {
            if (mappings != null) {
                this.schemaMappings.addAll(mappings);
            }
            return this;
        }

        public Builder envVar(EnvVarSpec envVar) {
            this.envVars.add(envVar);
            return this;
        }

        public Builder envVars(List<EnvVarSpec> envVars) {
            if (envVars != null) {
                this.envVars.addAll(envVars);
            }
            return this;
        }

        public Builder packageDependency(PackageDependency dependency) {
            this.packageDependencies.add(dependency);
            return this;
        }

        public Builder packageDependencies(List<PackageDependency> dependencies) {
            if (dependencies != null) {
                this.packageDependencies.addAll(dependencies);
            }
            return this;
        }

        public Feature build() {
            Objects.requireNonNull(slug, "slug is required");
            Objects.requireNonNull(module, "module is required");
            return new Feature(this);
        }
    }
}
