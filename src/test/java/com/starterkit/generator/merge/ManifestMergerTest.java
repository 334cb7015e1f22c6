package com.starterkit.generator.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.starterkit.generator.TestFixtures;
import com.starterkit.generator.core.JsonSupport;
import com.starterkit.generator.core.model.Feature;
import com.starterkit.generator.core.model.PackageDependency;
import com.starterkit.generator.template.BaseTemplateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ManifestMerger Tests")
class ManifestMergerTest {

    private static Feature withPackages(String slug, PackageDependency... dependencies) {
        return Feature.builder().slug(slug).module(TestFixtures.PAYMENTS)
                .packageDependencies(List.of(dependencies)).build();
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        Iterator<String> it = node.fieldNames();
        it.forEachRemaining(names::add);
        return names;
    }

    @Nested
    @DisplayName("Dependencies")
    class DependencyTests {

        @Test
        @DisplayName("Should union base and feature dependencies in sorted order")
        void sortedUnion() throws Exception {
            ProjectManifest manifest = new ManifestMerger().merge(TestFixtures.BASE_MANIFEST, "starter-pro",
                    List.of(TestFixtures.s3Upload(), TestFixtures.authBasic()));

            assertEquals(List.of("@aws-sdk/client-s3", "bcryptjs", "express", "zod"),
                    new ArrayList<>(manifest.dependencies().keySet()));
            assertEquals(List.of("@types/multer", "typescript"), new ArrayList<>(manifest.devDependencies().keySet()));
            assertEquals(List.of("@aws-sdk/client-s3", "bcryptjs"), manifest.addedDependencies());
            assertEquals(List.of("@types/multer"), manifest.addedDevDependencies());

            JsonNode json = JsonSupport.mapper().readTree(manifest.content());
            assertEquals(List.of("@aws-sdk/client-s3", "bcryptjs", "express", "zod"),
                    fieldNames(json.get("dependencies")));
        }

        @Test
        @DisplayName("Last declaration wins by default and the conflict is reported")
        void lastWinsWithConflict() {
            ProjectManifest manifest = new ManifestMerger().merge(TestFixtures.BASE_MANIFEST, "starter-pro",
                    List.of(withPackages("a", PackageDependency.runtime("zod", "^3.20.0")),
                            withPackages("b", PackageDependency.runtime("zod", "^3.21.0"))));

            assertEquals("^3.21.0", manifest.dependencies().get("zod"));
            assertEquals(1, manifest.conflicts().size());
            VersionConflict conflict = manifest.conflicts().get(0);
            assertEquals("zod", conflict.packageName());
            assertEquals("^3.21.0", conflict.selected());
            assertEquals(List.of("^3.22.0", "^3.20.0"), conflict.alternatives());
            assertFalse(conflict.dev());
        }

        @Test
        @DisplayName("HIGHEST_VERSION keeps the higher constraint")
        void highestVersion() {
            ProjectManifest manifest = new ManifestMerger(VersionConflictStrategy.HIGHEST_VERSION)
                    .merge(TestFixtures.BASE_MANIFEST, "starter-pro",
                            List.of(withPackages("a", PackageDependency.runtime("express", "^4.17.1")),
                                    withPackages("b", PackageDependency.runtime("express", "^5.0.0"))));

            assertEquals("^5.0.0", manifest.dependencies().get("express"));
            assertTrue(manifest.hasConflicts());
        }

        @Test
        @DisplayName("FIRST_WINS keeps the base constraint")
        void firstWins() {
            ProjectManifest manifest = new ManifestMerger(VersionConflictStrategy.FIRST_WINS)
                    .merge(TestFixtures.BASE_MANIFEST, "starter-pro",
                            List.of(withPackages("a", PackageDependency.runtime("express", "^5.0.0"))));

            assertEquals("^4.18.0", manifest.dependencies().get("express"));
        }

        @Test
        @DisplayName("Identical constraints are not conflicts")
        void identicalNotConflict() {
            ProjectManifest manifest = new ManifestMerger().merge(TestFixtures.BASE_MANIFEST, "starter-pro",
                    List.of(withPackages("a", PackageDependency.runtime("express", "^4.18.0"))));

            assertFalse(manifest.hasConflicts());
        }

        @Test
        @DisplayName("Dev conflicts are flagged as dev")
        void devConflict() {
            ProjectManifest manifest = new ManifestMerger().merge(TestFixtures.BASE_MANIFEST, "starter-pro",
                    List.of(withPackages("a", PackageDependency.dev("typescript", "^5.4.0"))));

            assertEquals("^5.4.0", manifest.devDependencies().get("typescript"));
            assertTrue(manifest.conflicts().get(0).dev());
        }
    }

    @Nested
    @DisplayName("Document shape")
    class ShapeTests {

        @Test
        @DisplayName("Should set the name and keep other base fields in order")
        void preservesBaseFields() throws Exception {
            ProjectManifest manifest = new ManifestMerger().merge(TestFixtures.BASE_MANIFEST, "starter-pro", List.of());

            JsonNode json = JsonSupport.mapper().readTree(manifest.content());
            assertEquals("starter-pro", json.get("name").asText());
            assertEquals("1.0.0", json.get("version").asText());
            assertTrue(json.get("private").asBoolean());
            assertEquals(List.of("name", "version", "private", "scripts", "dependencies", "devDependencies"),
                    fieldNames(json));
        }

        @Test
        @DisplayName("Should add default scripts without overriding base scripts")
        void scriptDefaults() {
            ProjectManifest manifest = new ManifestMerger().merge(TestFixtures.BASE_MANIFEST, "starter-pro", List.of());

            assertEquals("nodemon src/app.ts", manifest.scripts().get("dev"));
            assertEquals("vitest", manifest.scripts().get("test"));
            assertEquals("tsc", manifest.scripts().get("build"));
            assertEquals("prisma migrate dev", manifest.scripts().get("db:migrate"));
            assertEquals(List.of("dev", "test"), new ArrayList<>(manifest.scripts().keySet()).subList(0, 2));
        }

        @Test
        @DisplayName("Should use two-space indentation and end with a newline")
        void formatting() {
            ProjectManifest manifest = new ManifestMerger().merge(TestFixtures.BASE_MANIFEST, "starter-pro", List.of());

            assertTrue(manifest.content().startsWith("{\n  \"name\": \"starter-pro\","));
            assertTrue(manifest.content().endsWith("}\n"));
        }

        @Test
        @DisplayName("Merging the same inputs twice gives identical output")
        void idempotent() {
            List<Feature> features = List.of(TestFixtures.stripe(), TestFixtures.s3Upload());
            ManifestMerger merger = new ManifestMerger();

            assertEquals(merger.merge(TestFixtures.BASE_MANIFEST, "p", features).content(),
                    merger.merge(TestFixtures.BASE_MANIFEST, "p", features).content());
        }
    }

    @Nested
    @DisplayName("Companion manifests")
    class RenameTests {

        @Test
        @DisplayName("Should rename and sort without adding packages or scripts")
        void renameOnly() throws Exception {
            ProjectManifest web = new ManifestMerger().rename(TestFixtures.WEB_MANIFEST, "starter-pro-web");

            JsonNode json = JsonSupport.mapper().readTree(web.content());
            assertEquals("starter-pro-web", json.get("name").asText());
            assertEquals(List.of("next", "react"), fieldNames(json.get("dependencies")));
            assertEquals(List.of("dev"), fieldNames(json.get("scripts")));
            assertFalse(json.has("devDependencies"));
            assertTrue(web.conflicts().isEmpty());
            assertTrue(web.content().endsWith("}\n"));
        }

        @Test
        @DisplayName("A manifest without scripts gets none")
        void noScriptsAdded() throws Exception {
            ProjectManifest web = new ManifestMerger().rename("{\"name\": \"w\"}", "p-web");

            JsonNode json = JsonSupport.mapper().readTree(web.content());
            assertFalse(json.has("scripts"));
            assertEquals("p-web", json.get("name").asText());
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("Malformed base manifest is a template error")
        void malformed() {
            BaseTemplateException e = assertThrows(BaseTemplateException.class,
                    () -> new ManifestMerger().merge("{ not json", "p", List.of()));
            assertTrue(e.getMessage().startsWith("Could not read base package.json"));
        }

        @Test
        @DisplayName("Non-object base manifest is a template error")
        void notAnObject() {
            assertThrows(BaseTemplateException.class, () -> new ManifestMerger().merge("[1, 2]", "p", List.of()));
        }
    }
}
