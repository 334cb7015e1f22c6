package com.starterkit.generator.archive;

import com.starterkit.generator.TestFixtures;
import com.starterkit.generator.core.model.Feature;
import com.starterkit.generator.document.GeneratedDocument;
import com.starterkit.generator.resolve.ResolvedFeatureSet;
import com.starterkit.generator.template.BaseTemplateException;
import com.starterkit.generator.template.FileSystemBaseTemplate;
import com.starterkit.generator.template.PathFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ArchiveAssembler Tests")
class ArchiveAssemblerTest {

    @TempDir
    Path repo;

    private ArchiveAssembler assembler;

    @BeforeEach
    void setUp() {
        TestFixtures.writeRepository(repo);
        assembler = new ArchiveAssembler(FileSystemBaseTemplate.inRepository(repo), PathFilter.defaults(), 6, 4096);
    }

    private static ResolvedFeatureSet resolved(Feature... features) {
        List<String> slugs = new ArrayList<>();
        for (Feature feature : features) {
            slugs.add(feature.getSlug());
        }
        return new ResolvedFeatureSet(List.of(features), slugs, Map.of(), List.of());
    }

    @Nested
    @DisplayName("Planning")
    class PlanTests {

        @Test
        @DisplayName("Overlays replace base files at the same path")
        void overlayReplacesBase() {
            ArchivePlan plan = assembler.plan("starter-pro", resolved(TestFixtures.authBasic()), List.of());

            ArchivePlan.Entry routes = plan.entries().stream()
                    .filter(e -> e.path().equals("backend/src/routes/auth.routes.ts"))
                    .findFirst().orElseThrow();
            assertEquals(ArchivePlan.Origin.OVERLAY, routes.origin());
            assertTrue(routes.source().endsWith("modules/auth/backend/src/routes/auth.routes.ts"));
            assertEquals(1, plan.entries().stream().filter(e -> e.path().equals(routes.path())).count());
        }

        @Test
        @DisplayName("Directory overlays expand recursively under the destination")
        void directoryOverlay() {
            ArchivePlan plan = assembler.plan("starter-pro", resolved(TestFixtures.stripe()), List.of());

            List<String> overlays = plan.entries().stream()
                    .filter(e -> e.origin() == ArchivePlan.Origin.OVERLAY).map(ArchivePlan.Entry::path).toList();
            assertEquals(List.of(
                    "backend/src/services/payments/stripe.service.ts",
                    "backend/src/services/payments/webhooks/webhook.service.ts"), overlays);
        }

        @Test
        @DisplayName("Generated documents replace any file at the same path")
        void generatedWins() {
            ArchivePlan plan = assembler.plan("starter-pro", ResolvedFeatureSet.empty(),
                    List.of(new GeneratedDocument("README.md", "# Generated\n")));

            List<ArchivePlan.Entry> readmes = plan.entries().stream().filter(e -> e.path().equals("README.md")).toList();
            assertEquals(1, readmes.size());
            assertEquals(ArchivePlan.Origin.GENERATED, readmes.get(0).origin());
            assertEquals(1, plan.count(ArchivePlan.Origin.GENERATED));
        }

        @Test
        @DisplayName("Missing overlay sources fail before anything is written")
        void missingOverlay() {
            Feature broken = Feature.builder().slug("broken").module(TestFixtures.STORAGE)
                    .fileMapping("modules/storage/missing.ts", "backend/src/missing.ts").build();
            ByteArrayOutputStream sink = new ByteArrayOutputStream();

            BaseTemplateException e = assertThrows(BaseTemplateException.class,
                    () -> assembler.assemble("starter-pro", resolved(broken), List.of(), sink, ProgressCallback.NOOP));
            assertTrue(e.getMessage().contains("Overlay source not found for feature broken"));
            assertEquals(0, sink.size());
        }

        @Test
        @DisplayName("Destinations may not escape the project folder")
        void destinationTraversal() {
            Feature evil = Feature.builder().slug("evil").module(TestFixtures.STORAGE)
                    .fileMapping("modules/auth/backend/src/routes/auth.routes.ts", "../outside.ts").build();

            assertThrows(BaseTemplateException.class, () -> assembler.plan("starter-pro", resolved(evil), List.of()));
        }
    }

    @Nested
    @DisplayName("Writing")
    class WriteTests {

        @Test
        @DisplayName("Should write the root folder first and report progress per entry")
        void writesArchive() {
            ByteArrayOutputStream sink = new ByteArrayOutputStream();
            AtomicLong lastWritten = new AtomicLong();
            List<Long> totals = new ArrayList<>();

            ArchiveStats stats = assembler.assemble("starter-pro", resolved(TestFixtures.authBasic()),
                    List.of(new GeneratedDocument("LICENSE.md", "license\n")), sink,
                    (written, total, entry) -> {
                        lastWritten.set(written);
                        totals.add(total);
                    });

            Map<String, String> entries = TestFixtures.unzip(sink.toByteArray());
            List<String> names = new ArrayList<>(entries.keySet());
            assertEquals("starter-pro/", names.get(0));
            assertTrue(names.stream().allMatch(n -> n.startsWith("starter-pro/")));
            assertEquals("// feature auth routes\n", entries.get("starter-pro/backend/src/routes/auth.routes.ts"));
            assertEquals(entries.size(), stats.entries());
            assertEquals(entries.size() - 1, lastWritten.get());
            assertEquals(lastWritten.get(), totals.get(0));
            assertEquals(1, stats.overlayFiles());
            assertEquals(1, stats.generatedFiles());
            assertEquals(sink.size(), stats.bytesWritten());
        }

        @Test
        @DisplayName("Sink failures surface as archive write errors")
        void sinkFailure() {
            OutputStream failing = new OutputStream() {
                @Override
                public void write(int b) throws IOException {
                    throw new IOException("connection reset");
                }
            };

            ArchiveWriteException e = assertThrows(ArchiveWriteException.class,
                    () -> assembler.assemble("starter-pro", ResolvedFeatureSet.empty(), List.of(), failing,
                            ProgressCallback.NOOP));
            assertEquals("starter-pro/", e.getEntryName());
            assertInstanceOf(IOException.class, e.getCause());
        }
    }
}
