package com.starterkit.generator.archive;

import com.starterkit.generator.core.model.Feature;
import com.starterkit.generator.core.model.FileMapping;
import com.starterkit.generator.document.GeneratedDocument;
import com.starterkit.generator.resolve.ResolvedFeatureSet;
import com.starterkit.generator.template.BaseTemplate;
import com.starterkit.generator.template.BaseTemplateException;
import com.starterkit.generator.template.PathFilter;
import com.starterkit.generator.template.PathSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assembles the project archive from the base template, feature overlays and generated documents.
 *
 * <p>Assembly runs in two phases. {@link #plan} walks the template, resolves every overlay and
 * validates every path; any problem there is a {@link BaseTemplateException} and nothing has been
 * written. {@link #write} then streams the planned entries. Layering is base, then overlays in
 * resolution order, then generated documents; a later layer replaces an earlier one at the same
 * path, so each path is written once.</p>
 */
public class ArchiveAssembler {
    private static final Logger log = LoggerFactory.getLogger(ArchiveAssembler.class);

    private final BaseTemplate template;
    private final PathFilter filter;
    private final int compressionLevel;
    private final int bufferSize;

    public ArchiveAssembler(BaseTemplate template, PathFilter filter, int compressionLevel, int bufferSize) {
        this.template = Objects.requireNonNull(template, "template is required");
        this.filter = Objects.requireNonNull(filter, "filter is required");
        this.compressionLevel = compressionLevel;
        this.bufferSize = bufferSize;
    }

    /**
     * Plans and writes the archive.
     *
     * @throws BaseTemplateException if planning fails; the sink is untouched
     * @throws ArchiveWriteException if writing fails; the sink holds an incomplete archive
     */
    public ArchiveStats assemble(String rootFolder, ResolvedFeatureSet resolved, List<GeneratedDocument> documents,
                                 OutputStream sink, ProgressCallback progress) {
        return write(plan(rootFolder, resolved, documents), sink, progress);
    }

    /**
     * Computes the entries of the archive without writing anything.
     *
     * @throws BaseTemplateException if the template cannot be walked, an overlay source does not exist,
     *                               or a path escapes its root
     */
    public ArchivePlan plan(String rootFolder, ResolvedFeatureSet resolved, List<GeneratedDocument> documents) {
        Map<String, ArchivePlan.Entry> entries = new LinkedHashMap<>();

        template.listFiles(template.getRoot(), filter)
                .forEach((path, source) -> entries.put(path, ArchivePlan.Entry.file(path, ArchivePlan.Origin.BASE, source)));
        int baseCount = entries.size();

        int overridden = 0;
        for (Feature feature : resolved.features()) {
            for (FileMapping mapping : feature.getFileMappings()) {
                for (Map.Entry<String, Path> file : resolveOverlay(feature, mapping).entrySet()) {
                    ArchivePlan.Entry previous = entries.put(file.getKey(),
                            ArchivePlan.Entry.file(file.getKey(), ArchivePlan.Origin.OVERLAY, file.getValue()));
                    if (previous != null) {
                        overridden++;
                        log.debug("archive.overlayReplaces path={} previous={} feature={}",
                                file.getKey(), previous.origin(), feature.getSlug());
                    }
                }
            }
        }

        for (GeneratedDocument document : documents) {
            String path = PathSanitizer.normalizeEntryName(document.path(), "generated document path");
            entries.put(path, ArchivePlan.Entry.generated(path, document.bytes()));
        }

        ArchivePlan plan = new ArchivePlan(rootFolder, new ArrayList<>(entries.values()));
        log.debug("archive.planned root={} base={} overlays={} generated={} overridden={}",
                rootFolder, baseCount, plan.count(ArchivePlan.Origin.OVERLAY),
                plan.count(ArchivePlan.Origin.GENERATED), overridden);
        return plan;
    }

    /**
     * Streams a planned archive into the sink. The sink is flushed but not closed.
     *
     * @throws ArchiveWriteException if a source file cannot be read or the sink rejects a write
     */
    public ArchiveStats write(ArchivePlan plan, OutputStream sink, ProgressCallback progress) {
        String current = null;
        long total = plan.entries().size();
        long written = 0;
        try (ZipArchiveWriter writer = new ZipArchiveWriter(sink, compressionLevel, bufferSize)) {
            current = plan.rootFolder() + "/";
            writer.addDirectory(current);
            for (ArchivePlan.Entry entry : plan.entries()) {
                current = plan.rootFolder() + "/" + entry.path();
                if (entry.source() != null) {
                    writer.addFile(current, entry.source());
                } else {
                    writer.addBytes(current, entry.content());
                }
                progress.onProgress(++written, total, current);
            }
            current = null;
            writer.finish();

            ArchiveStats stats = new ArchiveStats(plan.rootFolder(), writer.getEntryCount(),
                    writer.getBytesWritten(), writer.getUncompressedBytes(),
                    plan.count(ArchivePlan.Origin.BASE), plan.count(ArchivePlan.Origin.OVERLAY),
                    plan.count(ArchivePlan.Origin.GENERATED));
            log.info("archive.completed root={} entries={} bytes={} uncompressed={}",
                    stats.rootFolder(), stats.entries(), stats.bytesWritten(), stats.uncompressedBytes());
            return stats;
        } catch (IOException e) {
            log.error("archive.failed root={} entry={} written={} error={}",
                    plan.rootFolder(), current, written, e.getMessage());
            throw new ArchiveWriteException("Failed to write archive"
                    + (current != null ? " at entry " + current : ""), current, e);
        }
    }

    // Directory sources expand to every file below them, keyed under the destination
    private Map<String, Path> resolveOverlay(Feature feature, FileMapping mapping) {
        Path source = template.resolveSource(mapping.source());
        String destination = PathSanitizer.normalizeEntryName(mapping.destination(), "mapping destination");

        if (Files.isDirectory(source)) {
            Map<String, Path> files = new LinkedHashMap<>();
            template.listFiles(source, filter)
                    .forEach((relative, file) -> files.put(destination + "/" + relative, file));
            return files;
        }
        if (Files.isRegularFile(source)) {
            return Map.of(destination, source);
        }
        throw new BaseTemplateException("Overlay source not found for feature " + feature.getSlug()
                + ": '" + mapping.source() + "'");
    }
}
