package com.dcruver.organizer.reporting;

import com.dcruver.organizer.config.VaultLayout;
import com.dcruver.organizer.domain.links.LinkRewrite;
import com.dcruver.organizer.domain.links.LinkRewriter;
import com.dcruver.organizer.domain.planning.ExecutionResult;
import com.dcruver.organizer.domain.planning.MovePlan;
import com.dcruver.organizer.io.VaultFileOperations;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes execution reports and renders link rewrites as unified diffs.
 */
@Component
@Slf4j
public class ExecutionReportWriter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final VaultLayout layout;
    private final VaultFileOperations fileOperations;
    private final LinkRewriter linkRewriter;

    public ExecutionReportWriter(VaultLayout layout, VaultFileOperations fileOperations, LinkRewriter linkRewriter) {
        this.layout = layout;
        this.fileOperations = fileOperations;
        this.linkRewriter = linkRewriter;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Write a JSON report of the plan and its execution.
     *
     * @return the report file, or null when no reports directory is configured
     */
    public Path writeReport(MovePlan plan, ExecutionResult result) throws IOException {
        Path reportsRoot = layout.getReportsRoot();
        if (reportsRoot == null) {
            log.debug("No reports path configured - skipping execution report");
            return null;
        }

        Files.createDirectories(reportsRoot);
        Instant now = Instant.now();
        Path reportFile = reportsRoot.resolve("organizer-report-" + TIMESTAMP_FORMAT.format(now) + ".json");

        ExecutionReport report = ExecutionReport.builder()
            .generatedAt(now)
            .vault(layout.getVaultRoot().toString())
            .plan(plan)
            .result(result)
            .build();

        objectMapper.writerWithDefaultPrettyPrinter().writeValue(reportFile.toFile(), report);
        log.info("Wrote execution report: {}", reportFile);
        return reportFile;
    }

    /**
     * Unified diff of every note the plan's link rewrites would change.
     * Reads the vault but never writes it.
     */
    public String previewRewrites(MovePlan plan) throws IOException {
        Map<String, String> moves = plan.moveMap();
        Map<String, List<LinkRewrite>> byNote = new LinkedHashMap<>();
        for (LinkRewrite rewrite : plan.getRewrites()) {
            byNote.computeIfAbsent(rewrite.getSourcePath(), k -> new ArrayList<>()).add(rewrite);
        }

        StringBuilder preview = new StringBuilder();
        for (Map.Entry<String, List<LinkRewrite>> entry : byNote.entrySet()) {
            String source = entry.getKey();
            String original = fileOperations.read(layout.resolve(source));
            String revised = linkRewriter.apply(original, entry.getValue());
            preview.append(generateDiff(original, revised, source, moves.getOrDefault(source, source)));
            preview.append('\n');
        }
        return preview.toString();
    }

    String generateDiff(String original, String revised, String oldPath, String newPath) {
        List<String> originalLines = original.lines().toList();
        List<String> revisedLines = revised.lines().toList();

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
            "a/" + oldPath,
            "b/" + newPath,
            originalLines,
            patch,
            3  // context lines
        );

        return String.join("\n", unifiedDiff);
    }
}
