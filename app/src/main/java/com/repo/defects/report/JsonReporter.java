package com.repo.defects.report;

import com.repo.defects.scoring.RankedEntry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Writes reports as a self-describing JSON document for external tools.
 */
public class JsonReporter {

    public void generate(List<DefectReport> reports, Path outputPath) throws IOException {
        Files.writeString(outputPath, toJson(reports, Instant.now()));
        System.out.println("JSON Report generated at: " + outputPath.toAbsolutePath());
    }

    String toJson(List<DefectReport> reports, Instant generatedAt) {
        return String.format(Locale.ROOT,
                "{ \"metadata\": { \"generatedAt\": \"%s\", \"tool\": \"Defect Predictor 1.0\", "
                        + "\"description\": \"Files ranked by estimated defect-proneness\" }, "
                        + "\"schema\": { "
                        + "\"score\": \"Share of the signal (0-1). Scores of one report sum to 1 over all known files.\", "
                        + "\"rank\": \"Position in the report, ties ordered by path.\", "
                        + "\"partial\": \"True if part of the history or a tool run could not be collected.\" "
                        + "}, \"reports\": %s }",
                generatedAt, reports.stream()
                        .map(this::reportToJson)
                        .collect(Collectors.joining(", ", "[", "]")));
    }

    private String reportToJson(DefectReport report) {
        return String.format(Locale.ROOT,
                "{ \"title\": \"%s\", \"requested\": %d, \"partial\": %b, \"entries\": %s, \"warnings\": %s }",
                escapeJson(report.title()),
                report.requested(),
                report.partial(),
                report.entries().stream()
                        .map(this::entryToJson)
                        .collect(Collectors.joining(", ", "[", "]")),
                report.warnings().stream()
                        .map(w -> "\"" + escapeJson(w) + "\"")
                        .collect(Collectors.joining(", ", "[", "]")));
    }

    private String entryToJson(RankedEntry entry) {
        return String.format(Locale.ROOT, "{ \"rank\": %d, \"path\": \"%s\", \"score\": %.6f }",
                entry.rank(), escapeJson(entry.path()), entry.score());
    }

    private String escapeJson(String s) {
        if (s == null)
            return "";
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\t", "\\t");
    }
}
