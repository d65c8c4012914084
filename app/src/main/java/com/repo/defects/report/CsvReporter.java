package com.repo.defects.report;

import com.repo.defects.scoring.RankedEntry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public class CsvReporter {

    public void generate(List<DefectReport> reports, Path outputPath) throws IOException {
        Files.writeString(outputPath, toCsv(reports));
        System.out.println("CSV Report generated at: " + outputPath.toAbsolutePath());
    }

    String toCsv(List<DefectReport> reports) {
        StringBuilder csv = new StringBuilder();
        csv.append("Source,Rank,Path,Score,Partial\n");

        for (DefectReport report : reports) {
            for (RankedEntry entry : report.entries()) {
                csv.append(String.format(Locale.ROOT, "%s,%d,%s,%.6f,%b%n",
                        escape(report.title()),
                        entry.rank(),
                        escape(entry.path()),
                        entry.score(),
                        report.partial()));
            }
        }
        return csv.toString();
    }

    private String escape(String s) {
        if (s == null)
            return "";
        // Quote fields containing separators, doubling embedded quotes
        if (s.contains(",") || s.contains("\"") || s.contains("\n")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }
}
