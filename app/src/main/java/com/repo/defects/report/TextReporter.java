package com.repo.defects.report;

import com.repo.defects.scoring.RankedEntry;

import java.util.Locale;

/**
 * Plain text rendering for the console.
 */
public class TextReporter {

    public String render(DefectReport report) {
        StringBuilder text = new StringBuilder();
        text.append("=== ").append(report.title());
        if (report.partial()) {
            text.append(" (partial result)");
        }
        text.append(" ===\n");

        if (!report.hasSignal()) {
            text.append("No signal: no files could be scored.\n");
        } else {
            text.append(String.format(Locale.ROOT, "Top %d files most likely to contain defects:%n",
                    report.requested()));
            for (RankedEntry entry : report.entries()) {
                text.append(formatEntry(entry)).append('\n');
            }
        }

        for (String warning : report.warnings()) {
            text.append("Warning: ").append(warning).append('\n');
        }
        return text.toString();
    }

    public String formatEntry(RankedEntry entry) {
        return String.format(Locale.ROOT, "%d. %s (Score: %.4f)", entry.rank(), entry.path(), entry.score());
    }
}
