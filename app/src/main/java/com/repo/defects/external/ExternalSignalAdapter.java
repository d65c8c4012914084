package com.repo.defects.external;

import com.repo.defects.core.FindingSeverity;
import com.repo.defects.core.PredictorConfig;
import com.repo.defects.core.ScoreMap;
import com.repo.defects.core.StaticAnalysisTool;
import com.repo.defects.core.ToolInvocation;
import com.repo.defects.core.ToolRegistry;

import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Translates static analysis tool output into a raw score map that the score
 * normalizer treats exactly like change counts.
 *
 * <p>
 * A failing tool run (non-zero exit, missing binary, timeout) never stops the
 * pipeline: the file gets no score from that run and a {@link ToolWarning} is
 * reported instead.
 */
public class ExternalSignalAdapter {

    private final ToolRegistry registry;
    private final PredictorConfig config;

    public ExternalSignalAdapter(ToolRegistry registry, PredictorConfig config) {
        this.registry = registry;
        this.config = config;
    }

    /**
     * Run the registered tools on every file that has one, at most
     * {@code static_analysis.concurrency} processes at a time.
     */
    public ExternalSignal collect(Path repoRoot, Collection<String> relativePaths) {
        Duration timeout = Duration.ofSeconds(config.getToolTimeoutSeconds());
        Map<String, StaticAnalysisTool> jobs = new TreeMap<>();
        for (String path : relativePaths) {
            registry.getTool(path).ifPresent(tool -> jobs.put(path, tool));
        }
        if (jobs.isEmpty()) {
            return ExternalSignal.none();
        }

        int workers = Math.min(config.getToolConcurrency(), jobs.size());
        System.out.println("Running static analysis on " + jobs.size() + " files with " + workers + " workers...");

        List<ToolOutcome> outcomes = new ArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            Map<String, Future<ToolOutcome>> futures = new LinkedHashMap<>();
            jobs.forEach((path, tool) -> futures.put(path,
                    executor.submit(() -> translate(tool, tool.run(repoRoot, path, timeout)))));

            for (Map.Entry<String, Future<ToolOutcome>> entry : futures.entrySet()) {
                String toolId = jobs.get(entry.getKey()).getToolId();
                try {
                    outcomes.add(entry.getValue().get());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    outcomes.add(ToolOutcome.failed(toolId, entry.getKey(), "interrupted"));
                } catch (ExecutionException e) {
                    outcomes.add(ToolOutcome.failed(toolId, entry.getKey(), String.valueOf(e.getCause())));
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return combine(outcomes);
    }

    /**
     * Turn one captured tool run into its score contribution.
     */
    public ToolOutcome translate(StaticAnalysisTool tool, ToolInvocation invocation) {
        if (!invocation.succeeded()) {
            return ToolOutcome.failed(invocation.tool(), invocation.file(), failureReason(invocation));
        }

        List<FindingSeverity> findings = tool.parseFindings(invocation);
        double score = config.isWeightBySeverity()
                ? findings.stream().mapToInt(FindingSeverity::weight).sum()
                : findings.size();
        return ToolOutcome.findings(invocation.file(), score);
    }

    /**
     * Sum outcomes per file. Files whose runs found nothing are left out.
     */
    public ExternalSignal combine(List<ToolOutcome> outcomes) {
        Map<String, Double> raw = new TreeMap<>();
        List<ToolWarning> warnings = new ArrayList<>();
        for (ToolOutcome outcome : outcomes) {
            if (outcome.rawScore() > 0) {
                raw.merge(outcome.file(), outcome.rawScore(), Double::sum);
            }
            outcome.warning().ifPresent(warnings::add);
        }
        warnings.sort(Comparator.comparing(ToolWarning::file).thenComparing(ToolWarning::tool));
        for (ToolWarning warning : warnings) {
            System.err.println("Warning: " + warning);
        }
        return new ExternalSignal(ScoreMap.of(raw), warnings, outcomes.size());
    }

    private String failureReason(ToolInvocation invocation) {
        if (invocation.launchError() != null) {
            return "could not start: " + invocation.launchError();
        }
        if (invocation.timedOut()) {
            return "timed out";
        }
        String detail = invocation.stderr().isBlank() ? "" : ": " + firstLine(invocation.stderr());
        return "exit status " + invocation.exitCode() + detail;
    }

    private String firstLine(String text) {
        String trimmed = text.strip();
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline).strip();
    }
}
