package com.repo.defects;

import com.repo.defects.core.PredictorConfig;
import com.repo.defects.git.CommitSelector;
import com.repo.defects.git.HistoryMiningException;
import com.repo.defects.report.CsvReporter;
import com.repo.defects.report.DefectReport;
import com.repo.defects.report.JsonReporter;
import com.repo.defects.report.TextReporter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Defect Predictor - ranks files of a Git repository by how likely they are
 * to contain defects.
 *
 * Usage: java -jar defect-predictor.jar --repo <path> [options]
 */
public class DefectPredictionApp {

    public static void main(String[] args) {
        System.out.println("=== Defect Predictor ===");

        CliArgs cliArgs;
        try {
            cliArgs = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            cliArgs = null;
        }
        if (cliArgs == null) {
            printUsage();
            System.exit(1);
        }

        try {
            new DefectPredictionApp().run(cliArgs);
        } catch (HistoryMiningException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(2);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.err.println("""
                Usage: java -jar defect-predictor.jar --repo <path> [options]

                Arguments:
                  --repo <path>            Local Git repository to analyze (required)
                  --output <dir>           Directory for CSV/JSON reports (default: no files)
                  --top <n>                Number of files per report (default: 10)
                  --branch <name>          Only walk this branch (repeatable; default: all refs)
                  --range <from>..<to>     Only walk commits in this range
                  --half-life-days <d>     Weigh changes by recency with this half-life
                  --follow-renames         Count a renamed file's history under its latest name
                  --source-only            Only count source code files
                  --static-analysis        Blend in SpotBugs/cppcheck findings
                  --simulated-model        Blend in the simulated (random) model
                  --blend-weight <w>       Weight of the history score when blending (0-1)
                  --seed <n>               Seed for the simulated model
                  --timeout-seconds <s>    Stop the history walk after this many seconds
                """);
    }

    record CliArgs(
            Path repoPath,
            Path outputDir,
            Integer top,
            List<String> branches,
            String range,
            Double halfLifeDays,
            boolean followRenames,
            boolean sourceOnly,
            boolean staticAnalysis,
            boolean simulatedModel,
            Double blendWeight,
            Long seed,
            Long timeoutSeconds) {

        CommitSelector selector() {
            if (range != null) {
                return CommitSelector.parseRange(range);
            }
            if (!branches.isEmpty()) {
                return CommitSelector.branches(branches.toArray(String[]::new));
            }
            return CommitSelector.all();
        }
    }

    static CliArgs parseArgs(String[] args) {
        Path repoPath = null;
        Path outputDir = null;
        Integer top = null;
        List<String> branches = new ArrayList<>();
        String range = null;
        Double halfLifeDays = null;
        boolean followRenames = false;
        boolean sourceOnly = false;
        boolean staticAnalysis = false;
        boolean simulatedModel = false;
        Double blendWeight = null;
        Long seed = null;
        Long timeoutSeconds = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--repo" -> repoPath = Path.of(value(args, ++i));
                case "--output" -> outputDir = Path.of(value(args, ++i));
                case "--top" -> top = Integer.parseInt(value(args, ++i));
                case "--branch" -> branches.add(value(args, ++i));
                case "--range" -> range = value(args, ++i);
                case "--half-life-days" -> halfLifeDays = Double.parseDouble(value(args, ++i));
                case "--follow-renames" -> followRenames = true;
                case "--source-only" -> sourceOnly = true;
                case "--static-analysis" -> staticAnalysis = true;
                case "--simulated-model" -> simulatedModel = true;
                case "--blend-weight" -> blendWeight = Double.parseDouble(value(args, ++i));
                case "--seed" -> seed = Long.parseLong(value(args, ++i));
                case "--timeout-seconds" -> timeoutSeconds = Long.parseLong(value(args, ++i));
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }

        if (repoPath == null) {
            return null;
        }
        return new CliArgs(repoPath, outputDir, top, branches, range, halfLifeDays, followRenames, sourceOnly,
                staticAnalysis, simulatedModel, blendWeight, seed, timeoutSeconds);
    }

    private static String value(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[index - 1]);
        }
        return args[index];
    }

    static PredictorConfig configure(CliArgs args) {
        PredictorConfig config = PredictorConfig.load(args.repoPath());
        if (args.top() != null)
            config.withTopN(args.top());
        if (args.halfLifeDays() != null)
            config.withHalfLifeDays(args.halfLifeDays());
        if (args.followRenames())
            config.withFollowRenames(true);
        if (args.sourceOnly())
            config.withSourceOnly(true);
        if (args.staticAnalysis())
            config.withStaticAnalysis(true);
        if (args.simulatedModel())
            config.withSimulatedModel(true);
        if (args.blendWeight() != null)
            config.withBlendWeight(args.blendWeight());
        if (args.seed() != null)
            config.withSimulatedModelSeed(args.seed());
        if (args.timeoutSeconds() != null)
            config.withHistoryTimeoutSeconds(args.timeoutSeconds());
        return config;
    }

    private void run(CliArgs args) throws HistoryMiningException, IOException {
        PredictorConfig config = configure(args);

        System.out.println("\n>>> PHASE 1: SCORING <<<");
        DefectPredictor predictor = DefectPredictor.create(config);
        List<DefectReport> reports = predictor.predict(args.repoPath(), args.selector());

        System.out.println("\n>>> PHASE 2: REPORTING <<<");
        TextReporter text = new TextReporter();
        for (DefectReport report : reports) {
            System.out.println();
            System.out.print(text.render(report));
        }

        if (args.outputDir() != null) {
            Files.createDirectories(args.outputDir());
            new CsvReporter().generate(reports, args.outputDir().resolve("defect-report.csv"));
            new JsonReporter().generate(reports, args.outputDir().resolve("defect-report.json"));
        }
    }
}
