package com.repo.defects;

import com.repo.defects.core.PredictorConfig;
import com.repo.defects.core.ScoreMap;
import com.repo.defects.core.StaticAnalysisTool;
import com.repo.defects.core.ToolRegistry;
import com.repo.defects.core.WorkingTree;
import com.repo.defects.external.ExternalSignal;
import com.repo.defects.external.ExternalSignalAdapter;
import com.repo.defects.git.AggregationResult;
import com.repo.defects.git.CommitSelector;
import com.repo.defects.git.HistoryMiner;
import com.repo.defects.git.HistoryMiningException;
import com.repo.defects.git.WeightFunction;
import com.repo.defects.report.DefectReport;
import com.repo.defects.scoring.RankReporter;
import com.repo.defects.scoring.RankedEntry;
import com.repo.defects.scoring.RawScoreSource;
import com.repo.defects.scoring.ScoreNormalizer;
import com.repo.defects.scoring.SimulatedModelSource;
import com.repo.defects.tools.CppcheckTool;
import com.repo.defects.tools.SpotBugsTool;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point to the scoring engine.
 *
 * <p>
 * Exposes the four core operations (history aggregation, normalization,
 * blending, ranking) and {@link #predict}, which chains them: change history
 * first, then, if enabled, static analysis findings and the simulated model,
 * each normalized on its own and blended into a combined ranking.
 */
public class DefectPredictor {

    private final PredictorConfig config;
    private final HistoryMiner miner;
    private final ScoreNormalizer normalizer = new ScoreNormalizer();
    private final RankReporter ranker = new RankReporter();
    private final ExternalSignalAdapter externalSignalAdapter;
    private final RawScoreSource simulatedModel;

    public DefectPredictor(PredictorConfig config, ExternalSignalAdapter externalSignalAdapter,
            RawScoreSource simulatedModel) {
        this.config = config;
        this.miner = new HistoryMiner(config);
        this.externalSignalAdapter = externalSignalAdapter;
        this.simulatedModel = simulatedModel;
    }

    /**
     * Predictor with the built-in tools (SpotBugs, cppcheck) and the simulated
     * model, used when the configuration enables them.
     */
    public static DefectPredictor create(PredictorConfig config) {
        ExternalSignalAdapter adapter = null;
        if (config.isStaticAnalysisEnabled()) {
            List<StaticAnalysisTool> tools = List.of(new SpotBugsTool(), new CppcheckTool());
            ToolRegistry registry = new ToolRegistry(tools);
            registry.printSummary();
            adapter = new ExternalSignalAdapter(registry, config);
        }
        RawScoreSource model = null;
        if (config.isSimulatedModelEnabled()) {
            model = config.getSimulatedModelSeed()
                    .map(seed -> (RawScoreSource) new SimulatedModelSource(seed))
                    .orElseGet(SimulatedModelSource::new);
        }
        return new DefectPredictor(config, adapter, model);
    }

    /**
     * @param weightFunction weight per commit, or null for the configured one
     */
    public AggregationResult aggregateChangeHistory(Path repoRoot, CommitSelector selector,
            WeightFunction weightFunction) throws HistoryMiningException {
        WeightFunction weights = weightFunction != null ? weightFunction : miner.configuredWeightFunction(Instant.now());
        return miner.aggregateChangeHistory(repoRoot, selector, weights, miner.configuredCancellation());
    }

    public ScoreMap normalize(ScoreMap raw) {
        return normalizer.normalize(raw);
    }

    public ScoreMap blend(ScoreMap a, ScoreMap b, double weight) {
        return normalizer.blend(a, b, weight);
    }

    public List<RankedEntry> topN(ScoreMap scores, int n) {
        return ranker.topN(scores, n);
    }

    /**
     * Run the whole pipeline and return one report per score source, plus a
     * combined report when more than one source contributed. In the combined
     * report the change history carries the configured blend weight and the
     * other sources split the remainder equally.
     *
     * @throws HistoryMiningException if the repository or its whole history is
     *                                unusable
     * @throws IOException            if the working tree cannot be listed
     */
    public List<DefectReport> predict(Path repoRoot, CommitSelector selector)
            throws HistoryMiningException, IOException {
        int top = config.getTopN();
        List<DefectReport> reports = new ArrayList<>();

        AggregationResult history = aggregateChangeHistory(repoRoot, selector, null);
        ScoreMap historyScores = normalize(history.changes().toScoreMap());
        List<String> combinedWarnings = new ArrayList<>(history.warnings());
        reports.add(new DefectReport("change-history", top, topN(historyScores, top), history.isPartial(),
                history.warnings()));
        List<ScoreMap> otherSignals = new ArrayList<>();

        if (externalSignalAdapter != null) {
            ExternalSignal signal = externalSignalAdapter.collect(repoRoot, WorkingTree.listFiles(repoRoot));
            ScoreMap findings = normalize(signal.rawScores());
            List<String> warnings = signal.warnings().stream().map(Object::toString).toList();
            reports.add(new DefectReport("static-analysis", top, topN(findings, top), false, warnings));
            otherSignals.add(findings);
            combinedWarnings.addAll(warnings);
        }

        if (simulatedModel != null) {
            ScoreMap modelScores = normalize(simulatedModel.collect(repoRoot));
            reports.add(new DefectReport(simulatedModel.getSourceId(), top, topN(modelScores, top), false,
                    List.of()));
            otherSignals.add(modelScores);
        }

        if (!otherSignals.isEmpty()) {
            ScoreMap combined = blend(historyScores, normalizer.average(otherSignals), config.getBlendWeight());
            reports.add(new DefectReport("combined", top, topN(combined, top), history.isPartial(),
                    combinedWarnings));
        }
        return reports;
    }
}
