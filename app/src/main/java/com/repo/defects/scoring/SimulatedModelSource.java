package com.repo.defects.scoring;

import com.repo.defects.core.ScoreMap;
import com.repo.defects.core.WorkingTree;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;

/**
 * Stand-in for a trained defect model: gives every code file in the working
 * tree a random raw score in [0, 1). With a fixed seed the scores are
 * reproducible.
 */
public class SimulatedModelSource implements RawScoreSource {

    private static final Set<String> CODE_EXTENSIONS = Set.of(".py", ".c", ".cpp", ".h", ".java", ".js", ".go");

    private final Long seed;

    public SimulatedModelSource(long seed) {
        this.seed = seed;
    }

    public SimulatedModelSource() {
        this.seed = null;
    }

    @Override
    public String getSourceId() {
        return "simulated-model";
    }

    @Override
    public ScoreMap collect(Path repoRoot) throws IOException {
        // Sorted so that a seed maps to the same score per file on every run
        List<String> files = WorkingTree.listFiles(repoRoot).stream()
                .filter(SimulatedModelSource::isCodeFile)
                .toList();
        Random random = seed != null ? new Random(seed) : new Random();
        Map<String, Double> scores = new TreeMap<>();
        for (String file : files) {
            scores.put(file, random.nextDouble());
        }
        return ScoreMap.of(scores);
    }

    private static boolean isCodeFile(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        return dot >= 0 && CODE_EXTENSIONS.contains(lower.substring(dot));
    }
}
