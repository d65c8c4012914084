package com.repo.defects.core;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Configuration for a defect prediction run.
 * Loaded from defect-predictor.yaml in the repository root or uses sensible
 * defaults. Command line flags override the loaded values through the
 * {@code with*} methods.
 */
public class PredictorConfig {

    public static final String FILE_NAME = "defect-predictor.yaml";

    // History mining
    private boolean followRenames = false;
    private double halfLifeDays = 0; // 0 = every change weighs 1
    private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
    private long historyTimeoutSeconds = 0; // 0 = no deadline
    private boolean sourceOnly = false;

    // Scoring
    private int topN = 10;
    private double blendWeight = 0.5;

    // Static analysis
    private boolean staticAnalysisEnabled = false;
    private long toolTimeoutSeconds = 60;
    private int toolConcurrency = 4;
    private boolean weightBySeverity = false;

    // Simulated model
    private boolean simulatedModelEnabled = false;
    private Long simulatedModelSeed = null;

    // Exclusion patterns
    private Set<String> exclusions = Set.of();

    private static final Set<String> SOURCE_EXTENSIONS = Set.of(
            ".java", ".py", ".js", ".jsx", ".ts", ".tsx", ".mjs", ".cjs",
            ".go", ".rs", ".rb", ".php", ".c", ".cpp", ".h", ".hpp",
            ".kt", ".kts", ".swift", ".scala");

    /**
     * Load configuration from YAML file or return defaults.
     */
    public static PredictorConfig load(Path repositoryRoot) {
        PredictorConfig config = new PredictorConfig();
        Path configFile = repositoryRoot.resolve(FILE_NAME);

        if (Files.exists(configFile)) {
            try (InputStream is = Files.newInputStream(configFile)) {
                Yaml yaml = new Yaml();
                Object data = yaml.load(is);
                if (data instanceof Map) {
                    @SuppressWarnings("unchecked")
                    Map<String, Object> sections = (Map<String, Object>) data;
                    config.parseYaml(sections);
                    System.out.println("Loaded configuration from: " + configFile);
                } else if (data != null) {
                    System.err.println("Warning: " + configFile + " is not a mapping, using defaults");
                }
            } catch (IOException | YAMLException e) {
                System.err.println("Warning: Could not read config file, using defaults: " + e.getMessage());
            }
        }
        return config;
    }

    public static PredictorConfig defaults() {
        return new PredictorConfig();
    }

    private void parseYaml(Map<String, Object> data) {
        Map<String, Object> history = section(data, "history");
        followRenames = getBool(history, "follow_renames", followRenames);
        halfLifeDays = getDouble(history, "half_life_days", halfLifeDays);
        parallelism = Math.max(1, getInt(history, "parallelism", parallelism));
        historyTimeoutSeconds = getInt(history, "timeout_seconds", (int) historyTimeoutSeconds);
        sourceOnly = getBool(history, "source_only", sourceOnly);

        Map<String, Object> scoring = section(data, "scoring");
        topN = getInt(scoring, "top_n", topN);
        blendWeight = getDouble(scoring, "blend_weight", blendWeight);

        Map<String, Object> sa = section(data, "static_analysis");
        staticAnalysisEnabled = getBool(sa, "enabled", staticAnalysisEnabled);
        toolTimeoutSeconds = getInt(sa, "timeout_seconds", (int) toolTimeoutSeconds);
        toolConcurrency = Math.max(1, getInt(sa, "concurrency", toolConcurrency));
        weightBySeverity = getBool(sa, "weight_by_severity", weightBySeverity);

        Map<String, Object> sm = section(data, "simulated_model");
        simulatedModelEnabled = getBool(sm, "enabled", simulatedModelEnabled);
        Object seed = sm.get("seed");
        if (seed instanceof Number) {
            simulatedModelSeed = ((Number) seed).longValue();
        }

        Object excList = data.get("exclusions");
        if (excList instanceof List) {
            Set<String> patterns = new HashSet<>();
            for (Object pattern : (List<?>) excList) {
                if (pattern != null) {
                    patterns.add(pattern.toString());
                }
            }
            exclusions = patterns;
        }
    }

    /**
     * A nested section, or an empty map when it is missing, empty or not a
     * mapping.
     */
    @SuppressWarnings("unchecked")
    private Map<String, Object> section(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        if (value != null) {
            System.err.println("Warning: ignoring config section '" + key + "', expected a mapping");
        }
        return Map.of();
    }

    private int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).intValue();
        return defaultVal;
    }

    private double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).doubleValue();
        return defaultVal;
    }

    private boolean getBool(Map<String, Object> map, String key, boolean defaultVal) {
        Object val = map.get(key);
        if (val instanceof Boolean)
            return (Boolean) val;
        return defaultVal;
    }

    // === Getters ===

    public boolean isFollowRenames() {
        return followRenames;
    }

    public double getHalfLifeDays() {
        return halfLifeDays;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getHistoryTimeoutSeconds() {
        return historyTimeoutSeconds;
    }

    public boolean isSourceOnly() {
        return sourceOnly;
    }

    public int getTopN() {
        return topN;
    }

    public double getBlendWeight() {
        return blendWeight;
    }

    public boolean isStaticAnalysisEnabled() {
        return staticAnalysisEnabled;
    }

    public long getToolTimeoutSeconds() {
        return toolTimeoutSeconds;
    }

    public int getToolConcurrency() {
        return toolConcurrency;
    }

    public boolean isWeightBySeverity() {
        return weightBySeverity;
    }

    public boolean isSimulatedModelEnabled() {
        return simulatedModelEnabled;
    }

    public Optional<Long> getSimulatedModelSeed() {
        return Optional.ofNullable(simulatedModelSeed);
    }

    public Set<String> getExclusions() {
        return exclusions;
    }

    // === Overrides ===

    public PredictorConfig withFollowRenames(boolean followRenames) {
        this.followRenames = followRenames;
        return this;
    }

    public PredictorConfig withHalfLifeDays(double halfLifeDays) {
        this.halfLifeDays = halfLifeDays;
        return this;
    }

    public PredictorConfig withParallelism(int parallelism) {
        this.parallelism = Math.max(1, parallelism);
        return this;
    }

    public PredictorConfig withHistoryTimeoutSeconds(long seconds) {
        this.historyTimeoutSeconds = seconds;
        return this;
    }

    public PredictorConfig withSourceOnly(boolean sourceOnly) {
        this.sourceOnly = sourceOnly;
        return this;
    }

    public PredictorConfig withTopN(int topN) {
        this.topN = topN;
        return this;
    }

    public PredictorConfig withBlendWeight(double blendWeight) {
        this.blendWeight = blendWeight;
        return this;
    }

    public PredictorConfig withStaticAnalysis(boolean enabled) {
        this.staticAnalysisEnabled = enabled;
        return this;
    }

    public PredictorConfig withWeightBySeverity(boolean weightBySeverity) {
        this.weightBySeverity = weightBySeverity;
        return this;
    }

    public PredictorConfig withSimulatedModel(boolean enabled) {
        this.simulatedModelEnabled = enabled;
        return this;
    }

    public PredictorConfig withSimulatedModelSeed(long seed) {
        this.simulatedModelSeed = seed;
        return this;
    }

    public PredictorConfig withExclusions(Set<String> exclusions) {
        this.exclusions = Set.copyOf(exclusions);
        return this;
    }

    // === Path filtering ===

    /**
     * Whether changes to the given repository-relative path are counted.
     */
    public boolean isTracked(String path) {
        if (shouldExclude(path)) {
            return false;
        }
        return !sourceOnly || isSourceFile(path);
    }

    public boolean shouldExclude(String path) {
        for (String pattern : exclusions) {
            if (matchesGlob(path, pattern)) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesGlob(String path, String glob) {
        String regex = glob
                .replace(".", "\\.")
                .replace("**", "<<<DOUBLESTAR>>>")
                .replace("*", "[^/]*")
                .replace("<<<DOUBLESTAR>>>", ".*");
        return path.matches(".*" + regex + ".*");
    }

    /**
     * Check if a file is a source file based on extension.
     */
    static boolean isSourceFile(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        return dot >= 0 && SOURCE_EXTENSIONS.contains(lower.substring(dot));
    }
}
