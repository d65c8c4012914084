package com.repo.defects.scoring;

import com.repo.defects.core.ScoreMap;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A pluggable producer of raw (not yet normalized) per-file scores.
 */
public interface RawScoreSource {

    /** Short name used in reports, e.g. "simulated-model". */
    String getSourceId();

    ScoreMap collect(Path repoRoot) throws IOException;
}
