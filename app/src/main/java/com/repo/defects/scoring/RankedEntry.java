package com.repo.defects.scoring;

/**
 * One line of a defect-proneness report.
 *
 * @param path  repository-relative file path
 * @param score normalized score
 * @param rank  position in the report, starting at 1
 */
public record RankedEntry(String path, double score, int rank) {
}
