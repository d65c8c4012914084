package com.repo.defects.core;

/**
 * Severity of a single static analysis finding, with the weight it adds to a
 * file's raw score when findings are weighted by severity.
 */
public enum FindingSeverity {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int weight;

    FindingSeverity(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
