package com.repo.defects.external;

/**
 * A tool run that contributed nothing to the score, and why.
 */
public record ToolWarning(String tool, String file, String reason) {

    @Override
    public String toString() {
        return tool + " on " + file + ": " + reason;
    }
}
