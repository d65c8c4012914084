package com.repo.defects.git;

import java.util.List;

/**
 * Chooses which part of the commit graph is walked.
 */
public record CommitSelector(Kind kind, List<String> branches, String from, String to) {

    public enum Kind {
        /** Every ref: local branches, remote-tracking branches and tags */
        ALL,
        /** The named local branches */
        BRANCHES,
        /** Commits reachable from {@code to} but not from {@code from} */
        RANGE
    }

    public CommitSelector {
        branches = List.copyOf(branches);
        if (kind == Kind.BRANCHES && branches.isEmpty()) {
            throw new IllegalArgumentException("At least one branch name is required");
        }
        if (kind == Kind.RANGE && (from == null || from.isBlank() || to == null || to.isBlank())) {
            throw new IllegalArgumentException("A range needs both ends: " + from + ".." + to);
        }
    }

    public static CommitSelector all() {
        return new CommitSelector(Kind.ALL, List.of(), null, null);
    }

    public static CommitSelector branches(String... names) {
        return new CommitSelector(Kind.BRANCHES, List.of(names), null, null);
    }

    public static CommitSelector range(String from, String to) {
        return new CommitSelector(Kind.RANGE, List.of(), from, to);
    }

    /**
     * Parse a {@code from..to} expression.
     */
    public static CommitSelector parseRange(String expression) {
        int separator = expression.indexOf("..");
        if (separator < 0) {
            throw new IllegalArgumentException("Expected <from>..<to> but got: " + expression);
        }
        return range(expression.substring(0, separator), expression.substring(separator + 2));
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ALL -> "--all";
            case BRANCHES -> String.join(" ", branches);
            case RANGE -> from + ".." + to;
        };
    }
}
