package com.repo.defects.git;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A single commit as seen by the change aggregator.
 * Read-only snapshot of repository history: never mutated after creation.
 */
public record Commit(
        /** Full object id (hash) */
        String id,

        /** Parent ids: empty for a root commit, two or more for a merge */
        List<String> parentIds,

        /** Repository-relative paths added, modified, deleted, copied or renamed */
        Set<String> touchedFiles,

        /** Detected renames of this commit, old path to new path */
        Map<String, String> renames,

        /** Committer time */
        Instant commitTime,

        /** Author email, or name when no email is recorded */
        String author) {

    public Commit {
        parentIds = List.copyOf(parentIds);
        touchedFiles = Set.copyOf(touchedFiles);
        renames = Map.copyOf(renames);
    }

    /**
     * Create a commit without rename information or author.
     */
    public static Commit of(String id, Instant commitTime, Set<String> touchedFiles) {
        return new Commit(id, List.of(), touchedFiles, Map.of(), commitTime, "");
    }

    public boolean isMerge() {
        return parentIds.size() > 1;
    }
}
