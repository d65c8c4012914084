package com.repo.defects.git;

import org.eclipse.jgit.lib.ObjectId;

import java.util.ArrayList;
import java.util.List;

/**
 * One independent unit of history work: the commits reachable from
 * {@code head} that are not reachable from any of the {@code excluded} commits.
 * Partitions produced by {@link CommitWalker#partition} never share a commit.
 *
 * @param name     ref name (or range expression) the partition was built from
 * @param head     commit the walk starts at
 * @param excluded commits whose ancestry belongs to other partitions
 */
public record HistoryPartition(String name, ObjectId head, List<ObjectId> excluded) {

    public HistoryPartition {
        excluded = List.copyOf(excluded);
    }

    /**
     * The same partition without the ancestry of {@code head} excluded, for
     * when that head turned out to be unreadable.
     */
    public HistoryPartition withoutExcluded(ObjectId head) {
        List<ObjectId> remaining = new ArrayList<>(excluded);
        remaining.remove(head);
        return new HistoryPartition(name, this.head, remaining);
    }
}
