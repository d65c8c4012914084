package com.repo.defects.git;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.CanceledException;
import org.eclipse.jgit.diff.DiffConfig;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.RenameDetector;
import org.eclipse.jgit.errors.RepositoryNotFoundException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.NullProgressMonitor;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.EmptyTreeIterator;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.eclipse.jgit.treewalk.filter.TreeFilter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.*;

/**
 * Walks the commit graph of a local Git repository and reports, per commit,
 * the files it touched.
 *
 * <p>
 * Commits are produced newest first (by commit time, every commit before its
 * parents). Each commit is diffed against its first parent, root commits
 * against the empty tree. Merge commits are visited once, like any other
 * commit.
 *
 * <p>
 * The walker is safe to use from several threads as long as every thread
 * walks its own {@link HistoryPartition}: each cursor owns its
 * {@link RevWalk} and object reader.
 */
public class CommitWalker implements AutoCloseable {

    /**
     * Partitions of a selector plus the refs that had to be skipped.
     */
    public record Partitioning(List<HistoryPartition> partitions, List<String> warnings) {

        public Partitioning {
            partitions = List.copyOf(partitions);
            warnings = List.copyOf(warnings);
        }
    }

    private final Repository repository;
    private final boolean followRenames;

    public CommitWalker(Repository repository, boolean followRenames) {
        this.repository = repository;
        this.followRenames = followRenames;
    }

    /**
     * Open the repository at the given working tree or bare repository path.
     *
     * @throws RepositoryAccessException if the path is missing or not a readable
     *                                   Git repository
     */
    public static CommitWalker open(Path repositoryPath, boolean followRenames) throws RepositoryAccessException {
        if (!Files.isDirectory(repositoryPath)) {
            throw new RepositoryAccessException("Repository path does not exist: " + repositoryPath);
        }
        try {
            Git git = Git.open(repositoryPath.toFile());
            return new CommitWalker(git.getRepository(), followRenames);
        } catch (RepositoryNotFoundException e) {
            throw new RepositoryAccessException("Not a Git repository: " + repositoryPath, e);
        } catch (IOException e) {
            throw new RepositoryAccessException("Cannot open repository " + repositoryPath + ": " + e.getMessage(), e);
        }
    }

    public boolean isFollowRenames() {
        return followRenames;
    }

    /**
     * Split the selected history into disjoint partitions, one per distinct
     * head. Heads are ordered by ref name; every commit belongs to the first
     * head (in that order) it is reachable from.
     *
     * @throws RepositoryAccessException if the refs cannot be read at all
     */
    public Partitioning partition(CommitSelector selector) throws RepositoryAccessException {
        List<String> warnings = new ArrayList<>();
        SortedMap<String, String> revisions = selectRevisions(selector);

        List<HistoryPartition> partitions = new ArrayList<>();
        List<ObjectId> claimed = new ArrayList<>();
        try (RevWalk walk = new RevWalk(repository)) {
            if (selector.kind() == CommitSelector.Kind.RANGE) {
                Optional<ObjectId> to = resolveCommit(walk, selector.to(), warnings);
                Optional<ObjectId> from = resolveCommit(walk, selector.from(), warnings);
                if (to.isPresent() && from.isPresent()) {
                    partitions.add(new HistoryPartition(selector.toString(), to.get(), List.of(from.get())));
                }
                return new Partitioning(partitions, warnings);
            }

            for (Map.Entry<String, String> revision : revisions.entrySet()) {
                Optional<ObjectId> head = resolveCommit(walk, revision.getValue(), warnings);
                if (head.isEmpty() || claimed.contains(head.get())) {
                    continue;
                }
                partitions.add(new HistoryPartition(revision.getKey(), head.get(), claimed));
                claimed.add(head.get());
            }
        }
        return new Partitioning(partitions, warnings);
    }

    private SortedMap<String, String> selectRevisions(CommitSelector selector) throws RepositoryAccessException {
        SortedMap<String, String> revisions = new TreeMap<>();
        switch (selector.kind()) {
            case ALL -> {
                try {
                    for (Ref ref : repository.getRefDatabase().getRefs()) {
                        if (ref.getObjectId() != null) {
                            revisions.put(ref.getName(), ref.getName());
                        }
                    }
                } catch (IOException e) {
                    throw new RepositoryAccessException("Cannot read refs of " + repository + ": " + e.getMessage(), e);
                }
            }
            case BRANCHES -> {
                for (String branch : selector.branches()) {
                    String name = branch.startsWith(Constants.R_REFS) ? branch : Constants.R_HEADS + branch;
                    revisions.put(name, name);
                }
            }
            case RANGE -> {
                // resolved directly by partition()
            }
        }
        return revisions;
    }

    private Optional<ObjectId> resolveCommit(RevWalk walk, String revision, List<String> warnings) {
        try {
            ObjectId id = repository.resolve(revision);
            if (id == null) {
                warnings.add("Unknown revision '" + revision + "'");
                return Optional.empty();
            }
            return Optional.of(walk.parseCommit(id).copy());
        } catch (IOException | RuntimeException e) {
            warnings.add("Skipping '" + revision + "': " + e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Lazily walk the commits of one partition.
     *
     * @throws HistoryTraversalException if the partition's start or boundary
     *                                   commits cannot be read
     */
    public CommitCursor walk(HistoryPartition partition) throws HistoryTraversalException {
        RevWalk revWalk = new RevWalk(repository);
        try {
            revWalk.markStart(revWalk.parseCommit(partition.head()));
            for (ObjectId excluded : partition.excluded()) {
                revWalk.markUninteresting(revWalk.parseCommit(excluded));
            }
        } catch (IOException e) {
            revWalk.close();
            throw new HistoryTraversalException(
                    "Cannot start history walk of " + partition.name() + ": " + e.getMessage(), e);
        }
        return new PartitionCursor(partition, revWalk);
    }

    /**
     * Walk every partition of the selector one after another. Unlike
     * {@link #partition}, an unresolvable ref is an error here.
     */
    public CommitCursor walk(CommitSelector selector) throws HistoryMiningException {
        Partitioning partitioning = partition(selector);
        if (!partitioning.warnings().isEmpty()) {
            throw new HistoryTraversalException(String.join("; ", partitioning.warnings()));
        }
        Iterator<HistoryPartition> remaining = partitioning.partitions().iterator();
        return new CommitCursor() {
            private CommitCursor current;

            @Override
            public Optional<Commit> next() throws HistoryTraversalException {
                while (true) {
                    if (current != null) {
                        Optional<Commit> commit = current.next();
                        if (commit.isPresent()) {
                            return commit;
                        }
                        current.close();
                        current = null;
                    }
                    if (!remaining.hasNext()) {
                        return Optional.empty();
                    }
                    current = walk(remaining.next());
                }
            }

            @Override
            public void close() {
                if (current != null) {
                    current.close();
                }
            }
        };
    }

    @Override
    public void close() {
        repository.close();
    }

    private class PartitionCursor implements CommitCursor {

        private final HistoryPartition partition;
        private final RevWalk revWalk;
        private final ObjectReader reader;

        PartitionCursor(HistoryPartition partition, RevWalk revWalk) {
            this.partition = partition;
            this.revWalk = revWalk;
            this.reader = revWalk.getObjectReader();
        }

        @Override
        public Optional<Commit> next() throws HistoryTraversalException {
            RevCommit commit;
            try {
                commit = revWalk.next();
            } catch (IOException e) {
                throw new HistoryTraversalException(
                        "Broken history on " + partition.name() + ": " + e.getMessage(), e);
            }
            if (commit == null) {
                return Optional.empty();
            }
            try {
                return Optional.of(toCommit(commit));
            } catch (IOException e) {
                throw new HistoryTraversalException(
                        "Cannot read changes of commit " + commit.getName() + " on " + partition.name()
                                + ": " + e.getMessage(),
                        e);
            }
        }

        private Commit toCommit(RevCommit commit) throws IOException {
            List<String> parents = new ArrayList<>();
            for (RevCommit parent : commit.getParents()) {
                parents.add(parent.getName());
            }

            Set<String> touched = new HashSet<>();
            Map<String, String> renames = new HashMap<>();
            for (DiffEntry entry : diffAgainstFirstParent(commit)) {
                switch (entry.getChangeType()) {
                    case DELETE -> touched.add(entry.getOldPath());
                    case RENAME -> {
                        touched.add(entry.getNewPath());
                        renames.put(entry.getOldPath(), entry.getNewPath());
                    }
                    default -> touched.add(entry.getNewPath());
                }
            }

            return new Commit(
                    commit.getName(),
                    parents,
                    touched,
                    renames,
                    Instant.ofEpochSecond(commit.getCommitTime()),
                    getAuthor(commit));
        }

        private List<DiffEntry> diffAgainstFirstParent(RevCommit commit) throws IOException {
            try (TreeWalk treeWalk = new TreeWalk(repository, reader)) {
                treeWalk.setRecursive(true);
                treeWalk.setFilter(TreeFilter.ANY_DIFF);
                if (commit.getParentCount() == 0) {
                    treeWalk.addTree(new EmptyTreeIterator());
                } else {
                    RevCommit parent = commit.getParent(0);
                    revWalk.parseHeaders(parent);
                    treeWalk.addTree(parent.getTree());
                }
                treeWalk.addTree(commit.getTree());

                List<DiffEntry> entries = DiffEntry.scan(treeWalk);
                if (!followRenames) {
                    return entries;
                }
                RenameDetector renames = new RenameDetector(reader, repository.getConfig().get(DiffConfig.KEY));
                renames.addAll(entries);
                try {
                    return renames.compute(reader, NullProgressMonitor.INSTANCE);
                } catch (CanceledException e) {
                    throw new IOException("Rename detection cancelled for " + commit.getName(), e);
                }
            }
        }

        private String getAuthor(RevCommit commit) {
            PersonIdent author = commit.getAuthorIdent();
            if (author == null) {
                return "";
            }
            String email = author.getEmailAddress();
            return email == null || email.isEmpty() ? author.getName() : email;
        }

        @Override
        public void close() {
            revWalk.close();
        }
    }
}
