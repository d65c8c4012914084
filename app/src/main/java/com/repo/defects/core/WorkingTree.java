package com.repo.defects.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Lists the files of a checked out repository.
 */
public final class WorkingTree {

    private WorkingTree() {
    }

    /**
     * All regular files below the root as sorted, '/'-separated relative paths,
     * without the contents of the .git directory.
     */
    public static List<String> listFiles(Path root) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                    .filter(Files::isRegularFile)
                    .map(root::relativize)
                    .filter(p -> !p.startsWith(".git"))
                    .map(p -> p.toString().replace('\\', '/'))
                    .sorted()
                    .toList();
        }
    }
}
