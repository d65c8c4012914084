package com.repo.defects.core;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Plugin interface for external static analysis tools.
 * Each implementation wraps one tool and knows which files it can check and
 * how to read its findings.
 */
public interface StaticAnalysisTool {

    /**
     * Unique identifier of the tool (e.g., "spotbugs", "cppcheck").
     */
    String getToolId();

    /**
     * File extensions this tool handles, including the leading dot.
     */
    Set<String> getSupportedExtensions();

    /**
     * Check if the tool is installed and can be started.
     */
    boolean isAvailable();

    /**
     * Run the tool on one file. Implementations never throw for tool failures:
     * a missing binary, a timeout or a crash is recorded in the returned
     * invocation.
     *
     * @param workingDir   directory the tool is started in (repository root)
     * @param relativePath file to check, relative to {@code workingDir}
     * @param timeout      maximum run time of this single invocation
     */
    ToolInvocation run(Path workingDir, String relativePath, Duration timeout);

    /**
     * Extract the findings reported by a successful invocation.
     */
    List<FindingSeverity> parseFindings(ToolInvocation invocation);

    /**
     * Whether a file with a supported extension should still be skipped.
     */
    default boolean accepts(String relativePath) {
        return true;
    }

    /**
     * Priority when several tools support the same extension.
     * Lower values = higher priority. Default is 100.
     */
    default int getPriority() {
        return 100;
    }
}
