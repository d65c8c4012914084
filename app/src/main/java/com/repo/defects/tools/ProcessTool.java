package com.repo.defects.tools;

import com.repo.defects.core.StaticAnalysisTool;
import com.repo.defects.core.ToolInvocation;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Base class for tools that run as an external process.
 * Stdout and stderr are redirected to temporary files so a chatty tool can
 * never block on a full pipe while the timeout is enforced.
 */
public abstract class ProcessTool implements StaticAnalysisTool {

    private final String executable;
    private Boolean available;

    protected ProcessTool(String executable) {
        this.executable = executable;
    }

    /**
     * Tool arguments for checking one file; the executable is prepended.
     */
    protected abstract List<String> arguments(String relativePath);

    /**
     * Arguments of the cheap call used to check availability.
     */
    protected List<String> versionArguments() {
        return List.of("--version");
    }

    @Override
    public synchronized boolean isAvailable() {
        if (available == null) {
            available = checkAvailable();
        }
        return available;
    }

    private boolean checkAvailable() {
        try {
            List<String> command = new ArrayList<>();
            command.add(executable);
            command.addAll(versionArguments());
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            Process process = pb.start();
            boolean finished = process.waitFor(5, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                return false;
            }
            return process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public ToolInvocation run(Path workingDir, String relativePath, Duration timeout) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(arguments(relativePath));

        Path stdoutFile = null;
        Path stderrFile = null;
        try {
            stdoutFile = Files.createTempFile(getToolId() + "-out", ".log");
            stderrFile = Files.createTempFile(getToolId() + "-err", ".log");

            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(workingDir.toFile());
            pb.redirectOutput(stdoutFile.toFile());
            pb.redirectError(stderrFile.toFile());
            Process process = pb.start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                return ToolInvocation.timedOut(getToolId(), relativePath);
            }
            return ToolInvocation.completed(getToolId(), relativePath, process.exitValue(),
                    Files.readString(stdoutFile, StandardCharsets.UTF_8),
                    Files.readString(stderrFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            return ToolInvocation.launchFailed(getToolId(), relativePath, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolInvocation.launchFailed(getToolId(), relativePath, "interrupted");
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        File handle = file.toFile();
        if (handle.exists() && !handle.delete()) {
            handle.deleteOnExit();
        }
    }
}
