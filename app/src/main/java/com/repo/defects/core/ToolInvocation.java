package com.repo.defects.core;

/**
 * Captured result of running one tool on one file.
 */
public record ToolInvocation(
        /** Tool identifier */
        String tool,

        /** Repository-relative path of the checked file */
        String file,

        /** Process exit status, -1 if the process never finished */
        int exitCode,

        String stdout,

        String stderr,

        /** True if the invocation was killed after its timeout */
        boolean timedOut,

        /** Why the process could not be started, or null */
        String launchError) {

    public static ToolInvocation completed(String tool, String file, int exitCode, String stdout, String stderr) {
        return new ToolInvocation(tool, file, exitCode, stdout, stderr, false, null);
    }

    public static ToolInvocation timedOut(String tool, String file) {
        return new ToolInvocation(tool, file, -1, "", "", true, null);
    }

    public static ToolInvocation launchFailed(String tool, String file, String reason) {
        return new ToolInvocation(tool, file, -1, "", "", false, reason);
    }

    public boolean succeeded() {
        return !timedOut && launchError == null && exitCode == 0;
    }
}
