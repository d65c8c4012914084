package com.repo.defects.tools;

import com.repo.defects.core.FindingSeverity;
import com.repo.defects.core.ToolInvocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * SpotBugs in text mode. Every bug line starts with its priority letter
 * (H, M or L) followed by a space.
 */
public class SpotBugsTool extends ProcessTool {

    private static final Set<String> EXTENSIONS = Set.of(".java");

    public SpotBugsTool() {
        super("spotbugs");
    }

    @Override
    public String getToolId() {
        return "spotbugs";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public boolean accepts(String relativePath) {
        return !relativePath.endsWith("module-info.java");
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    protected List<String> arguments(String relativePath) {
        return List.of("-textui", relativePath);
    }

    @Override
    protected List<String> versionArguments() {
        return List.of("-version");
    }

    @Override
    public List<FindingSeverity> parseFindings(ToolInvocation invocation) {
        List<FindingSeverity> findings = new ArrayList<>();
        for (String line : invocation.stdout().split("\\R")) {
            if (line.length() < 2 || line.charAt(1) != ' ') {
                continue;
            }
            switch (line.charAt(0)) {
                case 'H' -> findings.add(FindingSeverity.HIGH);
                case 'M' -> findings.add(FindingSeverity.MEDIUM);
                case 'L' -> findings.add(FindingSeverity.LOW);
                default -> {
                }
            }
        }
        return findings;
    }
}
