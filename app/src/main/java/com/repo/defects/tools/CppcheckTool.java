package com.repo.defects.tools;

import com.repo.defects.core.FindingSeverity;
import com.repo.defects.core.ToolInvocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * cppcheck for C and C++ sources. Findings are printed to stderr using a
 * fixed template that starts with the severity.
 */
public class CppcheckTool extends ProcessTool {

    private static final Set<String> EXTENSIONS = Set.of(".c", ".cpp", ".h", ".hpp");

    private static final Pattern FINDING = Pattern.compile(
            "^(error|warning|style|performance|portability):");

    public CppcheckTool() {
        super("cppcheck");
    }

    @Override
    public String getToolId() {
        return "cppcheck";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    protected List<String> arguments(String relativePath) {
        return List.of(
                "--enable=warning,style,performance,portability",
                "--quiet",
                "--template={severity}:{file}:{line}:{message}",
                relativePath);
    }

    @Override
    public List<FindingSeverity> parseFindings(ToolInvocation invocation) {
        List<FindingSeverity> findings = new ArrayList<>();
        for (String line : invocation.stderr().split("\\R")) {
            Matcher m = FINDING.matcher(line.trim());
            if (!m.find()) {
                continue;
            }
            findings.add(switch (m.group(1)) {
                case "error" -> FindingSeverity.HIGH;
                case "warning" -> FindingSeverity.MEDIUM;
                default -> FindingSeverity.LOW;
            });
        }
        return findings;
    }
}
