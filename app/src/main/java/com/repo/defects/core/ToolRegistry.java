package com.repo.defects.core;

import java.util.*;

/**
 * Registry for static analysis tools.
 * Routes files to the tool registered for their extension.
 */
public class ToolRegistry {

    private final List<StaticAnalysisTool> tools;
    private final Map<String, StaticAnalysisTool> extensionMap;

    public ToolRegistry(List<StaticAnalysisTool> tools) {
        this.tools = new ArrayList<>(tools);
        this.extensionMap = buildExtensionMap();
    }

    private Map<String, StaticAnalysisTool> buildExtensionMap() {
        Map<String, StaticAnalysisTool> map = new HashMap<>();

        // Sort by priority (lower = higher priority)
        List<StaticAnalysisTool> sorted = new ArrayList<>(tools);
        sorted.sort(Comparator.comparingInt(StaticAnalysisTool::getPriority));

        for (StaticAnalysisTool tool : sorted) {
            if (!tool.isAvailable()) {
                System.out.println("  [SKIP] " + tool.getToolId() + " not available");
                continue;
            }

            for (String ext : tool.getSupportedExtensions()) {
                map.putIfAbsent(ext.toLowerCase(Locale.ROOT), tool);
            }
        }

        return map;
    }

    /**
     * Get the tool responsible for a file, if any.
     */
    public Optional<StaticAnalysisTool> getTool(String relativePath) {
        StaticAnalysisTool tool = extensionMap.get(getExtension(relativePath));
        if (tool == null || !tool.accepts(relativePath)) {
            return Optional.empty();
        }
        return Optional.of(tool);
    }

    public List<StaticAnalysisTool> getAvailableTools() {
        return tools.stream()
                .filter(StaticAnalysisTool::isAvailable)
                .toList();
    }

    public Set<String> getSupportedExtensions() {
        return extensionMap.keySet();
    }

    public void printSummary() {
        System.out.println("Available static analysis tools:");
        for (StaticAnalysisTool tool : getAvailableTools()) {
            System.out.printf("  [%s] %s%n", tool.getToolId(),
                    String.join(", ", new TreeSet<>(tool.getSupportedExtensions())));
        }
    }

    private String getExtension(String path) {
        int slash = path.lastIndexOf('/');
        String name = path.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
    }
}
