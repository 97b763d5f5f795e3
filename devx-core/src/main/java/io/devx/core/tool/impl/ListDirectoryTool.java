package io.devx.core.tool.impl;

import io.devx.core.tool.Tool;
import io.devx.core.tool.ToolContext;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public final class ListDirectoryTool implements Tool {
    private final WorkspaceGuard guard = new WorkspaceGuard();

    @Override
    public String name() {
        return "list_directory";
    }

    @Override
    public String description() {
        return "List the entries of a directory inside the workspace. Directories end with '/'.";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "path", Map.of("type", "string", "description", "Directory path, relative to the workspace")
            ),
            "required", List.of("path")
        );
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) {
        String pathArg = String.valueOf(input.getOrDefault("path", "")).trim();
        if (pathArg.isBlank()) {
            return "Error: path is required";
        }

        try {
            Path target = guard.resolve(context, pathArg);
            if (!Files.exists(target)) {
                return "Error: path not found: " + pathArg;
            }
            if (!Files.isDirectory(target)) {
                return "Error: not a directory: " + pathArg;
            }
            try (Stream<Path> entries = Files.list(target)) {
                String listing = entries
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .map(path -> path.getFileName() + (Files.isDirectory(path) ? "/" : ""))
                    .collect(Collectors.joining("\n"));
                return listing.isEmpty() ? "(empty directory)" : listing;
            }
        } catch (IOException | IllegalArgumentException e) {
            return "Error: " + e.getMessage();
        }
    }
}
