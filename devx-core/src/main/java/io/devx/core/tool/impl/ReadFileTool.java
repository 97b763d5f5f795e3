package io.devx.core.tool.impl;

import io.devx.core.tool.Tool;
import io.devx.core.tool.ToolContext;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public final class ReadFileTool implements Tool {
    private static final int MAX_CHARS = 100_000;

    private final WorkspaceGuard guard = new WorkspaceGuard();

    @Override
    public String name() {
        return "read_file";
    }

    @Override
    public String description() {
        return "Read a UTF-8 text file inside the workspace";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "path", Map.of("type", "string", "description", "File path, relative to the workspace")
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
                return "Error: file not found: " + pathArg;
            }
            if (Files.isDirectory(target)) {
                return "Error: path is a directory: " + pathArg;
            }
            String content = Files.readString(target, StandardCharsets.UTF_8);
            if (content.length() > MAX_CHARS) {
                return content.substring(0, MAX_CHARS) + "\n[truncated " + (content.length() - MAX_CHARS) + " chars]";
            }
            return content;
        } catch (IOException | IllegalArgumentException e) {
            return "Error: " + e.getMessage();
        }
    }
}
