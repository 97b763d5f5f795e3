package io.devx.core.tool;

import java.nio.file.Path;

public record ToolContext(Path workspace) {
}
