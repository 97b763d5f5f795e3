package io.devx.core.stream;

import java.util.Objects;

public record DataQualityWarning(String backend, String toolCallId, String toolName, Kind kind, String detail) {

    public enum Kind {
        EMPTY_ARGUMENTS,
        UNPARSABLE_ARGUMENTS,
        TRUNCATED,
        PROTOCOL_VIOLATION
    }

    public DataQualityWarning {
        Objects.requireNonNull(kind, "kind must not be null");
        backend = backend == null ? "" : backend;
        toolName = toolName == null ? "" : toolName;
        detail = detail == null ? "" : detail;
    }

    public String describe() {
        String call = toolCallId == null ? "" : " tool call " + toolCallId + (toolName.isBlank() ? "" : " (" + toolName + ")");
        return "[" + backend + "] " + kind + call + (detail.isBlank() ? "" : ": " + detail);
    }
}
