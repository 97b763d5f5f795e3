package io.devx.core.model;

import io.devx.core.stream.DataQualityWarning;
import java.util.List;
import java.util.Objects;

public record ModelResponse(
    Turn turn,
    FinishReason finishReason,
    UsageMetadata usage,
    List<DataQualityWarning> warnings
) {
    public ModelResponse {
        Objects.requireNonNull(turn, "turn must not be null");
        finishReason = finishReason == null ? FinishReason.STOP : finishReason;
        usage = usage == null ? UsageMetadata.ZERO : usage;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public ModelResponse(Turn turn, FinishReason finishReason, UsageMetadata usage) {
        this(turn, finishReason, usage, List.of());
    }

    public boolean hasToolCalls() {
        return !turn.toolCalls().isEmpty();
    }
}
