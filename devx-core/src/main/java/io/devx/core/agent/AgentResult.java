package io.devx.core.agent;

import io.devx.core.model.Conversation;
import io.devx.core.model.UsageMetadata;
import io.devx.core.stream.DataQualityWarning;
import java.util.List;

public record AgentResult(
    String content,
    Conversation conversation,
    UsageMetadata usage,
    List<DataQualityWarning> warnings
) {
    public AgentResult {
        content = content == null ? "" : content;
        usage = usage == null ? UsageMetadata.ZERO : usage;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
