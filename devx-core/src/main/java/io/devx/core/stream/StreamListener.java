package io.devx.core.stream;

import io.devx.core.model.FinishReason;
import io.devx.core.model.ToolCallPart;
import io.devx.core.model.UsageMetadata;

public interface StreamListener {
    StreamListener NOOP = new StreamListener() {
    };

    default void onText(String text) {
    }

    default void onToolCall(ToolCallPart call) {
    }

    default void onWarning(DataQualityWarning warning) {
    }

    default void onComplete(FinishReason finishReason, UsageMetadata usage) {
    }
}
