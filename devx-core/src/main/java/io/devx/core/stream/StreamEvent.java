package io.devx.core.stream;

import io.devx.core.model.FinishReason;
import io.devx.core.model.UsageMetadata;
import java.util.Objects;

/**
 * Provider-neutral streaming vocabulary. Per tool call id a stream carries one {@link ToolCallStart}, any
 * number of {@link ToolCallArgumentDelta}s and one {@link ToolCallEnd}; {@link MessageEnd} closes the stream.
 */
public interface StreamEvent {

    record TextDelta(String text) implements StreamEvent {
        public TextDelta {
            text = text == null ? "" : text;
        }
    }

    record ToolCallStart(String id, String name) implements StreamEvent {
        public ToolCallStart {
            Objects.requireNonNull(id, "id must not be null");
            name = name == null ? "" : name;
        }
    }

    record ToolCallArgumentDelta(String id, String fragment) implements StreamEvent {
        public ToolCallArgumentDelta {
            Objects.requireNonNull(id, "id must not be null");
            fragment = fragment == null ? "" : fragment;
        }
    }

    record ToolCallEnd(String id) implements StreamEvent {
        public ToolCallEnd {
            Objects.requireNonNull(id, "id must not be null");
        }
    }

    record MessageEnd(FinishReason finishReason, UsageMetadata usage) implements StreamEvent {
        public MessageEnd {
            finishReason = finishReason == null ? FinishReason.OTHER : finishReason;
            usage = usage == null ? UsageMetadata.ZERO : usage;
        }
    }
}
