package io.devx.core.translate;

import com.fasterxml.jackson.databind.JsonNode;
import io.devx.core.stream.StreamEvent;
import java.util.List;

/**
 * Turns provider stream chunks into {@link StreamEvent}s. Stateful; one instance per stream.
 */
public interface StreamDecoder {
    List<StreamEvent> decode(JsonNode chunk);

    /**
     * Called once the transport is exhausted. Emits the closing {@link StreamEvent.MessageEnd} if the
     * provider never sent its own terminal chunk.
     */
    List<StreamEvent> finish();
}
