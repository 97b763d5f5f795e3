package io.devx.core.translate;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A translated request body plus what translation had to leave out.
 */
public record ProviderRequest(
    Dialect dialect,
    ObjectNode body,
    List<String> droppedToolResultIds,
    boolean historyDiscarded
) {
    public ProviderRequest {
        Objects.requireNonNull(dialect, "dialect must not be null");
        Objects.requireNonNull(body, "body must not be null");
        droppedToolResultIds = droppedToolResultIds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(droppedToolResultIds));
    }
}
