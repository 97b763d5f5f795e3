package io.devx.core.repair;

import io.devx.core.model.Conversation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public record RepairResult(
    Conversation conversation,
    boolean discardHistory,
    List<String> orphanedIds,
    int orphanCount,
    int resultCount
) {
    public RepairResult {
        Objects.requireNonNull(conversation, "conversation must not be null");
        orphanedIds = orphanedIds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(orphanedIds));
    }

    public boolean changed() {
        return discardHistory;
    }

    public double orphanRatio() {
        return resultCount == 0 ? 0.0 : (double) orphanCount / resultCount;
    }
}
