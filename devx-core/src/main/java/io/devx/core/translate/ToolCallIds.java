package io.devx.core.translate;

import java.util.UUID;

/**
 * Ids for tool calls a backend returned without one. They must stay unique for the whole conversation, since
 * the results sent back later are matched to their calls by id.
 */
final class ToolCallIds {
    private static final String PREFIX = "call_";

    private ToolCallIds() {
    }

    static String synthesize() {
        return PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }

    static String orSynthesize(String announced) {
        return announced == null || announced.isBlank() ? synthesize() : announced;
    }
}
