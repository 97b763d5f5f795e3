package io.devx.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One role's contribution to a {@link Conversation}. Parts are never empty: an assistant turn built without
 * parts becomes the filler turn, a single empty {@link TextPart}.
 */
public record Turn(Role role, List<Part> parts) {

    public Turn {
        Objects.requireNonNull(role, "role must not be null");
        if (parts == null || parts.isEmpty()) {
            if (role != Role.ASSISTANT) {
                throw new IllegalArgumentException(role + " turn must have at least one part");
            }
            parts = List.of(new TextPart(""));
        } else {
            parts = List.copyOf(parts);
        }
    }

    public static Turn of(Role role, Part... parts) {
        return new Turn(role, List.of(parts));
    }

    public static Turn user(String text) {
        return new Turn(Role.USER, List.of(new TextPart(text)));
    }

    public static Turn assistant(String text) {
        return new Turn(Role.ASSISTANT, List.of(new TextPart(text)));
    }

    public static Turn system(String text) {
        return new Turn(Role.SYSTEM, List.of(new TextPart(text)));
    }

    public static Turn filler() {
        return new Turn(Role.ASSISTANT, List.of());
    }

    public boolean isFiller() {
        return role == Role.ASSISTANT
            && parts.size() == 1
            && parts.get(0) instanceof TextPart text
            && text.isEmpty();
    }

    public String text() {
        return parts.stream()
            .filter(TextPart.class::isInstance)
            .map(part -> ((TextPart) part).content())
            .collect(Collectors.joining());
    }

    public List<ToolCallPart> toolCalls() {
        List<ToolCallPart> calls = new ArrayList<>();
        for (Part part : parts) {
            if (part instanceof ToolCallPart call) {
                calls.add(call);
            }
        }
        return calls;
    }

    public List<ToolResultPart> toolResults() {
        List<ToolResultPart> results = new ArrayList<>();
        for (Part part : parts) {
            if (part instanceof ToolResultPart result) {
                results.add(result);
            }
        }
        return results;
    }
}
