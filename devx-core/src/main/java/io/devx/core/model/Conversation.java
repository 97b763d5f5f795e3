package io.devx.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable ordered history of turns. Appending returns a new conversation; existing history is never
 * edited in place.
 */
public record Conversation(List<Turn> turns) {

    private static final Conversation EMPTY = new Conversation(List.of());

    public Conversation {
        turns = turns == null ? List.of() : List.copyOf(turns);
    }

    public static Conversation empty() {
        return EMPTY;
    }

    public static Conversation of(Turn... turns) {
        return new Conversation(List.of(turns));
    }

    public Conversation append(Turn turn) {
        List<Turn> next = new ArrayList<>(turns.size() + 1);
        next.addAll(turns);
        next.add(turn);
        return new Conversation(next);
    }

    public int size() {
        return turns.size();
    }

    public boolean isEmpty() {
        return turns.isEmpty();
    }

    public Turn last() {
        if (turns.isEmpty()) {
            throw new IllegalStateException("conversation is empty");
        }
        return turns.get(turns.size() - 1);
    }
}
