package io.devx.core.agent;

import io.devx.core.model.Conversation;

public class TurnLimitExceededException extends RuntimeException {
    private final int limit;
    private final Conversation conversation;

    public TurnLimitExceededException(int limit, Conversation conversation) {
        super("Reached the maximum of " + limit + " model turn(s) without a final answer");
        this.limit = limit;
        this.conversation = conversation;
    }

    public int limit() {
        return limit;
    }

    public Conversation conversation() {
        return conversation;
    }
}
