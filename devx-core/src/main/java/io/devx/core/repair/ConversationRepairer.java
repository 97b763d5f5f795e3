package io.devx.core.repair;

import io.devx.core.model.Conversation;
import io.devx.core.model.Part;
import io.devx.core.model.Role;
import io.devx.core.model.TextPart;
import io.devx.core.model.ToolCallPart;
import io.devx.core.model.ToolResultPart;
import io.devx.core.model.Turn;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects tool results whose originating call is no longer in the history. A few orphans are left for the
 * translator to drop; a history dominated by orphans is replaced by the latest genuine user request.
 */
public final class ConversationRepairer {
    private static final Logger LOG = LoggerFactory.getLogger(ConversationRepairer.class);

    private final RepairPolicy policy;

    public ConversationRepairer() {
        this(RepairPolicy.defaults());
    }

    public ConversationRepairer(RepairPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public RepairPolicy policy() {
        return policy;
    }

    public RepairResult repair(Conversation conversation) {
        Objects.requireNonNull(conversation, "conversation must not be null");

        Set<String> issued = new HashSet<>();
        for (Turn turn : conversation.turns()) {
            if (turn.role() != Role.ASSISTANT) {
                continue;
            }
            for (ToolCallPart call : turn.toolCalls()) {
                if (call.hasId()) {
                    issued.add(call.id());
                }
            }
        }

        int resultCount = 0;
        List<String> orphaned = new ArrayList<>();
        for (Turn turn : conversation.turns()) {
            if (turn.role() != Role.USER) {
                continue;
            }
            for (ToolResultPart result : turn.toolResults()) {
                resultCount++;
                if (result.toolCallId() == null || !issued.contains(result.toolCallId())) {
                    orphaned.add(result.toolCallId());
                }
            }
        }

        if (orphaned.isEmpty()) {
            return new RepairResult(conversation, false, List.of(), 0, resultCount);
        }

        double ratio = (double) orphaned.size() / resultCount;
        if (orphaned.size() < policy.minOrphans() || ratio < policy.minOrphanRatio()) {
            LOG.debug("{} orphaned tool result(s) of {}; leaving history intact", orphaned.size(), resultCount);
            return new RepairResult(conversation, false, orphaned, orphaned.size(), resultCount);
        }

        String request = latestUserRequest(conversation).orElseGet(policy::fallbackPrompt);
        List<Turn> kept = conversation.turns().stream()
            .filter(turn -> turn.role() == Role.SYSTEM)
            .collect(Collectors.toCollection(ArrayList::new));
        kept.add(Turn.user(request));

        LOG.warn(
            "Discarding conversation history: {} of {} tool result(s) reference unknown calls",
            orphaned.size(),
            resultCount
        );
        return new RepairResult(new Conversation(kept), true, orphaned, orphaned.size(), resultCount);
    }

    /**
     * Most recent user text that is not an internal analysis prompt. Turns carrying only tool results are
     * skipped.
     */
    public Optional<String> latestUserRequest(Conversation conversation) {
        List<Turn> turns = conversation.turns();
        for (int i = turns.size() - 1; i >= 0; i--) {
            Turn turn = turns.get(i);
            if (turn.role() != Role.USER) {
                continue;
            }
            String text = joinText(turn.parts());
            if (!text.isBlank() && !policy.isAnalysisPrompt(text)) {
                return Optional.of(text);
            }
        }
        return Optional.empty();
    }

    private static String joinText(List<Part> parts) {
        return parts.stream()
            .filter(TextPart.class::isInstance)
            .map(part -> ((TextPart) part).content())
            .filter(content -> !content.isBlank())
            .collect(Collectors.joining(" "));
    }
}
