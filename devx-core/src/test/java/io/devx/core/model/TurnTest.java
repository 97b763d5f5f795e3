package io.devx.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class TurnTest {

    @Test
    void shouldReplaceEmptyAssistantTurnWithFiller() {
        Turn turn = new Turn(Role.ASSISTANT, List.of());

        assertThat(turn.parts()).containsExactly(new TextPart(""));
        assertThat(turn.isFiller()).isTrue();
        assertThat(Turn.filler()).isEqualTo(turn);
    }

    @Test
    void shouldRejectEmptyUserTurn() {
        assertThatThrownBy(() -> new Turn(Role.USER, List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("USER");
    }

    @Test
    void shouldSplitPartsByKind() throws Exception {
        ToolCallPart call = new ToolCallPart("t1", "list_directory", new ObjectMapper().readTree("{\"path\":\"/tmp\"}"));
        Turn turn = Turn.of(Role.ASSISTANT, new TextPart("Looking "), call, new TextPart("now"));

        assertThat(turn.text()).isEqualTo("Looking now");
        assertThat(turn.toolCalls()).containsExactly(call);
        assertThat(turn.toolResults()).isEmpty();
        assertThat(turn.isFiller()).isFalse();
    }

    @Test
    void shouldAppendWithoutTouchingOriginalConversation() {
        Conversation first = Conversation.of(Turn.user("hi"));
        Conversation second = first.append(Turn.assistant("hello"));

        assertThat(first.size()).isEqualTo(1);
        assertThat(second.size()).isEqualTo(2);
        assertThat(second.last().text()).isEqualTo("hello");
        assertThat(Conversation.empty().isEmpty()).isTrue();
    }

    @Test
    void shouldDefaultMissingToolArgumentsToEmptyObject() {
        ToolCallPart call = new ToolCallPart("t1", "read_file", null);

        assertThat(call.arguments().isObject()).isTrue();
        assertThat(call.arguments().size()).isZero();
        assertThat(new ToolCallPart(null, "read_file", null).hasId()).isFalse();
    }

    @Test
    void shouldRenderToolResultPayloadAsText() throws Exception {
        assertThat(ToolResultPart.ofText("t1", "plain").payloadAsText()).isEqualTo("plain");
        assertThat(new ToolResultPart("t1", new ObjectMapper().readTree("{\"files\":[\"a\"]}")).payloadAsText())
            .isEqualTo("{\"files\":[\"a\"]}");
        assertThat(new ToolResultPart("t1", null).payloadAsText()).isEmpty();
    }

    @Test
    void shouldSumUsageAndClampNegatives() {
        UsageMetadata total = new UsageMetadata(10, 5).plus(new UsageMetadata(-3, 2)).plus(null);

        assertThat(total).isEqualTo(new UsageMetadata(10, 7));
        assertThat(total.totalUnits()).isEqualTo(17);
    }
}
