package io.devx.core.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.devx.core.error.UpstreamProtocolException;
import io.devx.core.model.FinishReason;
import io.devx.core.model.ModelResponse;
import io.devx.core.model.ToolCallPart;
import io.devx.core.model.UsageMetadata;
import io.devx.core.stream.DataQualityWarning;
import org.junit.jupiter.api.Test;

class ResponseTranslatorTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldTranslateAnthropicTextAndToolUse() throws Exception {
        ModelResponse response = new AnthropicResponseTranslator("anthropic").translate(mapper.readTree("""
            {
              "content": [
                {"type": "text", "text": "Let me look."},
                {"type": "tool_use", "id": "toolu_1", "name": "list_directory", "input": {"path": "/tmp"}}
              ],
              "stop_reason": "tool_use",
              "usage": {"input_tokens": 12, "output_tokens": 7}
            }
            """));

        assertThat(response.turn().text()).isEqualTo("Let me look.");
        assertThat(response.turn().toolCalls()).containsExactly(
            new ToolCallPart("toolu_1", "list_directory", mapper.readTree("{\"path\":\"/tmp\"}"))
        );
        assertThat(response.finishReason()).isEqualTo(FinishReason.STOP);
        assertThat(response.usage()).isEqualTo(new UsageMetadata(12, 7));
    }

    @Test
    void shouldMapStopReasons() {
        assertThat(AnthropicResponseTranslator.finishReason("max_tokens")).isEqualTo(FinishReason.MAX_OUTPUT_REACHED);
        assertThat(AnthropicResponseTranslator.finishReason("refusal")).isEqualTo(FinishReason.CONTENT_FILTERED);
        assertThat(OpenAiResponseTranslator.finishReason("length")).isEqualTo(FinishReason.MAX_OUTPUT_REACHED);
        assertThat(OpenAiResponseTranslator.finishReason("content_filter")).isEqualTo(FinishReason.CONTENT_FILTERED);
        assertThat(GeminiResponseTranslator.finishReason("SAFETY")).isEqualTo(FinishReason.CONTENT_FILTERED);
        assertThat(GeminiResponseTranslator.finishReason("SOMETHING_NEW")).isEqualTo(FinishReason.OTHER);
    }

    @Test
    void shouldProduceFillerTurnForEmptyAnthropicContent() throws Exception {
        ModelResponse response = new AnthropicResponseTranslator("anthropic")
            .translate(mapper.readTree("{\"content\": [], \"stop_reason\": \"end_turn\"}"));

        assertThat(response.turn().isFiller()).isTrue();
    }

    @Test
    void shouldParseOpenAiArgumentStringsAndWarnOnBadOnes() throws Exception {
        ModelResponse response = new OpenAiResponseTranslator("openai").translate(mapper.readTree("""
            {
              "choices": [{
                "message": {
                  "content": null,
                  "tool_calls": [
                    {"id": "call_a", "function": {"name": "read_file", "arguments": "{\\"path\\":\\"x\\"}"}},
                    {"id": "call_b", "function": {"name": "read_file", "arguments": "{\\"path\\":"}},
                    {"function": {"name": "list_directory", "arguments": ""}}
                  ]
                },
                "finish_reason": "tool_calls"
              }],
              "usage": {"prompt_tokens": 4, "completion_tokens": 9}
            }
            """));

        assertThat(response.turn().toolCalls()).extracting(ToolCallPart::id)
            .startsWith("call_a", "call_b")
            .hasSize(3);
        assertThat(response.turn().toolCalls().get(2).id()).startsWith("call_").isNotIn("call_a", "call_b");
        assertThat(response.turn().toolCalls().get(0).arguments().path("path").asText()).isEqualTo("x");
        assertThat(response.warnings()).extracting(DataQualityWarning::kind).containsExactly(
            DataQualityWarning.Kind.UNPARSABLE_ARGUMENTS,
            DataQualityWarning.Kind.EMPTY_ARGUMENTS
        );
        assertThat(response.warnings().get(0).toolCallId()).isEqualTo("call_b");
        assertThat(response.usage().totalUnits()).isEqualTo(13);
    }

    @Test
    void shouldRejectOpenAiResponseWithoutChoices() throws Exception {
        assertThatThrownBy(() -> new OpenAiResponseTranslator("openai").translate(mapper.readTree("{\"choices\": []}")))
            .isInstanceOf(UpstreamProtocolException.class)
            .hasMessageContaining("[openai/");
    }

    @Test
    void shouldSynthesizeGeminiCallIdsAndSkipThoughts() throws Exception {
        ModelResponse response = new GeminiResponseTranslator("gemini").translate(mapper.readTree("""
            {
              "candidates": [{
                "content": {"role": "model", "parts": [
                  {"text": "thinking...", "thought": true},
                  {"text": "Reading both."},
                  {"functionCall": {"name": "read_file", "args": {"path": "a"}}},
                  {"functionCall": {"name": "read_file", "args": {"path": "b"}}}
                ]},
                "finishReason": "STOP"
              }],
              "usageMetadata": {"promptTokenCount": 5, "candidatesTokenCount": 6}
            }
            """));

        assertThat(response.turn().text()).isEqualTo("Reading both.");
        assertThat(response.turn().toolCalls()).extracting(ToolCallPart::id)
            .doesNotHaveDuplicates()
            .allMatch(id -> id.startsWith("call_"));
        assertThat(response.usage()).isEqualTo(new UsageMetadata(5, 6));
    }

    @Test
    void shouldNotReuseGeneratedGeminiIdsAcrossResponses() throws Exception {
        GeminiResponseTranslator translator = new GeminiResponseTranslator("gemini");
        String body = """
            {"candidates": [{"content": {"parts": [{"functionCall": {"name": "read_file", "args": {}}}]}}]}
            """;

        String first = translator.translate(mapper.readTree(body)).turn().toolCalls().get(0).id();
        String second = translator.translate(mapper.readTree(body)).turn().toolCalls().get(0).id();

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void shouldKeepNonObjectOpenAiArguments() throws Exception {
        ModelResponse response = new OpenAiResponseTranslator("openai").translate(mapper.readTree("""
            {"choices": [{"message": {"tool_calls": [
              {"id": "call_s", "function": {"name": "sum", "arguments": "[1,2]"}}
            ]}, "finish_reason": "tool_calls"}]}
            """));

        assertThat(response.turn().toolCalls().get(0).arguments().toString()).isEqualTo("[1,2]");
        assertThat(response.warnings()).isEmpty();
    }

    @Test
    void shouldTreatBlockedGeminiPromptAsFilteredFiller() throws Exception {
        ModelResponse response = new GeminiResponseTranslator("gemini")
            .translate(mapper.readTree("{\"promptFeedback\": {\"blockReason\": \"SAFETY\"}}"));

        assertThat(response.turn().isFiller()).isTrue();
        assertThat(response.finishReason()).isEqualTo(FinishReason.CONTENT_FILTERED);
    }
}
