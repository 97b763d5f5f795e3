package io.devx.core.stream;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.devx.core.error.CancelledException;
import io.devx.core.error.Stage;
import io.devx.core.model.FinishReason;
import io.devx.core.model.ModelResponse;
import io.devx.core.model.Part;
import io.devx.core.model.Role;
import io.devx.core.model.TextPart;
import io.devx.core.model.ToolCallPart;
import io.devx.core.model.Turn;
import io.devx.core.model.UsageMetadata;
import io.devx.core.stream.DataQualityWarning.Kind;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds one assistant turn from {@link StreamEvent}s. Each tool call id moves from idle to accumulating
 * on its start event and to closed on its end event; several ids may accumulate at once. Malformed input
 * never throws: it is reported through {@link StreamListener#onWarning} and kept in {@link #warnings()}.
 *
 * <p>Not thread-safe. One instance serves one stream.
 */
public final class StreamReassembler {
    private static final Logger LOG = LoggerFactory.getLogger(StreamReassembler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final String backend;
    private final StreamListener listener;
    private final List<Slot> slots = new ArrayList<>();
    private final Map<String, CallSlot> open = new LinkedHashMap<>();
    private final Set<String> closed = new HashSet<>();
    private final List<DataQualityWarning> warnings = new ArrayList<>();

    private FinishReason finishReason;
    private UsageMetadata usage = UsageMetadata.ZERO;
    private boolean ended;
    private boolean cancelled;
    private boolean emitted;

    public StreamReassembler(String backend, StreamListener listener) {
        this.backend = backend == null ? "" : backend;
        this.listener = listener == null ? StreamListener.NOOP : listener;
    }

    public void accept(StreamEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        if (cancelled) {
            return;
        }
        if (ended) {
            violation(null, "event after message end: " + event.getClass().getSimpleName());
            return;
        }

        if (event instanceof StreamEvent.TextDelta delta) {
            onText(delta.text());
        } else if (event instanceof StreamEvent.ToolCallStart start) {
            onStart(start);
        } else if (event instanceof StreamEvent.ToolCallArgumentDelta delta) {
            CallSlot slot = open.get(delta.id());
            if (slot == null) {
                violation(delta.id(), "argument fragment for unknown tool call");
                return;
            }
            slot.arguments.append(delta.fragment());
        } else if (event instanceof StreamEvent.ToolCallEnd end) {
            CallSlot slot = open.remove(end.id());
            if (slot == null) {
                violation(end.id(), "end for unknown tool call");
                return;
            }
            complete(slot, false);
        } else if (event instanceof StreamEvent.MessageEnd end) {
            onMessageEnd(end);
        }
    }

    public void acceptAll(Iterable<? extends StreamEvent> events) {
        for (StreamEvent event : events) {
            accept(event);
        }
    }

    public void cancel() {
        cancelled = true;
        slots.clear();
        open.clear();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isComplete() {
        return ended;
    }

    /**
     * True once anything (text, a tool call or a warning) has been handed to the listener.
     */
    public boolean hasEmitted() {
        return emitted;
    }

    public List<DataQualityWarning> warnings() {
        return List.copyOf(warnings);
    }

    public ModelResponse result() {
        if (cancelled) {
            throw new CancelledException(backend, Stage.STREAM);
        }
        if (!ended) {
            throw new IllegalStateException("stream has not ended");
        }
        List<Part> parts = new ArrayList<>();
        for (Slot slot : slots) {
            Part part = slot.toPart();
            if (part instanceof TextPart text && text.isEmpty()) {
                continue;
            }
            parts.add(part);
        }
        return new ModelResponse(new Turn(Role.ASSISTANT, parts), finishReason, usage, warnings);
    }

    private void onText(String text) {
        if (text.isEmpty()) {
            return;
        }
        TextSlot target;
        if (!slots.isEmpty() && slots.get(slots.size() - 1) instanceof TextSlot last) {
            target = last;
        } else {
            target = new TextSlot();
            slots.add(target);
        }
        target.text.append(text);
        emitted = true;
        listener.onText(text);
    }

    private void onStart(StreamEvent.ToolCallStart start) {
        if (open.containsKey(start.id()) || closed.contains(start.id())) {
            violation(start.id(), "duplicate start for tool call");
            return;
        }
        CallSlot slot = new CallSlot(start.id(), start.name());
        open.put(start.id(), slot);
        slots.add(slot);
    }

    private void onMessageEnd(StreamEvent.MessageEnd end) {
        for (CallSlot slot : new ArrayList<>(open.values())) {
            complete(slot, true);
        }
        open.clear();
        finishReason = end.finishReason();
        usage = end.usage();
        ended = true;
        listener.onComplete(finishReason, usage);
    }

    private void complete(CallSlot slot, boolean truncated) {
        closed.add(slot.id);
        String raw = slot.arguments.toString();
        JsonNode arguments = JsonNodeFactory.instance.objectNode();
        if (truncated) {
            warn(slot, Kind.TRUNCATED, "stream ended before the tool call was closed");
            JsonNode parsed = tryParse(raw);
            if (parsed != null) {
                arguments = parsed;
            }
        } else if (raw.isBlank()) {
            warn(slot, Kind.EMPTY_ARGUMENTS, "no argument fragments received");
        } else {
            JsonNode parsed = tryParse(raw);
            if (parsed == null) {
                warn(slot, Kind.UNPARSABLE_ARGUMENTS, "arguments are not valid JSON: " + abbreviate(raw));
            } else {
                arguments = parsed;
            }
        }
        slot.part = new ToolCallPart(slot.id, slot.name, arguments);
        emitted = true;
        listener.onToolCall(slot.part);
    }

    private JsonNode tryParse(String raw) {
        if (raw.isBlank()) {
            return null;
        }
        try {
            JsonNode node = MAPPER.readTree(raw);
            return node == null || node.isMissingNode() ? null : node;
        } catch (IOException e) {
            return null;
        }
    }

    private void violation(String id, String detail) {
        CallSlot known = id == null ? null : open.get(id);
        DataQualityWarning warning = new DataQualityWarning(
            backend,
            id,
            known == null ? "" : known.name,
            Kind.PROTOCOL_VIOLATION,
            detail
        );
        record(warning);
    }

    private void warn(CallSlot slot, Kind kind, String detail) {
        record(new DataQualityWarning(backend, slot.id, slot.name, kind, detail));
    }

    private void record(DataQualityWarning warning) {
        LOG.warn("Stream data quality warning: {}", warning.describe());
        warnings.add(warning);
        emitted = true;
        listener.onWarning(warning);
    }

    private static String abbreviate(String raw) {
        return raw.length() <= 80 ? raw : raw.substring(0, 80) + "...";
    }

    private interface Slot {
        Part toPart();
    }

    private static final class TextSlot implements Slot {
        private final StringBuilder text = new StringBuilder();

        @Override
        public Part toPart() {
            return new TextPart(text.toString());
        }
    }

    private static final class CallSlot implements Slot {
        private final String id;
        private final String name;
        private final StringBuilder arguments = new StringBuilder();
        private ToolCallPart part;

        private CallSlot(String id, String name) {
            this.id = id;
            this.name = name;
        }

        @Override
        public Part toPart() {
            return part;
        }
    }
}
