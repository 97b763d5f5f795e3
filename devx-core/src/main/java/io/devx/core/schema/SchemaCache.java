package io.devx.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.devx.core.model.ToolSchema;
import io.devx.core.translate.Dialect;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translated tool declarations keyed by dialect and the fingerprint of the whole schema list. Reads never
 * lock; two threads missing on the same key may both compute, the second write wins with an equal value.
 * Once {@code maxEntries} is exceeded the oldest inserted entry is evicted.
 */
public final class SchemaCache {
    private static final Logger LOG = LoggerFactory.getLogger(SchemaCache.class);
    public static final int DEFAULT_MAX_ENTRIES = 64;

    private final int maxEntries;
    private final Map<Key, JsonNode> entries = new ConcurrentHashMap<>();
    private final Queue<Key> insertionOrder = new ConcurrentLinkedQueue<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public SchemaCache() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public SchemaCache(int maxEntries) {
        this.maxEntries = Math.max(1, maxEntries);
    }

    public JsonNode getOrCompute(Dialect dialect, List<ToolSchema> schemas, Function<List<ToolSchema>, JsonNode> translate) {
        Objects.requireNonNull(dialect, "dialect must not be null");
        Objects.requireNonNull(translate, "translate must not be null");
        List<ToolSchema> tools = schemas == null ? List.of() : List.copyOf(schemas);
        Key key = new Key(dialect, fingerprint(tools));

        JsonNode cached = entries.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached.deepCopy();
        }

        misses.incrementAndGet();
        LOG.debug("Schema cache miss for {} ({} tool(s))", dialect, tools.size());
        JsonNode translated = Objects.requireNonNull(translate.apply(tools), "translated schema must not be null");
        if (entries.put(key, translated.deepCopy()) == null) {
            insertionOrder.add(key);
            evictOverflow();
        }
        return translated;
    }

    public static String fingerprint(List<ToolSchema> schemas) {
        String joined = schemas.stream().map(ToolSchema::fingerprint).collect(Collectors.joining(","));
        return CanonicalJson.sha256(joined);
    }

    public int size() {
        return entries.size();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public void clear() {
        entries.clear();
        insertionOrder.clear();
    }

    private void evictOverflow() {
        while (entries.size() > maxEntries) {
            Key oldest = insertionOrder.poll();
            if (oldest == null) {
                return;
            }
            entries.remove(oldest);
        }
    }

    private record Key(Dialect dialect, String fingerprint) {
    }
}
