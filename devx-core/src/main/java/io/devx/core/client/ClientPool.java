package io.devx.core.client;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Long-lived transport clients, one per {@link ClientKey} and client type. Clients are created on first use
 * and live until the pool is closed.
 */
public final class ClientPool implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ClientPool.class);

    private final OkHttpClient baseHttpClient;
    private final Map<Entry, Object> clients = new ConcurrentHashMap<>();

    public ClientPool() {
        this(HttpSettings.defaults());
    }

    public ClientPool(HttpSettings settings) {
        HttpSettings http = settings == null ? HttpSettings.defaults() : settings;
        this.baseHttpClient = new OkHttpClient.Builder()
            .connectTimeout(http.connectTimeout())
            .readTimeout(http.readTimeout())
            .writeTimeout(http.writeTimeout())
            .build();
    }

    /**
     * OkHttp clients derived from one base client share its connection pool and dispatcher.
     */
    public OkHttpClient http(ClientKey key) {
        return get(key, OkHttpClient.class, () -> baseHttpClient.newBuilder().build());
    }

    public <T> T get(ClientKey key, Class<T> type, Supplier<? extends T> factory) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        Object client = clients.computeIfAbsent(new Entry(key, type), ignored -> {
            LOG.debug("Creating {} for {} at {}", type.getSimpleName(), key.backend(), key.endpoint());
            return factory.get();
        });
        return type.cast(client);
    }

    public int size() {
        return clients.size();
    }

    @Override
    public void close() {
        for (Map.Entry<Entry, Object> entry : clients.entrySet()) {
            Object client = entry.getValue();
            try {
                if (client instanceof AutoCloseable closeable) {
                    closeable.close();
                }
            } catch (Exception e) {
                LOG.warn("Failed to close {} client: {}", entry.getKey().key().backend(), e.getMessage());
            }
        }
        clients.clear();
        baseHttpClient.dispatcher().executorService().shutdown();
        baseHttpClient.connectionPool().evictAll();
    }

    private record Entry(ClientKey key, Class<?> type) {
    }
}
