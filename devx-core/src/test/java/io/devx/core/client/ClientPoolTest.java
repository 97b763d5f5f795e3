package io.devx.core.client;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicInteger;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

class ClientPoolTest {

    @Test
    void shouldReuseClientForSameKey() {
        try (ClientPool pool = new ClientPool()) {
            OkHttpClient first = pool.http(ClientKey.of("openai", "https://api.openai.com/v1", "sk-1"));
            OkHttpClient second = pool.http(ClientKey.of("openai", "https://api.openai.com/v1", "sk-1"));
            OkHttpClient other = pool.http(ClientKey.of("openai", "https://api.openai.com/v1", "sk-2"));

            assertThat(second).isSameAs(first);
            assertThat(other).isNotSameAs(first);
            assertThat(other.connectionPool()).isSameAs(first.connectionPool());
            assertThat(pool.size()).isEqualTo(2);
        }
    }

    @Test
    void shouldCreateEachTypeOnceAndCloseOnShutdown() {
        AtomicInteger created = new AtomicInteger();
        AtomicInteger closed = new AtomicInteger();
        ClientKey key = ClientKey.of("bedrock", "us-east-1", "profile:default");
        ClientPool pool = new ClientPool();

        AutoCloseable first = pool.get(key, AutoCloseable.class, () -> {
            created.incrementAndGet();
            return closed::incrementAndGet;
        });
        AutoCloseable second = pool.get(key, AutoCloseable.class, () -> {
            created.incrementAndGet();
            return closed::incrementAndGet;
        });
        pool.close();

        assertThat(second).isSameAs(first);
        assertThat(created.get()).isEqualTo(1);
        assertThat(closed.get()).isEqualTo(1);
        assertThat(pool.size()).isZero();
    }

    @Test
    void shouldNotKeepCredentialInKey() {
        ClientKey key = ClientKey.of("anthropic", "https://api.anthropic.com/v1", "sk-ant-secret");

        assertThat(key.credentialFingerprint()).hasSize(16).doesNotContain("secret");
        assertThat(key.toString()).doesNotContain("sk-ant-secret");
    }
}
