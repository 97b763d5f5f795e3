package io.devx.core.provider;

import io.devx.core.client.ClientPool;
import io.devx.core.repair.ConversationRepairer;
import io.devx.core.retry.RetryPolicy;
import io.devx.core.schema.SchemaCache;
import java.util.Objects;

/**
 * Collaborators shared by every provider of one session.
 */
public record AdapterContext(
    SchemaCache schemaCache,
    ConversationRepairer repairer,
    RetryPolicy retryPolicy,
    ClientPool clientPool
) {
    public AdapterContext {
        Objects.requireNonNull(schemaCache, "schemaCache must not be null");
        Objects.requireNonNull(repairer, "repairer must not be null");
        Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        Objects.requireNonNull(clientPool, "clientPool must not be null");
    }

    public static AdapterContext defaults(ClientPool clientPool) {
        return new AdapterContext(new SchemaCache(), new ConversationRepairer(), RetryPolicy.defaults(), clientPool);
    }

    public AdapterContext withRetryPolicy(RetryPolicy policy) {
        return new AdapterContext(schemaCache, repairer, policy, clientPool);
    }
}
