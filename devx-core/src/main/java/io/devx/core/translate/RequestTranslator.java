package io.devx.core.translate;

import io.devx.core.model.Conversation;
import io.devx.core.model.GenerationOptions;
import io.devx.core.model.ToolSchema;
import java.util.List;

public interface RequestTranslator {
    Dialect dialect();

    ProviderRequest translate(Conversation conversation, List<ToolSchema> tools, GenerationOptions options);
}
