package io.devx.core.translate;

import com.fasterxml.jackson.databind.JsonNode;
import io.devx.core.model.ModelResponse;

public interface ResponseTranslator {
    ModelResponse translate(JsonNode body);
}
