package io.devx.core.model;

/**
 * Per-request generation settings. Null sampling fields are left out of the wire request.
 */
public record GenerationOptions(
    String model,
    String systemInstruction,
    int maxOutputTokens,
    Double temperature,
    Double topP,
    Integer topK
) {
    public static final int DEFAULT_MAX_OUTPUT_TOKENS = 4096;

    public GenerationOptions {
        model = model == null ? "" : model.trim();
        systemInstruction = systemInstruction == null ? "" : systemInstruction;
        maxOutputTokens = maxOutputTokens <= 0 ? DEFAULT_MAX_OUTPUT_TOKENS : maxOutputTokens;
    }

    public static GenerationOptions forModel(String model) {
        return new GenerationOptions(model, null, DEFAULT_MAX_OUTPUT_TOKENS, null, null, null);
    }

    public GenerationOptions withSystemInstruction(String instruction) {
        return new GenerationOptions(model, instruction, maxOutputTokens, temperature, topP, topK);
    }

    public GenerationOptions withMaxOutputTokens(int tokens) {
        return new GenerationOptions(model, systemInstruction, tokens, temperature, topP, topK);
    }

    public GenerationOptions withTemperature(Double value) {
        return new GenerationOptions(model, systemInstruction, maxOutputTokens, value, topP, topK);
    }
}
