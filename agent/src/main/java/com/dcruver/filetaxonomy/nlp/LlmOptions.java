package com.dcruver.filetaxonomy.nlp;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Per-call generation settings. A null model means the provider's configured default.
 */
@Value
@Builder
@With
public class LlmOptions {
    String model;
    double temperature;
    int maxTokens;
    double topP;
    @Builder.Default
    List<String> stop = List.of();

    public static LlmOptions defaults() {
        return LlmOptions.builder().temperature(0.3).maxTokens(2000).topP(0.9).build();
    }

    public static LlmOptions creative() {
        return LlmOptions.builder().temperature(0.7).maxTokens(2000).topP(0.95).build();
    }

    public static LlmOptions deterministic() {
        return LlmOptions.builder().temperature(0.0).maxTokens(2000).topP(1.0).build();
    }
}
