package com.agentic.customergraph.llm;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Functional interface for Large Language Model completion.
 * Implementations handle the call to an LLM provider.
 */
@FunctionalInterface
public interface LLMFunction {

    /**
     * Generate a completion from the LLM.
     *
     * @param prompt the user prompt
     * @param systemPrompt optional system prompt
     * @param kwargs additional parameters (model, temperature, max_tokens)
     * @return CompletableFuture with the generated response text
     */
    CompletableFuture<String> apply(
        @NotNull String prompt,
        @Nullable String systemPrompt,
        @NotNull Map<String, Object> kwargs
    );

    default CompletableFuture<String> apply(@NotNull String prompt, @Nullable String systemPrompt) {
        return apply(prompt, systemPrompt, Map.of());
    }
}
