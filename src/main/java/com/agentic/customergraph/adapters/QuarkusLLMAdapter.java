package com.agentic.customergraph.adapters;

import com.agentic.customergraph.config.CustomerGraphConfig;
import com.agentic.customergraph.llm.ChatMessage;
import com.agentic.customergraph.llm.LLMFunction;
import com.agentic.customergraph.llm.LlmChatClient;
import com.agentic.customergraph.llm.LlmChatRequest;
import com.agentic.customergraph.llm.LlmChatResponse;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bridges the MicroProfile {@link LlmChatClient} to the {@link LLMFunction} capability.
 * Calls run on a small daemon pool whose threads carry the application classloader.
 */
@ApplicationScoped
public class QuarkusLLMAdapter implements LLMFunction {

    private static final Logger LOG = Logger.getLogger(QuarkusLLMAdapter.class);
    private static final ClassLoader APP_CLASSLOADER = QuarkusLLMAdapter.class.getClassLoader();
    private static final int POOL_SIZE = 4;

    private final ExecutorService executor;

    @Inject
    @RestClient
    LlmChatClient chatClient;

    @Inject
    CustomerGraphConfig config;

    public QuarkusLLMAdapter() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = task -> {
            Thread thread = new Thread(() -> {
                Thread.currentThread().setContextClassLoader(APP_CLASSLOADER);
                task.run();
            }, "llm-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        this.executor = Executors.newFixedThreadPool(POOL_SIZE, threadFactory);
    }

    @Override
    public CompletableFuture<String> apply(
            @NotNull final String prompt,
            @Nullable final String systemPrompt,
            @NotNull final Map<String, Object> kwargs) {

        return CompletableFuture.supplyAsync(() -> {
            final List<ChatMessage> messages = new ArrayList<>();
            if (systemPrompt != null && !systemPrompt.isEmpty()) {
                messages.add(new ChatMessage("system", systemPrompt));
            }
            messages.add(new ChatMessage("user", prompt));

            final String model = (String) kwargs.getOrDefault("model", config.llm().model());
            final Double temperature = getDoubleParam(kwargs, "temperature", config.llm().temperature());
            final Integer maxTokens = getIntegerParam(kwargs, "max_tokens", config.llm().maxTokens());

            LOG.debugf("Calling LLM model %s (prompt length %d, temperature %.2f)",
                model, Integer.valueOf(prompt.length()), temperature);

            final LlmChatResponse response = chatClient.chat(
                new LlmChatRequest(model, messages, false, maxTokens, temperature));

            if (response == null || response.choices() == null || response.choices().isEmpty()) {
                throw new IllegalStateException("LLM returned no choices in response");
            }
            final String content = response.choices().get(0).message().content();
            if (content == null) {
                throw new IllegalStateException("LLM returned an empty message");
            }
            return content;
        }, executor);
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    private Double getDoubleParam(final Map<String, Object> kwargs, final String key, final Double defaultValue) {
        final Object value = kwargs.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private Integer getIntegerParam(final Map<String, Object> kwargs, final String key, final Integer defaultValue) {
        final Object value = kwargs.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }
}
