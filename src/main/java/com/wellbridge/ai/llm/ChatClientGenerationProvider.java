package com.wellbridge.ai.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wellbridge.ai.agent.state.ChatTurn;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;

/**
 * {@link GenerationProvider} over a Spring AI {@link ChatClient}. Each call runs on
 * {@code callExecutor} and is abandoned once {@code timeout} elapses.
 */
public class ChatClientGenerationProvider implements GenerationProvider {

    private static final Logger log = LoggerFactory.getLogger(ChatClientGenerationProvider.class);

    private final ChatClient chatClient;
    private final ExecutorService callExecutor;
    private final Duration timeout;
    private final ObjectMapper mapper;
    private final Timer successTimer;
    private final Timer failureTimer;

    public ChatClientGenerationProvider(
            ChatClient chatClient,
            ExecutorService callExecutor,
            Duration timeout,
            ObjectMapper mapper,
            MeterRegistry meterRegistry) {
        this.chatClient = chatClient;
        this.callExecutor = callExecutor;
        this.timeout = timeout;
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.successTimer = Timer.builder("agent.generation.duration")
                .description("Generation provider call duration")
                .tag("outcome", "success")
                .register(meterRegistry);
        this.failureTimer = Timer.builder("agent.generation.duration")
                .description("Generation provider call duration")
                .tag("outcome", "failure")
                .register(meterRegistry);
    }

    @Override
    public String complete(GenerationRequest request) throws GenerationException {
        long startNanos = System.nanoTime();
        Future<String> call;
        try {
            call = callExecutor.submit(() -> call(request));
        } catch (RejectedExecutionException e) {
            failureTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
            throw new GenerationException("Generation capacity exhausted", e);
        }
        try {
            String content = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (content == null || content.isBlank()) {
                throw new GenerationException("Empty completion");
            }
            successTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
            return content;
        } catch (TimeoutException e) {
            call.cancel(true);
            failureTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
            throw new GenerationException("Generation timed out after " + timeout, e);
        } catch (ExecutionException e) {
            failureTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
            throw new GenerationException("Generation call failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            failureTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
            throw new GenerationException("Generation call interrupted", e);
        } catch (GenerationException e) {
            failureTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
            throw e;
        }
    }

    @Override
    public <T> T completeStructured(GenerationRequest request, Class<T> type) throws GenerationException {
        String content = complete(request);
        T value;
        try {
            value = mapper.readValue(stripCodeFence(content), type);
        } catch (JsonProcessingException e) {
            log.warn("Structured completion did not parse type={}", type.getSimpleName());
            throw new GenerationException("Invalid JSON for " + type.getSimpleName(), e);
        }
        // a bare JSON null binds without error
        if (value == null) {
            throw new GenerationException("Empty JSON payload for " + type.getSimpleName());
        }
        return value;
    }

    private String call(GenerationRequest request) {
        List<Message> messages = new ArrayList<>();
        for (ChatTurn turn : request.turns()) {
            messages.add(turn.isUser() ? new UserMessage(turn.content()) : new AssistantMessage(turn.content()));
        }
        String system = request.jsonOutput()
                ? request.systemPrompt() + "\n\nRespond ONLY with a single JSON object."
                : request.systemPrompt();

        return chatClient.prompt()
                .system(system)
                .messages(messages)
                .options(ChatOptions.builder()
                        .temperature(request.temperature())
                        .maxTokens(request.maxTokens())
                        .build())
                .call()
                .content();
    }

    static String stripCodeFence(String content) {
        String trimmed = content.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, closing).trim();
    }
}
