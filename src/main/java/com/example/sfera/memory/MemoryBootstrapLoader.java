package com.example.sfera.memory;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Loads the three memory sources of a user in parallel and merges them into the
 * context a new session starts with.
 *
 * <p>Profile, last summary and recent history are fetched concurrently and joined at a
 * single point. A failing source does not cancel the others, but any failure fails the
 * whole load with {@link MemoryLoadException}.</p>
 *
 * <p>The replayed history is the most recent {@code replayLimit} records in their
 * original order, restricted to non-empty {@code user}/{@code assistant} turns. The
 * greeting instruction is always the last message.</p>
 */
@Slf4j
public class MemoryBootstrapLoader {

    static final String EPISODIC_HEADER = "# EPISODIC MEMORY (LAST SESSION SUMMARY)\n"
            + "[SYSTEM NOTE: Use this to continue the conversation naturally.]\n";

    static final String ROLE_USER = "user";
    static final String ROLE_ASSISTANT = "assistant";

    private final UserStateStore userStateStore;
    private final SummaryStore summaryStore;
    private final VectorMemoryStore vectorMemoryStore;
    private final Executor executor;
    private final int historyFetchLimit;
    private final int replayLimit;
    private final String greetingInstruction;

    public MemoryBootstrapLoader(
            UserStateStore userStateStore,
            SummaryStore summaryStore,
            VectorMemoryStore vectorMemoryStore,
            Executor executor,
            int historyFetchLimit,
            int replayLimit,
            String greetingInstruction) {
        this.userStateStore = Objects.requireNonNull(userStateStore, "userStateStore");
        this.summaryStore = Objects.requireNonNull(summaryStore, "summaryStore");
        this.vectorMemoryStore = Objects.requireNonNull(vectorMemoryStore, "vectorMemoryStore");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.historyFetchLimit = historyFetchLimit;
        this.replayLimit = replayLimit;
        this.greetingInstruction = Objects.requireNonNull(greetingInstruction, "greetingInstruction");
    }

    /**
     * @throws MemoryLoadException if any of the three sources fails
     */
    public BootstrapContext load(String userId) {
        long started = System.nanoTime();
        log.info("[memory] parallel load started for user {}", userId);

        CompletableFuture<String> profileF;
        CompletableFuture<Optional<String>> summaryF;
        CompletableFuture<List<Map<String, Object>>> historyF;
        try {
            profileF = CompletableFuture.supplyAsync(() -> userStateStore.formatForPrompt(userId), executor);
            summaryF = CompletableFuture.supplyAsync(() -> summaryStore.getLastSummary(userId), executor);
            historyF = CompletableFuture.supplyAsync(
                    () -> vectorMemoryStore.queryAll(Map.of("user_id", userId), historyFetchLimit), executor);
        } catch (RejectedExecutionException e) {
            throw new MemoryLoadException(userId, e);
        }

        try {
            CompletableFuture.allOf(profileF, summaryF, historyF).join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = (e instanceof CompletionException && e.getCause() != null) ? e.getCause() : e;
            log.warn("[memory] load failed for user {}: {}", userId, cause.toString());
            throw new MemoryLoadException(userId, cause);
        }

        String coreMemory = Objects.requireNonNullElse(profileF.join(), "");
        log.info("[memory] core memory loaded for user {}", userId);

        String episodicMemory = frameEpisodic(summaryF.join());
        if (!episodicMemory.isEmpty()) {
            log.info("[memory] episodic memory loaded for user {}", userId);
        }

        List<Map<String, Object>> recent = Objects.requireNonNullElse(historyF.join(), List.of());
        if (!recent.isEmpty()) {
            log.info("[memory] {} recent records loaded for user {}", recent.size(), userId);
        }

        List<ChatMessage> messages = replay(recent);
        messages.add(SystemMessage.from(greetingInstruction));

        log.debug("[memory] bootstrap for user {} ready in {} ms ({} messages)",
                userId, (System.nanoTime() - started) / 1_000_000L, messages.size());
        return new BootstrapContext(messages, coreMemory, episodicMemory, recent);
    }

    /**
     * Context used when memory could not be loaded: greeting only.
     */
    public BootstrapContext emptyContext() {
        List<ChatMessage> messages = new ArrayList<>(1);
        messages.add(SystemMessage.from(greetingInstruction));
        return new BootstrapContext(messages, "", "", List.of());
    }

    static String frameEpisodic(Optional<String> summary) {
        if (summary == null) {
            return "";
        }
        return summary
                .filter(s -> !s.isBlank())
                .map(s -> EPISODIC_HEADER + s)
                .orElse("");
    }

    private List<ChatMessage> replay(List<Map<String, Object>> records) {
        List<ChatMessage> out = new ArrayList<>();
        int from = Math.max(0, records.size() - replayLimit);
        for (Map<String, Object> rec : records.subList(from, records.size())) {
            try {
                toMessage(rec).ifPresent(out::add);
            } catch (RuntimeException e) {
                log.warn("[memory] skipping history record that cannot be replayed: {}", e.getMessage());
            }
        }
        return out;
    }

    private static Optional<ChatMessage> toMessage(Map<String, Object> rec) {
        if (rec == null) {
            throw new IllegalArgumentException("null record");
        }
        Object role = rec.getOrDefault("role", ROLE_USER);
        Object content = rec.getOrDefault("content", "");
        if (!(role instanceof String r)) {
            throw new IllegalArgumentException("role is not text: " + role);
        }
        if (!(content instanceof String text)) {
            throw new IllegalArgumentException("content is not text for role " + r);
        }
        if (text.isBlank()) {
            return Optional.empty();
        }
        switch (r) {
            case ROLE_USER:
                return Optional.of(UserMessage.from(text));
            case ROLE_ASSISTANT:
                return Optional.of(AiMessage.from(text));
            default:
                return Optional.empty();
        }
    }
}
