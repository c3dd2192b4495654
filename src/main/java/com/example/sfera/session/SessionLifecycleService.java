package com.example.sfera.session;

import com.example.sfera.config.SferaMemoryProperties;
import com.example.sfera.memory.BootstrapContext;
import com.example.sfera.memory.MemoryBootstrapLoader;
import com.example.sfera.memory.MemoryLoadException;
import com.example.sfera.memory.SessionSummarizer;
import com.example.sfera.memory.SummaryStore;
import com.example.sfera.memory.VectorMemoryStore;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hooks the session runtime calls around a conversation: memory bootstrap and
 * registration on start; transcript persistence, summary and unregistration on end.
 */
@Slf4j
@RequiredArgsConstructor
public class SessionLifecycleService {

    static final String SYSTEM_NOTE_PREFIX = "[SYSTEM";

    private final MemoryBootstrapLoader memoryLoader;
    private final SessionRegistry registry;
    private final VectorMemoryStore vectorMemoryStore;
    private final SummaryStore summaryStore;
    private final SessionSummarizer summarizer;
    private final SferaMemoryProperties.OnFailure onFailure;

    /**
     * Loads memory for the handle's user and registers the handle.
     *
     * @throws MemoryLoadException when loading fails and the policy is {@code ABORT};
     *                             the handle is not registered in that case
     */
    public BootstrapContext start(SessionHandle handle) {
        String userId = handle.getUserId();
        BootstrapContext ctx;
        try {
            ctx = memoryLoader.load(userId);
        } catch (MemoryLoadException e) {
            if (onFailure == SferaMemoryProperties.OnFailure.ABORT) {
                log.error("[session] aborting start for user {}: {}", userId, e.getMessage());
                throw e;
            }
            log.warn("[session] starting user {} with empty context: {}", userId, e.getMessage());
            ctx = memoryLoader.emptyContext();
        }
        registry.register(userId, handle);
        return ctx;
    }

    /**
     * Saves the user/assistant turns of {@code transcript}, stores a summary of them and
     * unregisters the handle. Storage failures are logged; the handle is always
     * unregistered.
     */
    public void end(SessionHandle handle, List<ChatMessage> transcript) {
        String userId = handle.getUserId();
        log.info("[session] shutdown for user {}", userId);
        try {
            List<Map<String, Object>> turns = toTurns(transcript);
            if (turns.isEmpty()) {
                log.info("[session] no messages to save for user {}", userId);
                return;
            }
            saveTurns(userId, turns);
            saveSummary(userId, turns);
        } finally {
            registry.unregister(userId, handle);
        }
    }

    private void saveTurns(String userId, List<Map<String, Object>> turns) {
        try {
            vectorMemoryStore.add(turns, userId);
            log.info("[session] saved {} messages for user {}", turns.size(), userId);
        } catch (RuntimeException e) {
            log.error("[session] failed to save messages for user {}", userId, e);
        }
    }

    private void saveSummary(String userId, List<Map<String, Object>> turns) {
        try {
            String summary = summarizer.summarize(turns);
            if (summary == null || summary.isBlank()) {
                log.warn("[session] summarizer returned nothing for user {}", userId);
                return;
            }
            summaryStore.addSummary(userId, summary);
            log.info("[session] summary saved for user {}", userId);
        } catch (RuntimeException e) {
            log.error("[session] failed to summarize session for user {}", userId, e);
        }
    }

    static List<Map<String, Object>> toTurns(List<ChatMessage> transcript) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (transcript == null) {
            return out;
        }
        for (ChatMessage m : transcript) {
            if (m instanceof UserMessage um && um.hasSingleText()) {
                out.add(turn("user", um.singleText()));
            } else if (m instanceof AiMessage am && am.text() != null && !am.text().startsWith(SYSTEM_NOTE_PREFIX)) {
                out.add(turn("assistant", am.text()));
            }
        }
        return out;
    }

    private static Map<String, Object> turn(String role, String content) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("role", role);
        m.put("content", content);
        return m;
    }
}
