package com.example.sfera.memory;

import dev.langchain4j.data.message.ChatMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Everything a new session needs from memory, built once at session start and handed
 * to the runtime.
 *
 * @param initialMessages replayed history in chronological order, greeting turn last
 * @param coreMemory      formatted profile, possibly empty
 * @param episodicMemory  framed last-session summary, empty when there is none
 * @param recentRecords   raw history records as returned by the vector store
 */
public record BootstrapContext(
        List<ChatMessage> initialMessages,
        String coreMemory,
        String episodicMemory,
        List<Map<String, Object>> recentRecords) {

    public BootstrapContext {
        initialMessages = List.copyOf(initialMessages);
        // List.copyOf rejects nulls and malformed records may be null
        recentRecords = Collections.unmodifiableList(new ArrayList<>(recentRecords));
        coreMemory = coreMemory == null ? "" : coreMemory;
        episodicMemory = episodicMemory == null ? "" : episodicMemory;
    }

    public boolean hasEpisodicMemory() {
        return !episodicMemory.isEmpty();
    }
}
