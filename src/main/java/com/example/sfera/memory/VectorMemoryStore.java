package com.example.sfera.memory;

import java.util.List;
import java.util.Map;

/**
 * Conversation history kept in a vector database. Records are raw payload maps with at
 * least {@code role} and {@code content}; anything else is store-specific.
 */
public interface VectorMemoryStore {

    /**
     * Returns up to {@code limit} records matching {@code filter}, oldest first.
     */
    List<Map<String, Object>> queryAll(Map<String, Object> filter, int limit);

    void add(List<Map<String, Object>> records, String userId);
}
