package com.example.sfera.memory;

import java.util.Optional;

/**
 * Episodic memory: one condensed summary per finished session.
 */
public interface SummaryStore {

    Optional<String> getLastSummary(String userId);

    void addSummary(String userId, String text);
}
