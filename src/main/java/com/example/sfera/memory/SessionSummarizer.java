package com.example.sfera.memory;

import java.util.List;
import java.util.Map;

/**
 * Produces the episodic summary of a finished session (LLM-backed in production).
 */
@FunctionalInterface
public interface SessionSummarizer {

    /**
     * @param turns {@code role}/{@code content} records in conversation order
     * @return the summary, or an empty string when nothing could be produced
     */
    String summarize(List<Map<String, Object>> turns);
}
