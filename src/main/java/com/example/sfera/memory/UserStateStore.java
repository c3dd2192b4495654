package com.example.sfera.memory;

import java.time.Instant;
import java.util.List;

/**
 * Long-term user state (profile, preferences, active plan).
 */
public interface UserStateStore {

    /** Profile and core memory rendered for the system prompt; empty when nothing is known. */
    String formatForPrompt(String userId);

    /** Users that currently follow a plan. */
    List<UserPlanState> findUsersWithActivePlan();

    void markProactiveMessageSent(String userId, Instant at);
}
