package com.example.sfera.memory;

import java.time.Instant;
import java.util.Optional;

/**
 * A user's active plan as seen by the follow-up job.
 *
 * @param lastUpdate           last time the user reported progress, if ever
 * @param lastProactiveMessage last time we reached out on our own, if ever
 */
public record UserPlanState(
        String userId,
        String plan,
        Optional<Instant> lastUpdate,
        Optional<Instant> lastProactiveMessage) {
}
