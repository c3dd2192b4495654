package com.example.sfera.session;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Directory of live sessions by user id, used by proactive jobs to reach a running
 * conversation without holding their own reference to it.
 *
 * <p>The session runtime owns the lifecycle: it registers once on start and
 * unregisters once on end. A second {@link #register} for the same user replaces the
 * first (last writer wins). Handles are not validated.</p>
 */
@Slf4j
public class SessionRegistry {

    private final ConcurrentHashMap<String, SessionHandle> sessions = new ConcurrentHashMap<>();

    public void register(String userId, SessionHandle handle) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(handle, "handle");
        SessionHandle previous = sessions.put(userId, handle);
        if (previous != null && previous != handle) {
            log.info("[session] replaced session for user {}", userId);
        } else {
            log.info("[session] registered session for user {}", userId);
        }
    }

    public void unregister(String userId) {
        if (userId != null && sessions.remove(userId) != null) {
            log.info("[session] unregistered session for user {}", userId);
        }
    }

    /**
     * Removes the entry only while it still points at {@code handle}. Returns false when
     * a newer session has already replaced it.
     */
    public boolean unregister(String userId, SessionHandle handle) {
        if (userId == null || handle == null) {
            return false;
        }
        boolean removed = sessions.remove(userId, handle);
        if (removed) {
            log.info("[session] unregistered session for user {}", userId);
        } else {
            log.debug("[session] stale unregister ignored for user {}", userId);
        }
        return removed;
    }

    public Optional<SessionHandle> get(String userId) {
        return userId == null ? Optional.empty() : Optional.ofNullable(sessions.get(userId));
    }

    public boolean isActive(String userId) {
        return userId != null && sessions.containsKey(userId);
    }

    /** Snapshot of user ids with a live session. */
    public Set<String> listActive() {
        return Set.copyOf(sessions.keySet());
    }

    public int size() {
        return sessions.size();
    }

    public void clear() {
        sessions.clear();
        log.info("[session] all sessions cleared");
    }
}
