package com.example.sfera.proactive;

import com.example.sfera.session.SessionHandle;

/**
 * Delivery channel for agent-initiated messages.
 */
public interface ProactiveMessageSender {

    /** Pushes {@code text} into the live conversation behind {@code handle}. */
    void deliverLive(SessionHandle handle, String text);

    /** Out-of-band notification (push, e-mail) for a user without a live session. */
    void notifyOffline(String userId, String text);
}
