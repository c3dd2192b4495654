package com.example.sfera.session;

import java.util.Objects;

/**
 * Non-owning link between a user and the live conversation objects created by the
 * session runtime. {@code contextRef} and {@code agentRef} are opaque: the registry
 * stores and returns them verbatim and never calls into them.
 */
public final class SessionHandle {

    private final String userId;
    private final Object contextRef;
    private final Object agentRef;

    public SessionHandle(String userId, Object contextRef, Object agentRef) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.contextRef = contextRef;
        this.agentRef = agentRef;
    }

    public String getUserId() {
        return userId;
    }

    public Object getContextRef() {
        return contextRef;
    }

    public Object getAgentRef() {
        return agentRef;
    }

    @Override
    public String toString() {
        return "SessionHandle{userId=" + userId + "}";
    }
}
