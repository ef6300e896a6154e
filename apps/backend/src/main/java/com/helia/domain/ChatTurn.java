package com.helia.domain;

import java.time.Instant;

/**
 * Mutable bookkeeping of one turn as it walks through {@link TurnState}. Late transitions on a
 * terminal turn are ignored; any other illegal transition is a programming error.
 */
public final class ChatTurn {

    private final String ownerId;
    private final Instant openedAt;
    private volatile TurnState state = TurnState.IDLE;
    private volatile Session session;
    private volatile PersonaConfig persona;
    private volatile boolean sessionCreated;
    private volatile Throwable failure;

    public ChatTurn(String ownerId, Instant openedAt) {
        this.ownerId = ownerId;
        this.openedAt = openedAt;
    }

    public synchronized boolean moveTo(TurnState next) {
        if (state.isTerminal()) {
            return false;
        }
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Illegal turn transition " + state + " -> " + next);
        }
        state = next;
        return true;
    }

    public synchronized boolean fail(Throwable cause) {
        if (state.isTerminal()) {
            return false;
        }
        failure = cause;
        state = TurnState.ERRORED;
        return true;
    }

    public void bind(Session session, PersonaConfig persona, boolean created) {
        this.session = session;
        this.persona = persona;
        this.sessionCreated = created;
    }

    public TurnState state() {
        return state;
    }

    public String ownerId() {
        return ownerId;
    }

    public Instant openedAt() {
        return openedAt;
    }

    public Session session() {
        return session;
    }

    public String sessionId() {
        return session == null ? null : session.id();
    }

    public PersonaConfig persona() {
        return persona;
    }

    public boolean sessionCreated() {
        return sessionCreated;
    }

    public Throwable failure() {
        return failure;
    }
}
