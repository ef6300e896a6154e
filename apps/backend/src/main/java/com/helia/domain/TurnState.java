package com.helia.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one chat turn. ERRORED is reachable from every state except DONE.
 */
public enum TurnState {
    IDLE,
    VALIDATING,
    PERSISTING_USER_MESSAGE,
    STREAMING,
    FINALIZING,
    DONE,
    ERRORED;

    public Set<TurnState> successors() {
        return switch (this) {
            case IDLE -> EnumSet.of(VALIDATING, ERRORED);
            case VALIDATING -> EnumSet.of(PERSISTING_USER_MESSAGE, ERRORED);
            case PERSISTING_USER_MESSAGE -> EnumSet.of(STREAMING, ERRORED);
            case STREAMING -> EnumSet.of(FINALIZING, ERRORED);
            case FINALIZING -> EnumSet.of(DONE, ERRORED);
            case DONE, ERRORED -> EnumSet.noneOf(TurnState.class);
        };
    }

    public boolean canMoveTo(TurnState next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return this == DONE || this == ERRORED;
    }
}
