package com.dds.app.session;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a search session. {@code INTERRUPTED} is resumable; {@code COMPLETED} and
 * {@code FAILED} are terminal.
 */
public enum SessionStatus {
    ACTIVE,
    COMPLETED,
    INTERRUPTED,
    FAILED;

    public Set<SessionStatus> allowedNext() {
        return switch (this) {
            case ACTIVE -> EnumSet.of(COMPLETED, INTERRUPTED, FAILED);
            case INTERRUPTED -> EnumSet.of(ACTIVE, COMPLETED);
            case COMPLETED, FAILED -> EnumSet.noneOf(SessionStatus.class);
        };
    }

    public boolean canTransitionTo(SessionStatus next) {
        return allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
