package com.campaign.canon.run;

import java.util.EnumSet;
import java.util.Set;

/**
 * Run lifecycle. {@code RUNNING} may end in any other state; {@code PARTIAL} may only
 * move to {@code COMPLETED} through a successful resumption. {@code COMPLETED} and
 * {@code FAILED} are terminal.
 */
public enum RunStatus {
    RUNNING,
    COMPLETED,
    PARTIAL,
    FAILED;

    public boolean canTransitionTo(RunStatus next) {
        return allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    private Set<RunStatus> allowedNext() {
        return switch (this) {
            case RUNNING -> EnumSet.of(COMPLETED, PARTIAL, FAILED);
            case PARTIAL -> EnumSet.of(COMPLETED);
            case COMPLETED, FAILED -> EnumSet.noneOf(RunStatus.class);
        };
    }
}
