package com.issuepilot.orchestrator.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * States of one issue's lifecycle run.
 *
 *   SELECTING → CLAIMING → PREPARING → RUNNING ⇄ NUDGING → EVALUATING
 *             → COMPLETING → DONE
 *             → BLOCKED | FAILED
 *
 * A crash-resume with a finished marker goes PREPARING → EVALUATING directly.
 */
public enum LifecycleState {
    SELECTING,
    CLAIMING,
    PREPARING,
    RUNNING,
    NUDGING,
    EVALUATING,
    COMPLETING,
    DONE,
    BLOCKED,
    FAILED,
    // Claim lost to another writer, or run cancelled and handed back.
    RELEASED;

    private static final Map<LifecycleState, Set<LifecycleState>> ALLOWED = Map.ofEntries(
            Map.entry(SELECTING,  EnumSet.of(CLAIMING)),
            Map.entry(CLAIMING,   EnumSet.of(PREPARING, RELEASED, FAILED)),
            Map.entry(PREPARING,  EnumSet.of(RUNNING, EVALUATING, FAILED, RELEASED)),
            Map.entry(RUNNING,    EnumSet.of(NUDGING, EVALUATING, BLOCKED, FAILED, RELEASED)),
            Map.entry(NUDGING,    EnumSet.of(RUNNING, EVALUATING, BLOCKED, FAILED, RELEASED)),
            Map.entry(EVALUATING, EnumSet.of(COMPLETING, BLOCKED, FAILED, RELEASED)),
            Map.entry(COMPLETING, EnumSet.of(DONE, FAILED)),
            Map.entry(DONE,       EnumSet.noneOf(LifecycleState.class)),
            Map.entry(BLOCKED,    EnumSet.noneOf(LifecycleState.class)),
            Map.entry(FAILED,     EnumSet.noneOf(LifecycleState.class)),
            Map.entry(RELEASED,   EnumSet.noneOf(LifecycleState.class))
    );

    public boolean canTransitionTo(LifecycleState next) {
        return ALLOWED.get(this).contains(next);
    }

    public boolean isTerminal() {
        return ALLOWED.get(this).isEmpty();
    }
}
