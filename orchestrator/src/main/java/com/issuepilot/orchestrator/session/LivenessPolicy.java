package com.issuepilot.orchestrator.session;

import com.issuepilot.orchestrator.config.IssuePilotProperties;
import com.issuepilot.orchestrator.model.Session;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides what to do about a quiet session.
 *
 * Timeline measured from the last observed activity:
 *
 *   idleWindow                       first nudge
 *   idleWindow + k·nudgeInterval     nudge k+1   (while nudges < maxNudges)
 *   idleWindow + maxNudges·interval  restart, or fail once restarts are used up
 *
 * Any activity resets the nudge count (see {@link Session#recordActivity}).
 */
@Component
public class LivenessPolicy {

    public enum Decision { NONE, NUDGE, RESTART, FAIL }

    private final Duration idleWindow;
    private final Duration nudgeInterval;
    private final int      maxNudges;
    private final int      maxRestarts;

    @Autowired
    public LivenessPolicy(IssuePilotProperties props) {
        this(props.getSession().getIdleWindow(), props.getSession().getNudgeInterval(),
             props.getSession().getMaxNudges(), props.getSession().getMaxRestarts());
    }

    public LivenessPolicy(Duration idleWindow, Duration nudgeInterval, int maxNudges, int maxRestarts) {
        if (idleWindow.isNegative() || nudgeInterval.isZero() || nudgeInterval.isNegative()) {
            throw new IllegalArgumentException("idle window must not be negative and nudge interval must be positive");
        }
        if (maxNudges < 0 || maxRestarts < 0) {
            throw new IllegalArgumentException("nudge and restart budgets must not be negative");
        }
        this.idleWindow    = idleWindow;
        this.nudgeInterval = nudgeInterval;
        this.maxNudges     = maxNudges;
        this.maxRestarts   = maxRestarts;
    }

    public Decision decide(Session session, Instant now) {
        Duration idle = Duration.between(session.getLastActivityAt(), now);
        if (idle.compareTo(idleWindow) < 0) {
            return Decision.NONE;
        }
        Duration pastWindow = idle.minus(idleWindow);

        if (session.getNudgeCount() < maxNudges) {
            long thresholdsPassed = 1 + pastWindow.toMillis() / nudgeInterval.toMillis();
            return thresholdsPassed > session.getNudgeCount() ? Decision.NUDGE : Decision.NONE;
        }

        Duration giveUpAt = nudgeInterval.multipliedBy(maxNudges);
        if (pastWindow.compareTo(giveUpAt) < 0) {
            return Decision.NONE;
        }
        return canRestart(session) ? Decision.RESTART : Decision.FAIL;
    }

    /** A dead process gets the same restart budget as a stuck one. */
    public boolean canRestart(Session session) {
        return session.getRestartCount() < maxRestarts;
    }

    public int maxRestarts() {
        return maxRestarts;
    }
}
