package com.issuepilot.orchestrator.session;

import com.issuepilot.orchestrator.config.IssuePilotProperties;
import com.issuepilot.orchestrator.config.IssuePilotProperties.BackendChoice;
import com.issuepilot.orchestrator.model.Issue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Picks backend and model from the issue's {@code difficulty:*} label.
 */
@Component
public class BackendSelector {

    private static final Logger log = LoggerFactory.getLogger(BackendSelector.class);

    static final String DIFFICULTY_PREFIX = "difficulty:";

    private final Map<String, BackendChoice> byDifficulty;
    private final BackendChoice              fallback;

    public BackendSelector(IssuePilotProperties props) {
        this.byDifficulty = props.getDifficulty();
        this.fallback     = props.getDefaultBackend();
    }

    public BackendChoice select(Issue issue) {
        for (String label : issue.labels()) {
            if (!label.toLowerCase().startsWith(DIFFICULTY_PREFIX)) continue;
            String level = label.substring(DIFFICULTY_PREFIX.length()).toLowerCase();
            BackendChoice choice = byDifficulty.get(level);
            if (choice != null) {
                log.debug("{} is {}: {} / {}", issue.ref(), label, choice.getBackend(), choice.getModel());
                return choice;
            }
        }
        log.debug("{} has no known difficulty label, using {} / {}",
                issue.ref(), fallback.getBackend(), fallback.getModel());
        return fallback;
    }
}
