package com.issuepilot.orchestrator.support;

import com.issuepilot.orchestrator.config.IssuePilotProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/** Properties with short, round timings so scenarios fit in a few polls. */
public final class TestProperties {

    private TestProperties() {}

    public static IssuePilotProperties create(Path workspaceRoot) {
        IssuePilotProperties props = new IssuePilotProperties();
        props.getTracker().setRepos(List.of("acme/app"));
        props.getTracker().setBlockedReviewer("maintainer");
        props.getWorkspace().setRoot(workspaceRoot);
        props.getSession().setPollInterval(Duration.ofMinutes(1));
        props.getSession().setIdleWindow(Duration.ofMinutes(2));
        props.getSession().setNudgeInterval(Duration.ofMinutes(1));
        props.getSession().setMaxNudges(2);
        props.getSession().setMaxRestarts(1);
        props.getClaim().setOwnerId("orch-a");
        props.getClaim().setHeartbeatInterval(Duration.ofMinutes(2));
        props.getClaim().setStaleAfter(Duration.ofMinutes(15));
        return props;
    }
}
