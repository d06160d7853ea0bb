package com.issuepilot.orchestrator.config;

import com.issuepilot.orchestrator.executor.Sleeper;
import com.issuepilot.orchestrator.pool.AgentPool;
import com.issuepilot.orchestrator.pool.PoolOptions;
import com.issuepilot.orchestrator.tracker.GitHubTrackerClient;
import com.issuepilot.orchestrator.tracker.RetryingTrackerClient;
import com.issuepilot.orchestrator.tracker.TrackerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(IssuePilotProperties.class)
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    /** Everything that talks to the tracker goes through the retrying wrapper. */
    @Bean
    @Primary
    TrackerClient trackerClient(GitHubTrackerClient github, IssuePilotProperties props, Sleeper sleeper) {
        IssuePilotProperties.TrackerConfig tracker = props.getTracker();
        return new RetryingTrackerClient(github, tracker.getMaxRetries(),
                tracker.getRetryBaseDelay(), tracker.getRetryMaxDelay(), sleeper);
    }

    /** Server mode: start polling right away when issuepilot.pool.auto-start is set. */
    @Bean
    @Profile("!drain")
    @ConditionalOnProperty(prefix = "issuepilot.pool", name = "auto-start", havingValue = "true")
    ApplicationRunner poolAutoStart(AgentPool pool, IssuePilotProperties props) {
        return args -> {
            log.info("Auto-starting continuous pool");
            pool.start(PoolOptions.from(props.getPool(), true));
        };
    }
}
