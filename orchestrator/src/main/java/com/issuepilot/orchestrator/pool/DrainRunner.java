package com.issuepilot.orchestrator.pool;

import com.issuepilot.orchestrator.config.IssuePilotProperties;
import com.issuepilot.orchestrator.model.TargetFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Command-line drain, active under the {@code drain} profile.
 *
 * Example:
 *   java -jar orchestrator.jar --spring.profiles.active=drain \
 *     --concurrency=3 --target=remote --max-issues=10
 *
 * Flags not given fall back to {@code issuepilot.pool.*}. Exit code: 0 on a
 * clean drain, 2 on bad arguments or a dependency cycle, 1 otherwise.
 */
@Component
@Profile("drain")
public class DrainRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(DrainRunner.class);

    static final int EXIT_CONFIGURATION = 2;

    private final AgentPool            pool;
    private final IssuePilotProperties props;

    private int exitCode = 0;

    public DrainRunner(AgentPool pool, IssuePilotProperties props) {
        this.pool  = pool;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) {
        PoolOptions options;
        try {
            options = parse(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            exitCode = EXIT_CONFIGURATION;
            return;
        }

        DrainReport report = pool.drain(options);
        if (!report.cycle().isEmpty()) {
            log.error("Fix the blocking relationships between: {}", report.cycle());
        }
        exitCode = report.exitCode();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    PoolOptions parse(ApplicationArguments args) {
        IssuePilotProperties.PoolConfig defaults = props.getPool();
        int concurrency = intOption(args, "concurrency", defaults.getConcurrency());
        int maxIssues   = intOption(args, "max-issues", defaults.getMaxIssues());
        TargetFilter target = args.containsOption("target")
                ? TargetFilter.parse(single(args, "target"))
                : defaults.getTarget();
        Duration checkInterval = args.containsOption("check-interval")
                ? DurationStyle.detectAndParse(single(args, "check-interval"))
                : defaults.getCheckInterval();
        boolean continuous = args.containsOption("continuous");
        return new PoolOptions(concurrency, target, maxIssues, checkInterval, continuous);
    }

    private static int intOption(ApplicationArguments args, String name, int fallback) {
        if (!args.containsOption(name)) return fallback;
        String value = single(args, name);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer, got '" + value + "'", e);
        }
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.size() != 1 || values.get(0) == null) {
            throw new IllegalArgumentException("--" + name + " needs exactly one value");
        }
        return values.get(0);
    }
}
