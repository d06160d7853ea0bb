package com.issuepilot.orchestrator.api;

import com.issuepilot.orchestrator.api.dto.DrainRequest;
import com.issuepilot.orchestrator.api.dto.PoolStatusResponse;
import com.issuepilot.orchestrator.config.IssuePilotProperties;
import com.issuepilot.orchestrator.model.TargetFilter;
import com.issuepilot.orchestrator.pool.AgentPool;
import com.issuepilot.orchestrator.pool.PoolBusyException;
import com.issuepilot.orchestrator.pool.PoolOptions;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for the agent pool.
 *
 * GET  /pool/status — slots, active issues, totals, last drain report
 * POST /pool/drain  — bounded drain in the background
 * POST /pool/start  — continuous polling in the background
 * POST /pool/stop   — cancel running lifecycles; their issues go back to Ready
 */
@RestController
@RequestMapping("/pool")
public class PoolController {

    private final AgentPool            pool;
    private final IssuePilotProperties props;

    public PoolController(AgentPool pool, IssuePilotProperties props) {
        this.pool  = pool;
        this.props = props;
    }

    @GetMapping("/status")
    public PoolStatusResponse status() {
        return PoolStatusResponse.from(pool.status(), pool.lastReport());
    }

    /**
     * Start a bounded drain.
     *
     * Example:
     *   curl -X POST http://localhost:8080/pool/drain \
     *     -H "Content-Type: application/json" \
     *     -d '{"concurrency":3,"target":"remote","maxIssues":5}'
     *
     * HTTP 202 — drain started
     * HTTP 400 — invalid options
     * HTTP 409 — a drain is already running
     */
    @PostMapping("/drain")
    public ResponseEntity<PoolStatusResponse> drain(@RequestBody(required = false) DrainRequest req) {
        return launch(req, false);
    }

    @PostMapping("/start")
    public ResponseEntity<PoolStatusResponse> start(@RequestBody(required = false) DrainRequest req) {
        return launch(req, true);
    }

    @PostMapping("/stop")
    public PoolStatusResponse stop() {
        pool.stop();
        return PoolStatusResponse.from(pool.status(), pool.lastReport());
    }

    private ResponseEntity<PoolStatusResponse> launch(DrainRequest req, boolean continuous) {
        PoolOptions options;
        try {
            options = toOptions(req, continuous);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        try {
            pool.start(options);
        } catch (PoolBusyException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e);
        }
        return ResponseEntity.accepted().body(PoolStatusResponse.from(pool.status(), pool.lastReport()));
    }

    private PoolOptions toOptions(DrainRequest req, boolean continuous) {
        IssuePilotProperties.PoolConfig defaults = props.getPool();
        if (req == null) {
            return PoolOptions.from(defaults, continuous);
        }
        return new PoolOptions(
                req.concurrency()   != null ? req.concurrency() : defaults.getConcurrency(),
                req.target()        != null ? TargetFilter.parse(req.target()) : defaults.getTarget(),
                req.maxIssues()     != null ? req.maxIssues() : defaults.getMaxIssues(),
                req.checkInterval() != null ? req.checkInterval() : defaults.getCheckInterval(),
                continuous);
    }
}
