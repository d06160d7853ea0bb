package com.issuepilot.orchestrator.api;

import com.issuepilot.orchestrator.api.dto.RunResponse;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.service.RunLedger;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * Read-only view of the run ledger.
 *
 * GET /runs                      — the 50 most recent runs
 * GET /runs?repo=o/r&number=12   — every epoch of one issue, newest first
 * GET /runs/{id}                 — one run
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final RunLedger ledger;

    public RunController(RunLedger ledger) {
        this.ledger = ledger;
    }

    @GetMapping
    public List<RunResponse> list(@RequestParam(required = false) String repo,
                                  @RequestParam(required = false) Integer number) {
        if (repo == null && number == null) {
            return ledger.recent().stream().map(RunResponse::from).toList();
        }
        if (repo == null || number == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "repo and number must be given together");
        }
        IssueRef ref;
        try {
            ref = new IssueRef(repo, number);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        return ledger.history(ref).stream().map(RunResponse::from).toList();
    }

    /** Returns 404 if the run ID is not found. */
    @GetMapping("/{id}")
    public RunResponse get(@PathVariable UUID id) {
        return ledger.findById(id)
                .map(RunResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Run not found: " + id));
    }
}
