package com.issuepilot.orchestrator.executor;

/** Exit code and captured output of one finished process. */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public boolean ok() {
        return exitCode == 0;
    }
}
