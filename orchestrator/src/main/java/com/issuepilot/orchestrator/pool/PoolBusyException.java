package com.issuepilot.orchestrator.pool;

/** A drain was requested while another one is still running. */
public class PoolBusyException extends RuntimeException {

    public PoolBusyException(String message) {
        super(message);
    }
}
