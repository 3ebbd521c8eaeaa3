package com.oru.governance.domain.exception;

/**
 * A single historical query failed. Contained by the query planner and
 * surfaced as insufficient-data, never propagated to the report caller.
 */
public class MetricsQueryException extends GovernanceException {

    public MetricsQueryException(String message) {
        super(message);
    }

    public MetricsQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
