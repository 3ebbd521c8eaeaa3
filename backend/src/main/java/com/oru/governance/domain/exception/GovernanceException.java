package com.oru.governance.domain.exception;

/**
 * Root of all failures raised by the governance engine.
 */
public class GovernanceException extends RuntimeException {

    public GovernanceException(String message) {
        super(message);
    }

    public GovernanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
