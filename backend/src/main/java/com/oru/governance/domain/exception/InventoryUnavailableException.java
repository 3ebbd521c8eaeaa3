package com.oru.governance.domain.exception;

/**
 * The inventory backend could not list any workload for the requested scope.
 * This is the only collaborator failure that aborts a report.
 */
public class InventoryUnavailableException extends GovernanceException {

    public InventoryUnavailableException(String message) {
        super(message);
    }

    public InventoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
