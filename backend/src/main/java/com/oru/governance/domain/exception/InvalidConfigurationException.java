package com.oru.governance.domain.exception;

import java.util.List;

/**
 * Raised synchronously at engine entry when options or request arguments are invalid.
 * Values are never clamped silently; every violation is reported.
 */
public class InvalidConfigurationException extends GovernanceException {

    private final List<String> violations;

    public InvalidConfigurationException(String violation) {
        this(List.of(violation));
    }

    public InvalidConfigurationException(List<String> violations) {
        super("Invalid governance configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
