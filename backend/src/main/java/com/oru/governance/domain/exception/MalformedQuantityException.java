package com.oru.governance.domain.exception;

/**
 * A resource quantity string does not follow the Kubernetes quantity grammar.
 */
public class MalformedQuantityException extends GovernanceException {

    private final String value;

    public MalformedQuantityException(String value, String reason) {
        super("Malformed quantity '" + value + "': " + reason);
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
