package com.kotsin.advisor.validation;

/**
 * Raised when a generated signal breaks its own ladder geometry. Indicates a bug in the generator,
 * not bad market data.
 */
public class SignalInvariantException extends RuntimeException {

    private final transient ValidationResult result;

    public SignalInvariantException(String signalId, ValidationResult result) {
        super("Signal " + signalId + " violates ladder invariants: " + result);
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }
}
