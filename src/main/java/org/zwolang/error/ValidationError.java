package org.zwolang.error;

/**
 * Violation of a language rule found while validating a parsed workout.
 */
public record ValidationError(String reason) implements ZwomError {

    public static ValidationError of(String reason) {
        return new ValidationError(reason);
    }

    @Override
    public String message() {
        return reason;
    }
}
