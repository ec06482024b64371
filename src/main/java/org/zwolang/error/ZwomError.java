package org.zwolang.error;

/**
 * Failure of a ZWOM conversion step. Every failure is fatal for the document being converted.
 */
public sealed interface ZwomError permits SyntaxError, ValidationError {

    /**
     * Human-readable description of the failure.
     */
    String message();
}
