package org.zwolang.error;

import org.zwolang.peg.tree.SourceLocation;

/**
 * Source text that does not match the ZWOM grammar, or a literal the grammar accepts but the
 * language does not.
 */
public sealed interface SyntaxError extends ZwomError {
    SourceLocation location();

    /**
     * Unexpected input at the furthest position the parser reached.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements SyntaxError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }
    }

    /**
     * Input ended while more was expected.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements SyntaxError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * Well-formed text with an invalid meaning: unknown keyword or zone, mixed range, duplicate key.
     */
    record InvalidLiteral(
    SourceLocation location,
    String reason) implements SyntaxError {
        @Override
        public String message() {
            return reason + " at " + location;
        }
    }
}
