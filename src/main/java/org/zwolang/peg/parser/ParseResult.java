package org.zwolang.peg.parser;

import org.zwolang.peg.tree.CstNode;
import org.zwolang.peg.tree.SourceLocation;

/**
 * Result of parsing an expression - either success with a node or failure.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Successful parse with CST node and the location right after it.
     */
    record Success(
        CstNode node,
        SourceLocation endLocation
    ) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return true;
        }

        public static Success of(CstNode node, SourceLocation endLocation) {
            return new Success(node, endLocation);
        }
    }

    /**
     * Failed parse - no match at the given location.
     */
    record Failure(
        SourceLocation location,
        String expected
    ) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return false;
        }

        public static Failure at(SourceLocation location, String expected) {
            return new Failure(location, expected);
        }
    }

    /**
     * Lookahead matched; no input consumed, no node produced.
     */
    record PredicateSuccess(
        SourceLocation location
    ) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return true;
        }
    }
}
