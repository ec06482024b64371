package org.zwolang.peg.tree;

/**
 * Source text skipped between tokens: whitespace runs and {@code ;} line comments.
 */
public sealed interface Trivia {
    SourceSpan span();

    String text();

    record Whitespace(SourceSpan span, String text) implements Trivia {}

    record LineComment(SourceSpan span, String text) implements Trivia {
        /**
         * Comment body without the leading marker.
         */
        public String body() {
            return text.substring(1).strip();
        }
    }

    static Trivia classify(SourceSpan span, String text) {
        return text.startsWith(";")
               ? new LineComment(span, text)
               : new Whitespace(span, text);
    }
}
