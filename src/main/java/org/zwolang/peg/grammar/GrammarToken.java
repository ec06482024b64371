package org.zwolang.peg.grammar;

import org.zwolang.peg.tree.SourceSpan;

/**
 * Token types for grammar lexer.
 */
public sealed interface GrammarToken {
    SourceSpan span();

    // Identifiers and literals
    record Identifier(SourceSpan span, String name) implements GrammarToken {}

    record StringLiteral(SourceSpan span, String value) implements GrammarToken {}

    record CharClassLiteral(SourceSpan span, String pattern, boolean negated) implements GrammarToken {}

    // Operators
    record LeftArrow(SourceSpan span) implements GrammarToken {}

    record Slash(SourceSpan span) implements GrammarToken {}

    record Ampersand(SourceSpan span) implements GrammarToken {}

    record Exclamation(SourceSpan span) implements GrammarToken {}

    record Question(SourceSpan span) implements GrammarToken {}

    record Star(SourceSpan span) implements GrammarToken {}

    record Plus(SourceSpan span) implements GrammarToken {}

    record Dot(SourceSpan span) implements GrammarToken {}

    // Delimiters
    record LParen(SourceSpan span) implements GrammarToken {}

    record RParen(SourceSpan span) implements GrammarToken {}

    record LAngle(SourceSpan span) implements GrammarToken {}

    record RAngle(SourceSpan span) implements GrammarToken {}

    // Special
    record Directive(SourceSpan span, String name) implements GrammarToken {}

    record Eof(SourceSpan span) implements GrammarToken {}

    record Error(SourceSpan span, String message) implements GrammarToken {}

    /**
     * Short description for error messages.
     */
    static String describe(GrammarToken token) {
        if (token instanceof Identifier id) {
            return "identifier '" + id.name() + "'";
        }
        if (token instanceof StringLiteral) {
            return "string literal";
        }
        if (token instanceof CharClassLiteral) {
            return "character class";
        }
        if (token instanceof Directive directive) {
            return "directive '%" + directive.name() + "'";
        }
        if (token instanceof Eof) {
            return "end of input";
        }
        if (token instanceof Error error) {
            return error.message();
        }
        if (token instanceof LeftArrow) {
            return "'<-'";
        }
        return "'" + symbol(token) + "'";
    }

    private static char symbol(GrammarToken token) {
        if (token instanceof Slash) {
            return '/';
        }
        if (token instanceof Ampersand) {
            return '&';
        }
        if (token instanceof Exclamation) {
            return '!';
        }
        if (token instanceof Question) {
            return '?';
        }
        if (token instanceof Star) {
            return '*';
        }
        if (token instanceof Plus) {
            return '+';
        }
        if (token instanceof Dot) {
            return '.';
        }
        if (token instanceof LParen) {
            return '(';
        }
        if (token instanceof RParen) {
            return ')';
        }
        if (token instanceof LAngle) {
            return '<';
        }
        return '>';
    }
}
