package org.zwolang.peg.grammar;

import org.zwolang.peg.tree.SourceSpan;

import java.util.List;

/**
 * PEG expression types - the building blocks of grammar rules.
 */
public sealed interface Expression {

    /**
     * Source location of this expression in the grammar.
     */
    SourceSpan span();

    // === Terminals ===

    /**
     * Literal string match: 'text' or "text"
     */
    record Literal(SourceSpan span, String text) implements Expression {}

    /**
     * Character class: [a-z], [^"]
     */
    record CharClass(SourceSpan span, String pattern, boolean negated) implements Expression {}

    /**
     * Any character: .
     */
    record Any(SourceSpan span) implements Expression {}

    /**
     * Rule reference: RuleName
     */
    record Reference(SourceSpan span, String ruleName) implements Expression {}

    // === Combinators ===

    record Sequence(SourceSpan span, List<Expression> elements) implements Expression {}

    /**
     * Ordered choice: the first alternative that matches wins.
     */
    record Choice(SourceSpan span, List<Expression> alternatives) implements Expression {}

    record ZeroOrMore(SourceSpan span, Expression expression) implements Expression {}

    record OneOrMore(SourceSpan span, Expression expression) implements Expression {}

    record Optional(SourceSpan span, Expression expression) implements Expression {}

    // === Predicates ===

    /**
     * Positive lookahead: &e
     */
    record And(SourceSpan span, Expression expression) implements Expression {}

    /**
     * Negative lookahead: !e
     */
    record Not(SourceSpan span, Expression expression) implements Expression {}

    // === Special ===

    /**
     * Token boundary: < e > - captures matched text, no whitespace skipping inside.
     */
    record TokenBoundary(SourceSpan span, Expression expression) implements Expression {}

    record Group(SourceSpan span, Expression expression) implements Expression {}

    /**
     * Single nested expression of a wrapper, or {@code null} for terminals and composites.
     */
    static Expression inner(Expression expr) {
        if (expr instanceof ZeroOrMore zom) {
            return zom.expression();
        }
        if (expr instanceof OneOrMore oom) {
            return oom.expression();
        }
        if (expr instanceof Optional opt) {
            return opt.expression();
        }
        if (expr instanceof And and) {
            return and.expression();
        }
        if (expr instanceof Not not) {
            return not.expression();
        }
        if (expr instanceof TokenBoundary tb) {
            return tb.expression();
        }
        if (expr instanceof Group grp) {
            return grp.expression();
        }
        return null;
    }

    /**
     * Direct sub-expressions, in order.
     */
    static List<Expression> children(Expression expr) {
        if (expr instanceof Sequence seq) {
            return seq.elements();
        }
        if (expr instanceof Choice choice) {
            return choice.alternatives();
        }
        var inner = inner(expr);
        return inner == null
               ? List.of()
               : List.of(inner);
    }
}
