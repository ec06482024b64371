package org.zwolang.peg.grammar;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.zwolang.error.SyntaxError;
import org.zwolang.error.ZwomError;
import org.zwolang.peg.tree.SourceLocation;
import org.zwolang.peg.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for PEG grammar syntax.
 * Converts grammar text into Grammar object.
 */
public final class GrammarParser {

    private final List<GrammarToken> tokens;
    private int pos;

    private GrammarParser(List<GrammarToken> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse grammar text into Grammar object.
     */
    public static Either<ZwomError, Grammar> parse(String grammarText) {
        var tokens = GrammarLexer.tokenize(grammarText);

        for (var token : tokens) {
            if (token instanceof GrammarToken.Error error) {
                return Either.left(new SyntaxError.InvalidLiteral(error.span().start(), error.message()));
            }
        }

        return new GrammarParser(tokens).parseGrammar();
    }

    private Either<ZwomError, Grammar> parseGrammar() {
        var rules = new ArrayList<Rule>();
        Option<Expression> whitespace = Option.none();

        while (!isAtEnd()) {
            var token = peek();

            if (token instanceof GrammarToken.Directive directive) {
                if (!directive.name().equals("whitespace")) {
                    return Either.left(new SyntaxError.InvalidLiteral(directive.span().start(),
                                                                      "Unknown directive '%" + directive.name() + "'"));
                }
                advance();
                if (!expect(GrammarToken.LeftArrow.class)) {
                    return unexpected("'<-'");
                }
                var result = parseExpression();
                if (result.isLeft()) {
                    return Either.left(result.getLeft());
                }
                whitespace = Option.some(result.get());
            } else if (token instanceof GrammarToken.Identifier) {
                var result = parseRule();
                if (result.isLeft()) {
                    return Either.left(result.getLeft());
                }
                rules.add(result.get());
            } else {
                return unexpected("rule definition or directive");
            }
        }

        return Either.right(Grammar.grammar(rules, whitespace));
    }

    private Either<ZwomError, Rule> parseRule() {
        var start = peek().span().start();
        var id = (GrammarToken.Identifier) peek();
        advance();

        if (!expect(GrammarToken.LeftArrow.class)) {
            return unexpected("'<-'");
        }

        return parseExpression()
            .map(expression -> new Rule(SourceSpan.of(start, currentLocation()), id.name(), expression));
    }

    private Either<ZwomError, Expression> parseExpression() {
        return parseChoice();
    }

    private Either<ZwomError, Expression> parseChoice() {
        var start = peek().span().start();
        var alternatives = new ArrayList<Expression>();

        var first = parseSequence();
        if (first.isLeft()) {
            return first;
        }
        alternatives.add(first.get());

        while (peek() instanceof GrammarToken.Slash) {
            advance();
            var next = parseSequence();
            if (next.isLeft()) {
                return next;
            }
            alternatives.add(next.get());
        }

        if (alternatives.size() == 1) {
            return Either.right(alternatives.get(0));
        }
        return Either.right(new Expression.Choice(SourceSpan.of(start, currentLocation()), List.copyOf(alternatives)));
    }

    private Either<ZwomError, Expression> parseSequence() {
        var start = peek().span().start();
        var elements = new ArrayList<Expression>();

        while (isSequenceElement()) {
            var result = parsePrefix();
            if (result.isLeft()) {
                return result;
            }
            elements.add(result.get());
        }

        if (elements.isEmpty()) {
            return unexpected("expression");
        }
        if (elements.size() == 1) {
            return Either.right(elements.get(0));
        }
        return Either.right(new Expression.Sequence(SourceSpan.of(start, currentLocation()), List.copyOf(elements)));
    }

    private boolean isSequenceElement() {
        var token = peek();
        // Identifier followed by <- is a new rule definition, not a reference
        if (token instanceof GrammarToken.Identifier) {
            return !(pos + 1 < tokens.size() && tokens.get(pos + 1) instanceof GrammarToken.LeftArrow);
        }
        return token instanceof GrammarToken.StringLiteral
            || token instanceof GrammarToken.CharClassLiteral
            || token instanceof GrammarToken.Dot
            || token instanceof GrammarToken.LParen
            || token instanceof GrammarToken.LAngle
            || token instanceof GrammarToken.Ampersand
            || token instanceof GrammarToken.Exclamation;
    }

    private Either<ZwomError, Expression> parsePrefix() {
        var start = peek().span().start();

        if (peek() instanceof GrammarToken.Ampersand) {
            advance();
            return parseSuffix().map(inner -> new Expression.And(SourceSpan.of(start, currentLocation()), inner));
        }
        if (peek() instanceof GrammarToken.Exclamation) {
            advance();
            return parseSuffix().map(inner -> new Expression.Not(SourceSpan.of(start, currentLocation()), inner));
        }
        return parseSuffix();
    }

    private Either<ZwomError, Expression> parseSuffix() {
        var start = peek().span().start();
        var result = parsePrimary();
        if (result.isLeft()) {
            return result;
        }
        var expr = result.get();

        while (true) {
            if (peek() instanceof GrammarToken.Star) {
                advance();
                expr = new Expression.ZeroOrMore(SourceSpan.of(start, currentLocation()), expr);
            } else if (peek() instanceof GrammarToken.Plus) {
                advance();
                expr = new Expression.OneOrMore(SourceSpan.of(start, currentLocation()), expr);
            } else if (peek() instanceof GrammarToken.Question) {
                advance();
                expr = new Expression.Optional(SourceSpan.of(start, currentLocation()), expr);
            } else {
                break;
            }
        }

        return Either.right(expr);
    }

    private Either<ZwomError, Expression> parsePrimary() {
        var token = peek();
        var start = token.span().start();

        if (token instanceof GrammarToken.Identifier id) {
            advance();
            return Either.right(new Expression.Reference(token.span(), id.name()));
        }
        if (token instanceof GrammarToken.StringLiteral str) {
            advance();
            return Either.right(new Expression.Literal(token.span(), str.value()));
        }
        if (token instanceof GrammarToken.CharClassLiteral cc) {
            advance();
            return Either.right(new Expression.CharClass(token.span(), cc.pattern(), cc.negated()));
        }
        if (token instanceof GrammarToken.Dot) {
            advance();
            return Either.right(new Expression.Any(token.span()));
        }
        if (token instanceof GrammarToken.LParen) {
            advance();
            return parseEnclosed(GrammarToken.RParen.class, "')'")
                .map(inner -> new Expression.Group(SourceSpan.of(start, currentLocation()), inner));
        }
        if (token instanceof GrammarToken.LAngle) {
            advance();
            return parseEnclosed(GrammarToken.RAngle.class, "'>'")
                .map(inner -> new Expression.TokenBoundary(SourceSpan.of(start, currentLocation()), inner));
        }

        return unexpected("expression");
    }

    private Either<ZwomError, Expression> parseEnclosed(Class<? extends GrammarToken> closing, String description) {
        var inner = parseExpression();
        if (inner.isLeft()) {
            return inner;
        }
        if (!expect(closing)) {
            return unexpected(description);
        }
        return inner;
    }

    private <T> Either<ZwomError, T> unexpected(String expected) {
        var token = peek();
        return Either.left(new SyntaxError.UnexpectedInput(token.span().start(), GrammarToken.describe(token), expected));
    }

    private boolean isAtEnd() {
        return peek() instanceof GrammarToken.Eof;
    }

    private GrammarToken peek() {
        return tokens.get(pos);
    }

    private void advance() {
        if (!isAtEnd()) {
            pos++;
        }
    }

    private boolean expect(Class<? extends GrammarToken> tokenClass) {
        if (tokenClass.isInstance(peek())) {
            advance();
            return true;
        }
        return false;
    }

    private SourceLocation currentLocation() {
        return peek().span().start();
    }
}
