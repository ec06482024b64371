package org.zwolang.peg.parser;

import io.vavr.control.Either;
import org.zwolang.error.SyntaxError;
import org.zwolang.error.ZwomError;
import org.zwolang.peg.grammar.Expression;
import org.zwolang.peg.grammar.Grammar;
import org.zwolang.peg.grammar.Rule;
import org.zwolang.peg.tree.CstNode;
import org.zwolang.peg.tree.SourceLocation;
import org.zwolang.peg.tree.SourceSpan;
import org.zwolang.peg.tree.Trivia;

import java.util.ArrayList;
import java.util.List;

/**
 * PEG parsing engine - interprets a Grammar to build a concrete syntax tree.
 *
 * <p>Each rule wraps its match in a node carrying the rule name. Anonymous intermediate nodes
 * (sequences, repetitions, empty optionals) have an empty rule name; when a rule matches a single
 * node that already belongs to another rule, the result is nested rather than renamed, so every
 * rule that matched stays visible in the tree. Repetitions that matched exactly once collapse to
 * their only child.
 */
public final class PegEngine implements Parser {

    private final Grammar grammar;
    private final ParserConfig config;

    private PegEngine(Grammar grammar, ParserConfig config) {
        this.grammar = grammar;
        this.config = config;
    }

    public static PegEngine create(Grammar grammar, ParserConfig config) {
        return new PegEngine(grammar, config);
    }

    @Override
    public Either<ZwomError, CstNode> parseCst(String input) {
        var startRule = grammar.startRule();
        if (startRule.isEmpty()) {
            return Either.left(new SyntaxError.InvalidLiteral(SourceLocation.START, "No start rule defined in grammar"));
        }
        return parseCst(input, startRule.get().name());
    }

    @Override
    public Either<ZwomError, CstNode> parseCst(String input, String startRule) {
        var ruleOpt = grammar.rule(startRule);
        if (ruleOpt.isEmpty()) {
            return Either.left(new SyntaxError.InvalidLiteral(SourceLocation.START, "Unknown rule: " + startRule));
        }

        var ctx = ParsingContext.create(input, config);
        var result = parseRule(ctx, ruleOpt.get());

        if (result.isFailure()) {
            return Either.left(furthestError(ctx, "end of input"));
        }

        var trailingTrivia = skipWhitespace(ctx);

        if (!ctx.isAtEnd()) {
            // The start rule stopped early; the furthest failure explains why
            if (ctx.furthestLocation().offset() >= ctx.pos() && !ctx.furthestExpected().isEmpty()) {
                return Either.left(furthestError(ctx, "end of input"));
            }
            return Either.left(new SyntaxError.UnexpectedInput(ctx.location(), String.valueOf(ctx.peek()), "end of input"));
        }

        var success = (ParseResult.Success) result;
        return Either.right(withTrailingTrivia(success.node(), trailingTrivia));
    }

    private static SyntaxError furthestError(ParsingContext ctx, String fallback) {
        var expected = ctx.furthestExpected().isEmpty() ? fallback : ctx.furthestExpected();
        var location = ctx.furthestLocation();
        return ctx.furthestFound()
                  .<SyntaxError>map(found -> new SyntaxError.UnexpectedInput(location, printable(found), expected))
                  .getOrElse(() -> new SyntaxError.UnexpectedEof(location, expected));
    }

    private static String printable(char c) {
        return switch (c) {
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            case '\t' -> "\\t";
            default -> String.valueOf(c);
        };
    }

    // === Rule Parsing ===

    private ParseResult parseRule(ParsingContext ctx, Rule rule) {
        var startPos = ctx.pos();
        var startLoc = ctx.location();

        var cached = ctx.getCachedAt(rule.name(), startPos);
        if (cached.isDefined()) {
            var result = cached.get();
            if (result instanceof ParseResult.Success success) {
                ctx.restoreLocation(success.endLocation());
            }
            return result;
        }

        var leadingTrivia = skipWhitespace(ctx);
        var result = parseExpression(ctx, rule.expression());

        if (result instanceof ParseResult.Success success) {
            var node = wrapWithRuleName(success.node(), rule.name(), leadingTrivia);
            var wrapped = ParseResult.Success.of(node, ctx.location());
            ctx.cacheAt(rule.name(), startPos, wrapped);
            return wrapped;
        }
        if (result instanceof ParseResult.PredicateSuccess) {
            var node = new CstNode.NonTerminal(SourceSpan.at(ctx.location()), rule.name(), List.of(), leadingTrivia, List.of());
            var wrapped = ParseResult.Success.of(node, ctx.location());
            ctx.cacheAt(rule.name(), startPos, wrapped);
            return wrapped;
        }

        ctx.restoreLocation(startLoc);
        ctx.cacheAt(rule.name(), startPos, result);
        return result;
    }

    private ParseResult parseExpression(ParsingContext ctx, Expression expr) {
        if (expr instanceof Expression.Literal lit) {
            return parseLiteral(ctx, lit);
        }
        if (expr instanceof Expression.CharClass cc) {
            return parseCharClass(ctx, cc);
        }
        if (expr instanceof Expression.Any) {
            return parseAny(ctx);
        }
        if (expr instanceof Expression.Reference ref) {
            return parseReference(ctx, ref);
        }
        if (expr instanceof Expression.Sequence seq) {
            return parseSequence(ctx, seq);
        }
        if (expr instanceof Expression.Choice choice) {
            return parseChoice(ctx, choice);
        }
        if (expr instanceof Expression.ZeroOrMore zom) {
            return parseRepeated(ctx, zom.expression(), 0);
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return parseRepeated(ctx, oom.expression(), 1);
        }
        if (expr instanceof Expression.Optional opt) {
            return parseOptional(ctx, opt);
        }
        if (expr instanceof Expression.And and) {
            return parseAnd(ctx, and);
        }
        if (expr instanceof Expression.Not not) {
            return parseNot(ctx, not);
        }
        if (expr instanceof Expression.TokenBoundary tb) {
            return parseTokenBoundary(ctx, tb);
        }
        if (expr instanceof Expression.Group grp) {
            return parseExpression(ctx, grp.expression());
        }
        throw new IllegalStateException("Unsupported expression: " + expr);
    }

    // === Terminal Parsers ===

    private ParseResult parseLiteral(ParsingContext ctx, Expression.Literal lit) {
        var text = lit.text();
        var expected = "'" + text + "'";
        if (ctx.remaining() < text.length()) {
            ctx.updateFurthest(expected);
            return ParseResult.Failure.at(ctx.location(), expected);
        }

        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) != ctx.peek(i)) {
                ctx.updateFurthest(expected);
                return ParseResult.Failure.at(ctx.location(), expected);
            }
        }

        var startLoc = ctx.location();
        for (int i = 0; i < text.length(); i++) {
            ctx.advance();
        }
        var node = new CstNode.Terminal(ctx.spanFrom(startLoc), "", text, List.of(), List.of());
        return ParseResult.Success.of(node, ctx.location());
    }

    private ParseResult parseCharClass(ParsingContext ctx, Expression.CharClass cc) {
        var expected = "[" + (cc.negated() ? "^" : "") + cc.pattern() + "]";
        if (ctx.isAtEnd()) {
            ctx.updateFurthest(expected);
            return ParseResult.Failure.at(ctx.location(), expected);
        }

        char c = ctx.peek();
        if (matchesCharClass(c, cc.pattern()) == cc.negated()) {
            ctx.updateFurthest(expected);
            return ParseResult.Failure.at(ctx.location(), expected);
        }

        var startLoc = ctx.location();
        ctx.advance();
        var node = new CstNode.Terminal(ctx.spanFrom(startLoc), "", String.valueOf(c), List.of(), List.of());
        return ParseResult.Success.of(node, ctx.location());
    }

    static boolean matchesCharClass(char c, String pattern) {
        int i = 0;
        while (i < pattern.length()) {
            char start = pattern.charAt(i);
            int consumed = 1;
            if (start == '\\' && i + 1 < pattern.length()) {
                start = unescape(pattern.charAt(i + 1));
                consumed = 2;
            }

            // Range a-z, where the upper bound may itself be escaped
            int rangeEnd = i + consumed;
            if (rangeEnd + 1 < pattern.length() && pattern.charAt(rangeEnd) == '-') {
                char end = pattern.charAt(rangeEnd + 1);
                int endConsumed = 1;
                if (end == '\\' && rangeEnd + 2 < pattern.length()) {
                    end = unescape(pattern.charAt(rangeEnd + 2));
                    endConsumed = 2;
                }
                if (c >= start && c <= end) {
                    return true;
                }
                i = rangeEnd + 1 + endConsumed;
                continue;
            }

            if (c == start) {
                return true;
            }
            i += consumed;
        }
        return false;
    }

    private static char unescape(char escaped) {
        return switch (escaped) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            default -> escaped;
        };
    }

    private ParseResult parseAny(ParsingContext ctx) {
        if (ctx.isAtEnd()) {
            ctx.updateFurthest("any character");
            return ParseResult.Failure.at(ctx.location(), "any character");
        }

        var startLoc = ctx.location();
        char c = ctx.advance();
        var node = new CstNode.Terminal(ctx.spanFrom(startLoc), "", String.valueOf(c), List.of(), List.of());
        return ParseResult.Success.of(node, ctx.location());
    }

    // === Combinator Parsers ===

    private ParseResult parseReference(ParsingContext ctx, Expression.Reference ref) {
        var ruleOpt = grammar.rule(ref.ruleName());
        if (ruleOpt.isEmpty()) {
            return ParseResult.Failure.at(ctx.location(), "rule '" + ref.ruleName() + "'");
        }
        return parseRule(ctx, ruleOpt.get());
    }

    private ParseResult parseSequence(ParsingContext ctx, Expression.Sequence seq) {
        var startLoc = ctx.location();
        var children = new ArrayList<CstNode>();

        for (var element : seq.elements()) {
            // Skip whitespace between elements, but NOT before predicates
            var trivia = isPredicate(element) ? List.<Trivia>of() : skipWhitespace(ctx);
            var result = parseExpression(ctx, element);
            if (result.isFailure()) {
                ctx.restoreLocation(startLoc);
                return result;
            }
            if (result instanceof ParseResult.Success success) {
                children.add(withLeadingTrivia(success.node(), trivia));
            }
        }

        var node = new CstNode.NonTerminal(ctx.spanFrom(startLoc), "", children, List.of(), List.of());
        return ParseResult.Success.of(node, ctx.location());
    }

    private ParseResult parseChoice(ParsingContext ctx, Expression.Choice choice) {
        var startLoc = ctx.location();
        ParseResult lastFailure = null;

        for (var alt : choice.alternatives()) {
            var result = parseExpression(ctx, alt);
            if (result.isSuccess()) {
                return result;
            }
            lastFailure = result;
            ctx.restoreLocation(startLoc);
        }

        return lastFailure != null
            ? lastFailure
            : ParseResult.Failure.at(ctx.location(), "one of alternatives");
    }

    /**
     * Zero-or-more and one-or-more share one loop; {@code min} is 0 or 1.
     */
    private ParseResult parseRepeated(ParsingContext ctx, Expression element, int min) {
        var startLoc = ctx.location();
        var children = new ArrayList<CstNode>();
        int count = 0;

        while (true) {
            var beforeLoc = ctx.location();
            var trivia = count > 0 || min == 0 ? skipWhitespace(ctx) : List.<Trivia>of();

            var result = parseExpression(ctx, element);
            if (result.isFailure()) {
                ctx.restoreLocation(beforeLoc);
                if (count < min) {
                    return result;
                }
                break;
            }

            if (result instanceof ParseResult.Success success) {
                children.add(withLeadingTrivia(success.node(), trivia));
            }
            count++;

            if (ctx.pos() == beforeLoc.offset()) {
                break;
            }
        }

        if (children.size() == 1) {
            return ParseResult.Success.of(children.get(0), ctx.location());
        }
        var node = new CstNode.NonTerminal(ctx.spanFrom(startLoc), "", children, List.of(), List.of());
        return ParseResult.Success.of(node, ctx.location());
    }

    private ParseResult parseOptional(ParsingContext ctx, Expression.Optional opt) {
        var startLoc = ctx.location();
        var result = parseExpression(ctx, opt.expression());

        if (result.isSuccess()) {
            return result;
        }

        // Optional always succeeds - empty node on no match
        ctx.restoreLocation(startLoc);
        var node = new CstNode.NonTerminal(SourceSpan.at(startLoc), "", List.of(), List.of(), List.of());
        return ParseResult.Success.of(node, ctx.location());
    }

    private boolean isPredicate(Expression expr) {
        if (expr instanceof Expression.Group grp) {
            return isPredicate(grp.expression());
        }
        return expr instanceof Expression.And || expr instanceof Expression.Not;
    }

    // === Predicate Parsers ===

    private ParseResult parseAnd(ParsingContext ctx, Expression.And and) {
        var startLoc = ctx.location();
        var result = parseExpression(ctx, and.expression());
        ctx.restoreLocation(startLoc);

        if (result.isSuccess()) {
            return new ParseResult.PredicateSuccess(startLoc);
        }
        return result;
    }

    private ParseResult parseNot(ParsingContext ctx, Expression.Not not) {
        var startLoc = ctx.location();
        var result = parseExpression(ctx, not.expression());
        ctx.restoreLocation(startLoc);

        if (result.isSuccess()) {
            return ParseResult.Failure.at(startLoc, "not " + describeExpression(not.expression()));
        }
        return new ParseResult.PredicateSuccess(startLoc);
    }

    // === Special Parsers ===

    private ParseResult parseTokenBoundary(ParsingContext ctx, Expression.TokenBoundary tb) {
        var startLoc = ctx.location();

        // Disable whitespace skipping inside token boundary
        ctx.enterTokenBoundary();
        try {
            var result = parseExpression(ctx, tb.expression());
            if (result.isFailure()) {
                ctx.restoreLocation(startLoc);
                return result;
            }

            var text = ctx.substring(startLoc.offset(), ctx.pos());
            var node = new CstNode.Token(ctx.spanFrom(startLoc), "", text, List.of(), List.of());
            return ParseResult.Success.of(node, ctx.location());
        } finally {
            ctx.exitTokenBoundary();
        }
    }

    // === Whitespace ===

    private List<Trivia> skipWhitespace(ParsingContext ctx) {
        // Don't skip whitespace inside token boundaries or while already skipping
        if (grammar.whitespace().isEmpty() || ctx.isSkippingWhitespace() || ctx.inTokenBoundary()) {
            return List.of();
        }

        var trivia = new ArrayList<Trivia>();
        ctx.enterWhitespaceSkip();
        try {
            // Match one element of the whitespace repetition at a time, one trivia item each
            var wsExpr = grammar.whitespace().get();
            var inner = wsExpr instanceof Expression.ZeroOrMore || wsExpr instanceof Expression.OneOrMore
                        ? Expression.inner(wsExpr)
                        : wsExpr;

            while (!ctx.isAtEnd()) {
                var startLoc = ctx.location();
                var result = parseExpression(ctx, inner);
                if (result.isFailure() || ctx.pos() == startLoc.offset()) {
                    ctx.restoreLocation(startLoc);
                    break;
                }
                if (config.captureTrivia()) {
                    var span = ctx.spanFrom(startLoc);
                    trivia.add(Trivia.classify(span, ctx.substring(startLoc.offset(), ctx.pos())));
                }
            }
        } finally {
            ctx.exitWhitespaceSkip();
        }
        return trivia;
    }

    // === Node Helpers ===

    private CstNode wrapWithRuleName(CstNode node, String ruleName, List<Trivia> leadingTrivia) {
        var trivia = concat(leadingTrivia, node.leadingTrivia());
        if (!node.isAnonymous()) {
            var inner = withoutLeadingTrivia(node);
            return new CstNode.NonTerminal(inner.span(), ruleName, List.of(inner), trivia, List.of());
        }
        if (node instanceof CstNode.Terminal t) {
            return new CstNode.Terminal(t.span(), ruleName, t.text(), trivia, t.trailingTrivia());
        }
        if (node instanceof CstNode.Token tok) {
            return new CstNode.Token(tok.span(), ruleName, tok.text(), trivia, tok.trailingTrivia());
        }
        var nt = (CstNode.NonTerminal) node;
        return new CstNode.NonTerminal(nt.span(), ruleName, nt.children(), trivia, nt.trailingTrivia());
    }

    private static CstNode withLeadingTrivia(CstNode node, List<Trivia> leadingTrivia) {
        if (leadingTrivia.isEmpty()) {
            return node;
        }
        var trivia = concat(leadingTrivia, node.leadingTrivia());
        if (node instanceof CstNode.Terminal t) {
            return new CstNode.Terminal(t.span(), t.rule(), t.text(), trivia, t.trailingTrivia());
        }
        if (node instanceof CstNode.Token tok) {
            return new CstNode.Token(tok.span(), tok.rule(), tok.text(), trivia, tok.trailingTrivia());
        }
        var nt = (CstNode.NonTerminal) node;
        return new CstNode.NonTerminal(nt.span(), nt.rule(), nt.children(), trivia, nt.trailingTrivia());
    }

    private static CstNode withoutLeadingTrivia(CstNode node) {
        if (node.leadingTrivia().isEmpty()) {
            return node;
        }
        if (node instanceof CstNode.Terminal t) {
            return new CstNode.Terminal(t.span(), t.rule(), t.text(), List.of(), t.trailingTrivia());
        }
        if (node instanceof CstNode.Token tok) {
            return new CstNode.Token(tok.span(), tok.rule(), tok.text(), List.of(), tok.trailingTrivia());
        }
        var nt = (CstNode.NonTerminal) node;
        return new CstNode.NonTerminal(nt.span(), nt.rule(), nt.children(), List.of(), nt.trailingTrivia());
    }

    private static CstNode withTrailingTrivia(CstNode node, List<Trivia> trailingTrivia) {
        if (trailingTrivia.isEmpty()) {
            return node;
        }
        if (node instanceof CstNode.Terminal t) {
            return new CstNode.Terminal(t.span(), t.rule(), t.text(), t.leadingTrivia(), trailingTrivia);
        }
        if (node instanceof CstNode.Token tok) {
            return new CstNode.Token(tok.span(), tok.rule(), tok.text(), tok.leadingTrivia(), trailingTrivia);
        }
        var nt = (CstNode.NonTerminal) node;
        return new CstNode.NonTerminal(nt.span(), nt.rule(), nt.children(), nt.leadingTrivia(), trailingTrivia);
    }

    private static List<Trivia> concat(List<Trivia> first, List<Trivia> second) {
        if (first.isEmpty()) {
            return second;
        }
        if (second.isEmpty()) {
            return first;
        }
        var all = new ArrayList<Trivia>(first.size() + second.size());
        all.addAll(first);
        all.addAll(second);
        return List.copyOf(all);
    }

    private String describeExpression(Expression expr) {
        if (expr instanceof Expression.Literal lit) {
            return "'" + lit.text() + "'";
        }
        if (expr instanceof Expression.CharClass cc) {
            return "[" + cc.pattern() + "]";
        }
        if (expr instanceof Expression.Reference ref) {
            return ref.ruleName();
        }
        return expr instanceof Expression.Any ? "." : "expression";
    }
}
