package org.zwolang.peg.grammar;

import org.zwolang.peg.tree.SourceLocation;
import org.zwolang.peg.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for PEG grammar syntax.
 */
public final class GrammarLexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private int pos;
    private int line;
    private int column;

    private GrammarLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<GrammarToken> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Grammar input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new GrammarLexer(input).tokenizeAll();
    }

    private List<GrammarToken> tokenizeAll() {
        var tokens = new ArrayList<GrammarToken>();
        while (!isAtEnd()) {
            skipWhitespaceAndComments();
            if (!isAtEnd()) {
                tokens.add(nextToken());
            }
        }
        tokens.add(new GrammarToken.Eof(SourceSpan.at(currentLocation())));
        return tokens;
    }

    private GrammarToken nextToken() {
        var start = currentLocation();
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (c == '%') {
            advance();
            return new GrammarToken.Directive(span(start), scanWord());
        }
        if (c == '\'' || c == '"') {
            return scanStringLiteral(start);
        }
        if (c == '[') {
            return scanCharClass(start);
        }
        return scanOperator(start);
    }

    private GrammarToken scanIdentifier(SourceLocation start) {
        var name = scanWord();
        return new GrammarToken.Identifier(span(start), name);
    }

    private String scanWord() {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return sb.toString();
    }

    private GrammarToken scanStringLiteral(SourceLocation start) {
        char quote = advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
                sb.append(unescape(advance()));
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd()) {
            return new GrammarToken.Error(span(start), "Unterminated string literal");
        }
        advance();
        return new GrammarToken.StringLiteral(span(start), sb.toString());
    }

    private GrammarToken scanCharClass(SourceLocation start) {
        advance();
        boolean negated = false;
        if (!isAtEnd() && peek() == '^') {
            negated = true;
            advance();
        }
        // Escapes stay in the pattern, the engine resolves them while matching
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != ']') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                sb.append(advance());
            }
            sb.append(advance());
        }
        if (isAtEnd()) {
            return new GrammarToken.Error(span(start), "Unterminated character class");
        }
        advance();
        return new GrammarToken.CharClassLiteral(span(start), sb.toString(), negated);
    }

    private GrammarToken scanOperator(SourceLocation start) {
        char c = advance();
        return switch (c) {
            case '<' -> {
                if (!isAtEnd() && peek() == '-') {
                    advance();
                    yield new GrammarToken.LeftArrow(span(start));
                }
                yield new GrammarToken.LAngle(span(start));
            }
            case '/' -> new GrammarToken.Slash(span(start));
            case '&' -> new GrammarToken.Ampersand(span(start));
            case '!' -> new GrammarToken.Exclamation(span(start));
            case '?' -> new GrammarToken.Question(span(start));
            case '*' -> new GrammarToken.Star(span(start));
            case '+' -> new GrammarToken.Plus(span(start));
            case '.' -> new GrammarToken.Dot(span(start));
            case '(' -> new GrammarToken.LParen(span(start));
            case ')' -> new GrammarToken.RParen(span(start));
            case '>' -> new GrammarToken.RAngle(span(start));
            default -> new GrammarToken.Error(span(start), "Unexpected character: " + c);
        };
    }

    static char unescape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case '0' -> '\0';
            default -> c;
        };
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '#') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++ );
        if (c == '\n') {
            line++ ;
            column = 1;
        } else {
            column++ ;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
