package org.zwolang.peg.parser;

import io.vavr.control.Option;
import org.zwolang.peg.tree.SourceLocation;
import org.zwolang.peg.tree.SourceSpan;

import java.util.HashMap;
import java.util.Map;

/**
 * Mutable parsing context that tracks state during one parse.
 */
public final class ParsingContext {

    private final String input;
    private final ParserConfig config;
    private final Map<Long, ParseResult> packratCache;
    private final Map<String, Integer> ruleIds;

    private SourceLocation location;
    private SourceLocation furthest;
    private String furthestExpected;
    private int tokenBoundaryDepth;
    private boolean skippingWhitespace;

    private ParsingContext(String input, ParserConfig config) {
        this.input = input;
        this.config = config;
        this.packratCache = config.packratEnabled() ? new HashMap<>() : null;
        this.ruleIds = new HashMap<>();
        this.location = SourceLocation.START;
        this.furthest = SourceLocation.START;
        this.furthestExpected = "";
    }

    public static ParsingContext create(String input, ParserConfig config) {
        return new ParsingContext(input, config);
    }

    // === Position Management ===

    public int pos() {
        return location.offset();
    }

    public SourceLocation location() {
        return location;
    }

    public void restoreLocation(SourceLocation loc) {
        this.location = loc;
    }

    public boolean isAtEnd() {
        return location.offset() >= input.length();
    }

    public int remaining() {
        return input.length() - location.offset();
    }

    // === Character Access ===

    public char peek() {
        return input.charAt(location.offset());
    }

    public char peek(int offset) {
        return input.charAt(location.offset() + offset);
    }

    public char advance() {
        char c = peek();
        location = location.advance(c);
        return c;
    }

    public String substring(int start, int end) {
        return input.substring(start, end);
    }

    public SourceSpan spanFrom(SourceLocation start) {
        return SourceSpan.of(start, location);
    }

    // === Error Tracking ===

    /**
     * Record what was expected at the current position if it is the furthest one reached.
     */
    public void updateFurthest(String expected) {
        // Whitespace attempts never explain a failure
        if (skippingWhitespace) {
            return;
        }
        if (location.offset() > furthest.offset()) {
            furthest = location;
            furthestExpected = expected;
        } else if (location.offset() == furthest.offset() && !furthestExpected.contains(expected)) {
            furthestExpected = furthestExpected.isEmpty()
                ? expected
                : furthestExpected + " or " + expected;
        }
    }

    public SourceLocation furthestLocation() {
        return furthest;
    }

    public String furthestExpected() {
        return furthestExpected;
    }

    /**
     * Character at the furthest position, or empty when that position is the end of input.
     */
    public Option<Character> furthestFound() {
        return furthest.offset() < input.length()
            ? Option.some(input.charAt(furthest.offset()))
            : Option.none();
    }

    // === Token Boundary Tracking ===

    public void enterTokenBoundary() {
        tokenBoundaryDepth++;
    }

    public void exitTokenBoundary() {
        tokenBoundaryDepth--;
    }

    public boolean inTokenBoundary() {
        return tokenBoundaryDepth > 0;
    }

    // === Whitespace Skipping Guard ===

    public boolean isSkippingWhitespace() {
        return skippingWhitespace;
    }

    public void enterWhitespaceSkip() {
        skippingWhitespace = true;
    }

    public void exitWhitespaceSkip() {
        skippingWhitespace = false;
    }

    // === Packrat Cache ===

    public Option<ParseResult> getCachedAt(String ruleName, int position) {
        if (packratCache == null) {
            return Option.none();
        }
        return Option.of(packratCache.get(packratKey(ruleName, position)));
    }

    public void cacheAt(String ruleName, int position, ParseResult result) {
        if (packratCache != null) {
            packratCache.put(packratKey(ruleName, position), result);
        }
    }

    private long packratKey(String ruleName, int position) {
        int ruleId = ruleIds.computeIfAbsent(ruleName, k -> ruleIds.size());
        return ((long) ruleId << 32) | (position & 0xFFFFFFFFL);
    }

    public ParserConfig config() {
        return config;
    }
}
