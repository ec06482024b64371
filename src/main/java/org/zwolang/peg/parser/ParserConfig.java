package org.zwolang.peg.parser;

/**
 * Parser configuration options.
 *
 * @param packratEnabled memoise rule results per input position
 * @param captureTrivia  keep skipped whitespace and comments as trivia on CST nodes
 */
public record ParserConfig(
    boolean packratEnabled,
    boolean captureTrivia
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        true,
        true
    );
}
