package org.zwolang.peg;

import io.vavr.control.Either;
import org.zwolang.error.ZwomError;
import org.zwolang.peg.grammar.Grammar;
import org.zwolang.peg.grammar.GrammarParser;
import org.zwolang.peg.parser.Parser;
import org.zwolang.peg.parser.ParserConfig;
import org.zwolang.peg.parser.PegEngine;

/**
 * Entry point for creating PEG parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = PegParser.fromGrammar("""
 *     Number <- < [0-9]+ >
 *     %whitespace <- [ \\t]*
 *     """).get();
 *
 * var result = parser.parseCst("123");
 * }</pre>
 */
public final class PegParser {
    private PegParser() {}

    /**
     * Create a parser from grammar text.
     */
    public static Either<ZwomError, Parser> fromGrammar(String grammarText) {
        return fromGrammar(grammarText, ParserConfig.DEFAULT);
    }

    /**
     * Create a parser from grammar text with custom configuration.
     */
    public static Either<ZwomError, Parser> fromGrammar(String grammarText, ParserConfig config) {
        return GrammarParser.parse(grammarText)
                            .flatMap(grammar -> fromGrammar(grammar, config));
    }

    /**
     * Create a parser from a pre-parsed grammar with custom configuration.
     */
    public static Either<ZwomError, Parser> fromGrammar(Grammar grammar, ParserConfig config) {
        return grammar.validate()
                      .map(g -> (Parser) PegEngine.create(g, config));
    }
}
