package org.zwolang.syntax;

import io.vavr.control.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zwolang.error.ZwomError;
import org.zwolang.model.Workout;
import org.zwolang.peg.PegParser;
import org.zwolang.peg.parser.Parser;
import org.zwolang.peg.parser.ParserConfig;
import org.zwolang.peg.tree.CstNode;

/**
 * Parser for ZWOM source text.
 *
 * <p>Comments start with {@code ;} and run to the end of the line. They may appear between blocks,
 * inside a block, or after a parameter value; they are kept as trivia in the syntax tree and never
 * reach the value model.
 */
public final class ZwomParser {
    private static final Logger log = LoggerFactory.getLogger(ZwomParser.class);

    static final String GRAMMAR = """
        # ZWOM workout description
        Workout    <- Block*
        Block      <- Keyword '{' Parameter* '}'
        Parameter  <- (Message / Assignment) ','?
        Assignment <- Keyword (Text / Range / Scalar)
        Message    <- '@' Duration Text

        Range      <- Scalar '->' Scalar
        Scalar     <- Duration / Percent / Zone / Number

        Duration   <- < [0-9]+ ':' [0-9]+ >
        Percent    <- < [0-9]+ '%' >
        Zone       <- < 'Z' [0-9]+ / 'SS' >
        Number     <- < [0-9]+ >
        Keyword    <- < [A-Z] [A-Z_]* >
        Text       <- < '"' [^"]* '"' >

        %whitespace <- ([ \\t\\r\\n]+ / ';' [^\\n]*)*
        """;

    private final Parser parser;

    private ZwomParser(Parser parser) {
        this.parser = parser;
    }

    public static ZwomParser create() {
        return create(ParserConfig.DEFAULT);
    }

    public static ZwomParser create(ParserConfig config) {
        return PegParser.fromGrammar(GRAMMAR, config)
                        .map(ZwomParser::new)
                        .getOrElseThrow(error -> new IllegalStateException("Invalid ZWOM grammar: " + error.message()));
    }

    /**
     * Parse source text into raw blocks. Empty or whitespace-only text yields an empty workout.
     */
    public Either<ZwomError, Workout> parse(String source) {
        return tree(source)
            .flatMap(ZwomVisitor::workout)
            .peek(workout -> log.debug("Parsed {} block(s)", workout.blocks().size()));
    }

    /**
     * Parse source text into its concrete syntax tree, comments included as trivia.
     */
    public Either<ZwomError, CstNode> tree(String source) {
        return parser.parseCst(source);
    }
}
