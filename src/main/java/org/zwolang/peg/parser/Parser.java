package org.zwolang.peg.parser;

import io.vavr.control.Either;
import org.zwolang.error.ZwomError;
import org.zwolang.peg.tree.CstNode;

/**
 * Parser interface - parses input text according to a grammar.
 */
public interface Parser {

    /**
     * Parse the whole input from the grammar's start rule and return the CST.
     */
    Either<ZwomError, CstNode> parseCst(String input);

    /**
     * Parse the whole input starting from a specific rule.
     */
    Either<ZwomError, CstNode> parseCst(String input, String startRule);
}
