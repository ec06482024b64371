package org.zwolang.peg;

import org.junit.jupiter.api.Test;
import org.zwolang.error.SyntaxError;
import org.zwolang.peg.parser.ParserConfig;
import org.zwolang.peg.tree.CstNode;

import static org.junit.jupiter.api.Assertions.*;

class PegParserTest {

    @Test
    void parse_simpleLiteral_succeeds() {
        var parser = PegParser.fromGrammar("Root <- 'hello'").get();
        var result = parser.parseCst("hello");

        assertTrue(result.isRight());
        assertEquals("Root", result.get().rule());
    }

    @Test
    void parse_simpleLiteral_failsOnMismatch() {
        var parser = PegParser.fromGrammar("Root <- 'hello'").get();
        var result = parser.parseCst("world");

        assertTrue(result.isLeft());
        var error = assertInstanceOf(SyntaxError.UnexpectedInput.class, result.getLeft());
        assertEquals("w", error.found());
        assertEquals("'hello'", error.expected());
    }

    @Test
    void parse_characterClass_matchesRange() {
        var parser = PegParser.fromGrammar("Digit <- [0-9]").get();

        assertTrue(parser.parseCst("5").isRight());
        assertTrue(parser.parseCst("0").isRight());
        assertTrue(parser.parseCst("9").isRight());
        assertTrue(parser.parseCst("a").isLeft());
    }

    @Test
    void parse_negatedCharClass_matchesComplement() {
        var parser = PegParser.fromGrammar("NonQuote <- [^\"]").get();

        assertTrue(parser.parseCst("a").isRight());
        assertTrue(parser.parseCst("\"").isLeft());
    }

    @Test
    void parse_charClassWithUnderscore_matchesBoth() {
        var parser = PegParser.fromGrammar("Word <- < [A-Z_]+ >").get();

        assertEquals("START_REPEAT", ((CstNode.Token) parser.parseCst("START_REPEAT").get()).text());
        assertTrue(parser.parseCst("start").isLeft());
    }

    @Test
    void parse_anyChar_matchesSingle() {
        var parser = PegParser.fromGrammar("Any <- .").get();

        assertTrue(parser.parseCst("a").isRight());
        assertTrue(parser.parseCst("").isLeft());
    }

    @Test
    void parse_sequence_matchesAll() {
        var parser = PegParser.fromGrammar("ABC <- 'a' 'b' 'c'").get();

        assertTrue(parser.parseCst("abc").isRight());
        assertTrue(parser.parseCst("ab").isLeft());
        assertTrue(parser.parseCst("abd").isLeft());
    }

    @Test
    void parse_choice_matchesFirst() {
        var parser = PegParser.fromGrammar("Choice <- 'a' / 'b' / 'c'").get();

        assertTrue(parser.parseCst("a").isRight());
        assertTrue(parser.parseCst("c").isRight());
        assertTrue(parser.parseCst("d").isLeft());
    }

    @Test
    void parse_repetitions_respectBounds() {
        var stars = PegParser.fromGrammar("Stars <- 'a'*").get();
        var pluses = PegParser.fromGrammar("Pluses <- 'a'+").get();
        var optional = PegParser.fromGrammar("Opt <- 'a'? 'b'").get();

        assertTrue(stars.parseCst("").isRight());
        assertTrue(stars.parseCst("aaa").isRight());
        assertTrue(pluses.parseCst("").isLeft());
        assertTrue(pluses.parseCst("aa").isRight());
        assertTrue(optional.parseCst("b").isRight());
        assertTrue(optional.parseCst("ab").isRight());
    }

    @Test
    void parse_predicates_doNotConsume() {
        var parser = PegParser.fromGrammar("Root <- !'x' [a-z] &'!' '!'").get();

        assertTrue(parser.parseCst("a!").isRight());
        assertTrue(parser.parseCst("x!").isLeft());
        assertTrue(parser.parseCst("a?").isLeft());
    }

    @Test
    void parse_tokenBoundary_capturesTextWithoutWhitespace() {
        var parser = PegParser.fromGrammar("""
            Number <- < [0-9]+ >
            %whitespace <- [ ]*
            """).get();

        var node = parser.parseCst("123").get();
        var token = assertInstanceOf(CstNode.Token.class, node);
        assertEquals("Number", token.rule());
        assertEquals("123", token.text());
        assertTrue(parser.parseCst("1 2").isLeft());
    }

    @Test
    void parse_whitespace_skippedBetweenElements() {
        var parser = PegParser.fromGrammar("""
            Sum    <- Number '+' Number
            Number <- < [0-9]+ >
            %whitespace <- [ \\t]*
            """).get();

        assertTrue(parser.parseCst("1+2").isRight());
        assertTrue(parser.parseCst("  1 +\t2  ").isRight());
    }

    @Test
    void parse_ruleWrappingNamedRule_nestsInsteadOfRenaming() {
        var parser = PegParser.fromGrammar("""
            Outer <- Inner
            Inner <- 'x'
            """).get();

        var node = assertInstanceOf(CstNode.NonTerminal.class, parser.parseCst("x").get());
        assertEquals("Outer", node.rule());
        assertEquals(1, node.children().size());
        assertEquals("Inner", node.children().get(0).rule());
    }

    @Test
    void parse_intermediateNodes_areAnonymous() {
        var parser = PegParser.fromGrammar("""
            List <- Item (',' Item)*
            Item <- < [a-z]+ >
            """).get();

        var node = assertInstanceOf(CstNode.NonTerminal.class, parser.parseCst("a,b,c").get());
        assertEquals("List", node.rule());
        assertEquals("Item", node.children().get(0).rule());
        assertTrue(node.children().get(1).isAnonymous());
    }

    @Test
    void parse_prematureEnd_reportsUnexpectedEof() {
        var parser = PegParser.fromGrammar("Root <- 'a' 'b'").get();
        var result = parser.parseCst("a");

        var error = assertInstanceOf(SyntaxError.UnexpectedEof.class, result.getLeft());
        assertEquals(1, error.location().line());
        assertEquals(2, error.location().column());
        assertEquals("'b'", error.expected());
    }

    @Test
    void parse_failure_reportsFurthestLineAndColumn() {
        var parser = PegParser.fromGrammar("Lines <- ('a' '\\n')* 'b'").get();
        var result = parser.parseCst("a\na\nc");

        var error = assertInstanceOf(SyntaxError.UnexpectedInput.class, result.getLeft());
        assertEquals(3, error.location().line());
        assertEquals(1, error.location().column());
        assertEquals("c", error.found());
        assertTrue(error.expected().contains("'b'"));
    }

    @Test
    void parse_trailingInput_isRejected() {
        var parser = PegParser.fromGrammar("Root <- 'a'").get();

        assertTrue(parser.parseCst("ab").isLeft());
    }

    @Test
    void parse_withExplicitStartRule_usesThatRule() {
        var parser = PegParser.fromGrammar("""
            First  <- 'a'
            Second <- 'b'
            """).get();

        assertTrue(parser.parseCst("b", "Second").isRight());
        assertTrue(parser.parseCst("b", "Missing").isLeft());
    }

    @Test
    void fromGrammar_undefinedReference_fails() {
        var result = PegParser.fromGrammar("Root <- Missing");

        assertTrue(result.isLeft());
        assertTrue(result.getLeft().message().contains("Missing"));
    }

    @Test
    void parse_withoutPackrat_givesSameTree() {
        var grammar = """
            Expr <- Term '+' Expr / Term
            Term <- < [0-9]+ >
            """;
        var cached = PegParser.fromGrammar(grammar).get().parseCst("1+2+3").get();
        var uncached = PegParser.fromGrammar(grammar, new ParserConfig(false, true)).get().parseCst("1+2+3").get();

        assertEquals(cached, uncached);
    }
}
