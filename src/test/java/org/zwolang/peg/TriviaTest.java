package org.zwolang.peg;

import org.junit.jupiter.api.Test;
import org.zwolang.peg.parser.ParserConfig;
import org.zwolang.peg.tree.CstNode;
import org.zwolang.peg.tree.Trivia;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Each match of the inner whitespace expression becomes one Trivia item.
 */
class TriviaTest {

    private static final String COMMENTED = """
        Pair   <- Number ',' Number
        Number <- < [0-9]+ >
        %whitespace <- ([ \\t\\n]+ / ';' [^\\n]*)*
        """;

    @Test
    void leadingWhitespace_eachCharacterIsSeparateTrivia() {
        var parser = PegParser.fromGrammar("""
            Number <- < [0-9]+ >
            %whitespace <- [ \\t]+
            """).get();

        var node = parser.parseCst("  42").get();

        assertThat(node.leadingTrivia()).hasSize(2);
        assertThat(node.leadingTrivia().get(0)).isInstanceOf(Trivia.Whitespace.class);
        assertThat(node.leadingTrivia().get(0).text()).isEqualTo(" ");
    }

    @Test
    void whitespaceRuns_withChoiceGrammar_areGrouped() {
        var parser = PegParser.fromGrammar(COMMENTED).get();

        var node = parser.parseCst("   1,2").get();

        assertThat(node.leadingTrivia()).hasSize(1);
        assertThat(node.leadingTrivia().get(0).text()).isEqualTo("   ");
    }

    @Test
    void comments_areClassifiedAndAttachedToFollowingNode() {
        var parser = PegParser.fromGrammar(COMMENTED).get();

        var node = (CstNode.NonTerminal) parser.parseCst("1 ; first\n, 2").get();
        var comma = node.children().get(1);

        assertThat(comma.leadingTrivia()).hasSize(3);
        assertThat(comma.leadingTrivia().get(1)).isInstanceOf(Trivia.LineComment.class);
        assertThat(((Trivia.LineComment) comma.leadingTrivia().get(1)).body()).isEqualTo("first");
        assertThat(node.children().get(2).leadingTrivia()).hasSize(1);
    }

    @Test
    void trailingTrivia_isAttachedToRoot() {
        var parser = PegParser.fromGrammar(COMMENTED).get();

        var node = parser.parseCst("1,2 ; done").get();

        assertThat(node.trailingTrivia())
            .extracting(Trivia::text)
            .containsExactly(" ", "; done");
    }

    @Test
    void triviaSpans_coverTheirText() {
        var parser = PegParser.fromGrammar(COMMENTED).get();
        var input = "\n\n; note\n1,2";

        var trivia = parser.parseCst(input).get().leadingTrivia();

        assertThat(trivia).allSatisfy(item -> assertThat(item.span().extract(input)).isEqualTo(item.text()));
        assertThat(trivia.get(1).span().start().line()).isEqualTo(3);
    }

    @Test
    void captureDisabled_skipsWithoutRecording() {
        var parser = PegParser.fromGrammar(COMMENTED, new ParserConfig(true, false)).get();

        var node = parser.parseCst(" 1 , 2 ").get();

        assertThat(node.leadingTrivia()).isEmpty();
        assertThat(node.trailingTrivia()).isEmpty();
    }
}
