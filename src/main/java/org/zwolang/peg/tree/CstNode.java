package org.zwolang.peg.tree;

import java.util.List;

/**
 * Concrete Syntax Tree node. Whitespace and comments never appear as children, they are kept
 * as trivia on the node they precede (or, for the root, follow).
 */
public sealed interface CstNode {
    /**
     * The source span covered by this node (excluding trivia).
     */
    SourceSpan span();

    /**
     * Name of the rule that produced this node, empty for anonymous intermediate nodes.
     */
    String rule();

    List<Trivia> leadingTrivia();

    List<Trivia> trailingTrivia();

    default boolean isAnonymous() {
        return rule().isEmpty();
    }

    /**
     * Leaf that matched literal text or a character class.
     */
    record Terminal(
    SourceSpan span,
    String rule,
    String text,
    List<Trivia> leadingTrivia,
    List<Trivia> trailingTrivia) implements CstNode {}

    /**
     * Interior node with children in source order.
     */
    record NonTerminal(
    SourceSpan span,
    String rule,
    List<CstNode> children,
    List<Trivia> leadingTrivia,
    List<Trivia> trailingTrivia) implements CstNode {}

    /**
     * Result of the token boundary operator {@code < >}: the matched text as a single unit.
     */
    record Token(
    SourceSpan span,
    String rule,
    String text,
    List<Trivia> leadingTrivia,
    List<Trivia> trailingTrivia) implements CstNode {}
}
