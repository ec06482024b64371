package org.zwolang.peg.grammar;

import org.zwolang.peg.tree.SourceSpan;

/**
 * A grammar rule: Name <- Expression
 */
public record Rule(SourceSpan span, String name, Expression expression) {}
