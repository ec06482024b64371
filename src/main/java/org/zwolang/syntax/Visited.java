package org.zwolang.syntax;

import java.util.List;

/**
 * Result of visiting one CST node: raw text, a group of visited children, or a typed entry
 * (block, parameter, message, value) that flattening treats as a leaf.
 */
public sealed interface Visited {

    record Leaf(String text) implements Visited {}

    record Group(List<Visited> items) implements Visited {
        public Group {
            items = List.copyOf(items);
        }
    }

    record Entry(Object payload) implements Visited {}

    static Visited group(Visited... items) {
        return new Group(List.of(items));
    }

    static Visited entry(Object payload) {
        return new Entry(payload);
    }
}
