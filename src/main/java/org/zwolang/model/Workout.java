package org.zwolang.model;

import java.util.List;

/**
 * Blocks in source order, as produced by the parser.
 */
public record Workout(List<Block> blocks) {

    public Workout {
        blocks = List.copyOf(blocks);
    }

    public static Workout workout(Block... blocks) {
        return new Workout(List.of(blocks));
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }
}
