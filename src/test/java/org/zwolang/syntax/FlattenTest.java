package org.zwolang.syntax;

import org.junit.jupiter.api.Test;
import org.zwolang.model.Block;
import org.zwolang.model.Message;
import org.zwolang.model.Tag;
import org.zwolang.model.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FlattenTest {

    private static final Message MESSAGE = new Message(new Value.Duration(30), "Go");
    private static final Block FIRST = new Block(Tag.FREE, Map.of(), List.of(MESSAGE));
    private static final Block SECOND = Block.block(Tag.SEGMENT, Map.of());

    @Test
    void flatten_preservesDocumentOrderAcrossNesting() {
        var tree = Visited.group(
            new Visited.Leaf("{"),
            Visited.group(Visited.group(Visited.entry(FIRST)), new Visited.Leaf(",")),
            Visited.entry(SECOND));

        assertThat(Flatten.flatten(tree, Block.class)).containsExactly(FIRST, SECOND);
    }

    @Test
    void flatten_doesNotDescendIntoEntries() {
        var tree = Visited.group(Visited.entry(FIRST), Visited.entry(MESSAGE));

        assertThat(Flatten.flatten(tree, Block.class)).containsExactly(FIRST);
        assertThat(Flatten.flatten(tree, Message.class)).containsExactly(MESSAGE);
    }

    @Test
    void flatten_bareEntryRoot_isFound() {
        assertThat(Flatten.flatten(Visited.entry(SECOND), Block.class)).containsExactly(SECOND);
        assertThat(Flatten.flatten(new Visited.Leaf("x"), Block.class)).isEmpty();
    }

    @Test
    void flatten_twoPassesRecoverBothKinds() {
        var tree = Visited.group(
            Visited.entry(MESSAGE),
            Visited.group(Visited.entry(FIRST), Visited.group(Visited.entry(MESSAGE))),
            Visited.entry(SECOND));

        assertThat(Flatten.flatten(tree, Block.class)).containsExactly(FIRST, SECOND);
        assertThat(Flatten.flatten(tree, Message.class)).containsExactly(MESSAGE, MESSAGE);
    }

    @Test
    void flatten_deepNesting_doesNotOverflowStack() {
        Visited tree = Visited.entry(SECOND);
        for (int i = 0; i < 100_000; i++) {
            tree = Visited.group(tree);
        }

        assertThat(Flatten.flatten(tree, Block.class)).containsExactly(SECOND);
    }

    @Test
    void flatten_wideGroup_keepsEveryItem() {
        var items = new ArrayList<Visited>();
        for (int i = 0; i < 50; i++) {
            items.add(Visited.entry(new Value.Number(i)));
        }

        var numbers = Flatten.flatten(new Visited.Group(items), Value.Number.class);

        assertThat(numbers).hasSize(50);
        assertThat(numbers.get(49).value()).isEqualTo(49);
    }
}
