package org.zwolang.render;

import io.vavr.control.Option;
import org.zwolang.model.Block;
import org.zwolang.model.Tag;
import org.zwolang.model.Value;

import java.util.List;

/**
 * Ordered attributes of the element rendered for one block kind. An attribute whose source yields
 * nothing for a given block is left out.
 */
record BlockLayout(List<Attribute> attributes) {

    @FunctionalInterface
    interface Source {
        Option<String> valueOf(Block block, PowerFormat power);
    }

    record Attribute(String name, Source source) {}

    private static final BlockLayout FREE_RIDE = layout(
        attribute("Duration", value(Tag.DURATION)),
        attribute("Cadence", scalar(Tag.CADENCE)),
        attribute("FlatRoad", constant("0")));

    private static final BlockLayout STEADY_STATE = layout(
        attribute("Duration", value(Tag.DURATION)),
        attribute("Cadence", scalar(Tag.CADENCE)),
        attribute("Power", scalarPower()),
        attribute("PowerLow", lowPower()),
        attribute("PowerHigh", highPower()),
        attribute("pace", constant("0")));

    private static final BlockLayout RAMP = layout(
        attribute("Duration", value(Tag.DURATION)),
        attribute("Cadence", scalar(Tag.CADENCE)),
        attribute("PowerLow", lowPower()),
        attribute("PowerHigh", highPower()),
        attribute("pace", constant("0")));

    private static final BlockLayout INTERVALS = layout(
        attribute("Repeat", value(Tag.REPEAT)),
        attribute("OnDuration", left(Tag.DURATION)),
        attribute("OffDuration", right(Tag.DURATION)),
        attribute("OnPower", lowPower()),
        attribute("OffPower", highPower()),
        attribute("Cadence", left(Tag.CADENCE)),
        attribute("CadenceResting", right(Tag.CADENCE)),
        attribute("pace", constant("0")));

    static BlockLayout forKind(Tag kind) {
        if (kind == Tag.FREE) {
            return FREE_RIDE;
        }
        if (kind == Tag.SEGMENT) {
            return STEADY_STATE;
        }
        if (kind.isRampLike()) {
            return RAMP;
        }
        if (kind == Tag.INTERVALS) {
            return INTERVALS;
        }
        throw new IllegalArgumentException("No element layout for " + kind);
    }

    private static BlockLayout layout(Attribute... attributes) {
        return new BlockLayout(List.of(attributes));
    }

    private static Attribute attribute(String name, Source source) {
        return new Attribute(name, source);
    }

    // === Sources ===

    private static Source constant(String text) {
        return (block, power) -> Option.some(text);
    }

    private static Source value(Tag key) {
        return (block, power) -> block.param(key).map(Value::format);
    }

    private static Source scalar(Tag key) {
        return (block, power) -> block.param(key)
                                      .filter(value -> !(value instanceof Value.Range))
                                      .map(Value::format);
    }

    private static Source left(Tag key) {
        return (block, power) -> range(block, key).map(range -> range.left().format());
    }

    private static Source right(Tag key) {
        return (block, power) -> range(block, key).map(range -> range.right().format());
    }

    private static Source scalarPower() {
        return (block, power) -> block.param(Tag.POWER)
                                      .filter(value -> !(value instanceof Value.Range))
                                      .map(power::format);
    }

    private static Source lowPower() {
        return (block, power) -> range(block, Tag.POWER).map(range -> power.format(range.left()));
    }

    private static Source highPower() {
        return (block, power) -> range(block, Tag.POWER).map(range -> power.format(range.right()));
    }

    private static Option<Value.Range> range(Block block, Tag key) {
        return block.param(key)
                    .filter(Value.Range.class::isInstance)
                    .map(Value.Range.class::cast);
    }
}
