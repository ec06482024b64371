package org.zwolang.model;

import io.vavr.control.Option;

/**
 * Named training zones, each a fixed percentage of FTP.
 */
public enum PowerZone implements Value {
    Z1(50),
    Z2(65),
    Z3(81),
    SS(90),
    Z4(95),
    Z5(109),
    Z6(125),
    Z7(150);

    private final Value.Percentage percentage;

    PowerZone(int percent) {
        this.percentage = new Value.Percentage(percent);
    }

    public Value.Percentage percentage() {
        return percentage;
    }

    @Override
    public String format() {
        return percentage.format();
    }

    public static Option<PowerZone> fromName(String name) {
        for (var zone : values()) {
            if (zone.name().equals(name)) {
                return Option.some(zone);
            }
        }
        return Option.none();
    }
}
