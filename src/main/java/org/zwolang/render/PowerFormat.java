package org.zwolang.render;

import io.vavr.control.Option;
import org.zwolang.model.Value;

/**
 * Renders power values as fractions of FTP.
 */
public record PowerFormat(Option<Integer> ftp) {

    public String format(Value power) {
        if (power instanceof Value.Number watts) {
            var threshold = ftp.getOrElseThrow(() -> new IllegalStateException("Absolute watts rendered without FTP"));
            return Double.toString(watts.value() / (double) threshold);
        }
        if (Value.isRelativePower(power)) {
            return power.format();
        }
        throw new IllegalArgumentException("Not a power value: " + power.format());
    }
}
