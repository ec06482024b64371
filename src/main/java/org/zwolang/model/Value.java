package org.zwolang.model;

import java.util.Locale;

/**
 * Literal and composite values a ZWOM parameter can hold.
 */
public sealed interface Value permits Value.Number, Value.Percentage, PowerZone, Value.Duration, Value.Range, Value.Text {

    /**
     * Text form used in diagnostics and in the output document.
     */
    String format();

    /**
     * Bare non-negative integer: watts, rpm, repeat count or FTP depending on the key.
     */
    record Number(int value) implements Value {
        @Override
        public String format() {
            return Integer.toString(value);
        }
    }

    /**
     * Percentage of FTP, stored as the numerator out of 100.
     */
    record Percentage(int value) implements Value {
        public double fraction() {
            return value / 100.0;
        }

        @Override
        public String format() {
            return String.format(Locale.ROOT, "%.3f", fraction());
        }
    }

    record Duration(int seconds) implements Value {
        public static Duration of(int minutes, int seconds) {
            return new Duration(minutes * 60 + seconds);
        }

        @Override
        public String format() {
            return Integer.toString(seconds);
        }
    }

    /**
     * Two endpoints of the same family: durations, relative powers (percentages and zones) or numbers.
     */
    record Range(Value left, Value right) implements Value {
        @Override
        public String format() {
            return left.format() + " -> " + right.format();
        }
    }

    record Text(String text) implements Value {
        @Override
        public String format() {
            return text;
        }
    }

    /**
     * True for values expressing power relative to FTP.
     */
    static boolean isRelativePower(Value value) {
        return value instanceof Percentage || value instanceof PowerZone;
    }
}
