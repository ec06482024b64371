package org.zwolang.render;

/**
 * Element used for a ramp-like block, chosen by its position among the body blocks.
 */
public enum RampPosition {
    WARM_UP("WarmUp"),
    RAMP("Ramp"),
    COOLDOWN("Cooldown");

    private final String elementName;

    RampPosition(String elementName) {
        this.elementName = elementName;
    }

    public String elementName() {
        return elementName;
    }

    /**
     * Classify a ramp at 1-based {@code position} out of {@code total} body blocks. The first
     * position wins over the last, so a lone ramp is a warm-up.
     */
    public static RampPosition classify(int position, int total) {
        if (position == 1) {
            return WARM_UP;
        }
        return position == total
               ? COOLDOWN
               : RAMP;
    }
}
