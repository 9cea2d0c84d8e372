package com.largomodo.loadplanner.core;

/**
 * Fore and aft moment arms used to synthesize slot arms for a deck whose
 * catalog entry has no explicit arms.
 *
 * @param fore arm of the first slot
 * @param aft  arm of the last slot
 */
public record ArmRange(double fore, double aft) {

    public static final ArmRange MAIN_DECK_DEFAULT = new ArmRange(18.0, 36.0);
    public static final ArmRange LOWER_DECK_DEFAULT = new ArmRange(12.0, 28.0);

    public ArmRange {
        if (Double.isNaN(fore) || Double.isNaN(aft) || Double.isInfinite(fore) || Double.isInfinite(aft)) {
            throw new IllegalArgumentException("Arms must be finite numbers: fore=" + fore + ", aft=" + aft);
        }
    }

    /**
     * Parses {@code "fore,aft"}, e.g. {@code "18,36"}.
     *
     * @throws IllegalArgumentException if the text is not two comma-separated numbers
     */
    public static ArmRange parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Arm range must not be null");
        }
        String[] parts = text.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Arm range must be 'fore,aft', got: " + text);
        }
        try {
            return new ArmRange(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Arm range must contain numbers, got: " + text, e);
        }
    }
}
