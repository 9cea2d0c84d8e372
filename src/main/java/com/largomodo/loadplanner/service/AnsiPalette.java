package com.largomodo.loadplanner.service;

import java.util.Map;

/**
 * ANSI colours for occupied diagram cells, keyed by container type code.
 * <p>
 * Injected into the renderer rather than hardwired so the console can be
 * coloured while the saved plan and the tests stay plain.
 *
 * @param colorsByType escape sequence per type code (unmodifiable)
 */
public record AnsiPalette(Map<String, String> colorsByType) {

    public static final String RESET = "\u001B[0m";
    public static final AnsiPalette NONE = new AnsiPalette(Map.of());

    private static final String RED = "\u001B[31m";
    private static final String GREEN = "\u001B[32m";
    private static final String YELLOW = "\u001B[33m";
    private static final String BLUE = "\u001B[34m";
    private static final String MAGENTA = "\u001B[35m";
    private static final String CYAN = "\u001B[36m";
    private static final String BOLD = "\u001B[1m";

    public AnsiPalette {
        colorsByType = colorsByType == null ? Map.of() : Map.copyOf(colorsByType);
    }

    /**
     * Palette for the common IATA lower-deck and main-deck container types.
     */
    public static AnsiPalette defaults() {
        return new AnsiPalette(Map.ofEntries(
                Map.entry("LD1", BLUE),
                Map.entry("LD2", CYAN),
                Map.entry("LD3", GREEN),
                Map.entry("LD3-45", GREEN),
                Map.entry("LD4", MAGENTA),
                Map.entry("LD6", YELLOW),
                Map.entry("LD7", RED),
                Map.entry("LD8", BOLD + CYAN),
                Map.entry("LD9", BOLD + GREEN),
                Map.entry("LD11", BOLD + RED),
                Map.entry("LD26", BOLD + MAGENTA),
                Map.entry("LD39", BOLD + YELLOW),
                Map.entry("M1", CYAN),
                Map.entry("M1H", BLUE),
                Map.entry("M6", MAGENTA)));
    }

    /**
     * Wraps text in the colour of the type code; text without a colour is returned unchanged.
     */
    public String colorize(String typeCode, String text) {
        String color = typeCode == null ? null : colorsByType.get(typeCode);
        return color == null ? text : color + text + RESET;
    }
}
