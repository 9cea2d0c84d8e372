package com.largomodo.loadplanner.service;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnsiPaletteTest {

    @Test
    void testKnownTypeIsWrappedAndReset() {
        AnsiPalette palette = new AnsiPalette(Map.of("LD3", "\u001B[32m"));

        assertEquals("\u001B[32mAKE1\u001B[0m", palette.colorize("LD3", "AKE1"));
    }

    @Test
    void testUnknownOrMissingTypeIsPlain() {
        AnsiPalette palette = AnsiPalette.defaults();

        assertEquals("XYZ1", palette.colorize("ZZ9", "XYZ1"));
        assertEquals("XYZ1", palette.colorize(null, "XYZ1"));
        assertEquals("AKE1", AnsiPalette.NONE.colorize("LD3", "AKE1"));
    }
}
