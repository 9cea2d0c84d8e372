package com.largomodo.loadplanner.util;

import com.largomodo.loadplanner.core.domain.DeckRestriction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class InputParsersTest {

    @Test
    void testIdentifierIsTrimmed() {
        ParseResult<String> result = InputParsers.parseIdentifier("  PMC123AB ");

        assertTrue(result.isOk());
        assertEquals("PMC123AB", result.value());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\t"})
    void testBlankIdentifierRejected(String input) {
        ParseResult<String> result = InputParsers.parseIdentifier(input);

        assertFalse(result.isOk());
        assertEquals("ID must not be empty.", result.error());
    }

    @ParameterizedTest
    @CsvSource({"1500, 1500.0", "' 2.5 ', 2.5", "0, 0.0"})
    void testValidWeight(String input, double expected) {
        assertEquals(expected, InputParsers.parseWeight(input).value(), 1e-9);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "heavy", "12kg", "NaN", "Infinity"})
    void testNonNumericWeightRejected(String input) {
        assertEquals("Enter a number.", InputParsers.parseWeight(input).error());
    }

    @Test
    void testNegativeWeightRejected() {
        assertEquals("Weight must not be negative.", InputParsers.parseWeight("-1").error());
    }

    @Test
    void testCount() {
        assertEquals(3, InputParsers.parseCount(" 3 ").value());
        assertEquals(0, InputParsers.parseCount("0").value());
        assertEquals("Enter a whole number.", InputParsers.parseCount("2.5").error());
        assertEquals("Enter a whole number.", InputParsers.parseCount("").error());
        assertEquals("Number must not be negative.", InputParsers.parseCount("-4").error());
    }

    @Test
    void testDeckRestrictionNeverFails() {
        assertEquals(DeckRestriction.LOWER, InputParsers.parseDeckRestriction("lower").value());
        assertEquals(DeckRestriction.ANY, InputParsers.parseDeckRestriction("cabin").value());
        assertTrue(InputParsers.parseDeckRestriction(null).isOk());
    }

    @ParameterizedTest
    @CsvSource({"y, true", "YES, true", "' Yes ', true", "n, false", "no, false", "sure, false", "'', false"})
    void testSpecialPermission(String input, boolean expected) {
        assertEquals(expected, InputParsers.parseSpecialPermission(input).value());
    }

    @Test
    void testNullSpecialPermissionDenies() {
        assertFalse(InputParsers.parseSpecialPermission(null).value());
    }
}
