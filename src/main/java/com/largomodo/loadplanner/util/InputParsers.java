package com.largomodo.loadplanner.util;

import com.largomodo.loadplanner.core.domain.DeckRestriction;

import java.util.Locale;

/**
 * Validation of the text tokens a planner types or lists in a container file.
 * <p>
 * Pure functions with no state. Safe for concurrent use.
 */
public class InputParsers {

    private InputParsers() {
        // Static utility class - prevent instantiation
    }

    /**
     * Container id: any non-blank text, trimmed.
     */
    public static ParseResult<String> parseIdentifier(String input) {
        if (input == null || input.isBlank()) {
            return ParseResult.failure("ID must not be empty.");
        }
        return ParseResult.ok(input.trim());
    }

    /**
     * Weight in kg: a finite, non-negative decimal number.
     */
    public static ParseResult<Double> parseWeight(String input) {
        if (input == null || input.isBlank()) {
            return ParseResult.failure("Enter a number.");
        }
        double weight;
        try {
            weight = Double.parseDouble(input.trim());
        } catch (NumberFormatException e) {
            return ParseResult.failure("Enter a number.");
        }
        if (Double.isNaN(weight) || Double.isInfinite(weight)) {
            return ParseResult.failure("Enter a number.");
        }
        if (weight < 0) {
            return ParseResult.failure("Weight must not be negative.");
        }
        return ParseResult.ok(weight);
    }

    /**
     * Count of slots or containers: a non-negative integer.
     */
    public static ParseResult<Integer> parseCount(String input) {
        if (input == null || input.isBlank()) {
            return ParseResult.failure("Enter a whole number.");
        }
        int count;
        try {
            count = Integer.parseInt(input.trim());
        } catch (NumberFormatException e) {
            return ParseResult.failure("Enter a whole number.");
        }
        if (count < 0) {
            return ParseResult.failure("Number must not be negative.");
        }
        return ParseResult.ok(count);
    }

    /**
     * Deck token: never fails, unknown tokens mean ANY.
     */
    public static ParseResult<DeckRestriction> parseDeckRestriction(String input) {
        return ParseResult.ok(DeckRestriction.fromToken(input));
    }

    /**
     * Nose/tail permission: {@code y} or {@code yes} in any case allows, anything else denies.
     */
    public static ParseResult<Boolean> parseSpecialPermission(String input) {
        if (input == null) {
            return ParseResult.ok(false);
        }
        String normalized = input.trim().toLowerCase(Locale.ROOT);
        return ParseResult.ok(normalized.equals("y") || normalized.equals("yes"));
    }
}
