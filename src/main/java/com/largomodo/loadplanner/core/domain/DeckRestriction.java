package com.largomodo.loadplanner.core.domain;

/**
 * Deck a container is allowed to be loaded on.
 */
public enum DeckRestriction {
    MAIN,
    LOWER,
    ANY;

    /**
     * Parses a user token. {@code MAIN} and {@code LOWER} are matched
     * case-insensitively after trimming; any other token (including null) means ANY.
     *
     * @param token raw user input
     * @return parsed restriction, never null
     */
    public static DeckRestriction fromToken(String token) {
        if (token == null) {
            return ANY;
        }
        String normalized = token.trim();
        if (normalized.equalsIgnoreCase("MAIN")) {
            return MAIN;
        }
        if (normalized.equalsIgnoreCase("LOWER")) {
            return LOWER;
        }
        return ANY;
    }

    public boolean permits(Deck deck) {
        return switch (this) {
            case MAIN -> deck == Deck.MAIN;
            case LOWER -> deck == Deck.LOWER;
            case ANY -> true;
        };
    }
}
