package com.largomodo.loadplanner.core.domain;

/**
 * Cargo decks of an aircraft, in slot pool order.
 * <p>
 * Decks are logically disjoint: slot indices restart at zero on each deck and a
 * multi-slot container never spans both.
 */
public enum Deck {
    MAIN("main", "Main"),
    LOWER("lower", "Lower");

    private final String label;
    private final String displayName;

    Deck(String label, String displayName) {
        this.label = label;
        this.displayName = displayName;
    }

    /**
     * Lowercase name used in slot labels such as {@code main[3]}.
     */
    public String getLabel() {
        return label;
    }

    public String getDisplayName() {
        return displayName;
    }
}
