package com.largomodo.loadplanner.core.domain;

/**
 * Aircraft model with its two cargo decks.
 *
 * @param model              model name, e.g. {@code B747-400F}
 * @param mainDeck           main deck geometry
 * @param lowerDeck          lower deck geometry
 * @param maxTakeoffWeight   maximum takeoff weight in kg; reported, never enforced
 */
public record Aircraft(String model, DeckGeometry mainDeck, DeckGeometry lowerDeck, int maxTakeoffWeight) {

    public Aircraft {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model must not be null or blank");
        }
        if (mainDeck == null || lowerDeck == null) {
            throw new IllegalArgumentException("Deck geometries must not be null");
        }
    }

    public DeckGeometry geometry(Deck deck) {
        return deck == Deck.MAIN ? mainDeck : lowerDeck;
    }
}
