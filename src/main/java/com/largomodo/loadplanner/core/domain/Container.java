package com.largomodo.loadplanner.core.domain;

/**
 * A unit load device to be placed, as entered by the planner.
 * <p>
 * The slot width is not stored here: it is resolved from the container-type
 * catalog by id prefix at placement time.
 *
 * @param id                 container identifier, e.g. {@code PMC12345AB}
 * @param weight             total weight in kg (non-negative)
 * @param deckRestriction    deck the container may be loaded on
 * @param allowSpecialSlots  whether nose and tail slots are acceptable
 */
public record Container(String id, double weight, DeckRestriction deckRestriction, boolean allowSpecialSlots) {

    /**
     * @throws IllegalArgumentException if id is blank or weight is negative or not finite
     */
    public Container {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Container id must not be null or blank");
        }
        if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0) {
            throw new IllegalArgumentException("Container weight must be a non-negative number, got: " + weight);
        }
        if (deckRestriction == null) {
            deckRestriction = DeckRestriction.ANY;
        }
    }

    /**
     * Whether this container may occupy the given slot, ignoring occupancy.
     */
    public boolean accepts(Slot slot) {
        if (!deckRestriction.permits(slot.getDeck())) {
            return false;
        }
        return allowSpecialSlots || !slot.getZone().isSpecial();
    }
}
