package com.largomodo.loadplanner.core.domain;

/**
 * Outcome of placing one container: placed at a deck position, or unassigned.
 * <p>
 * An unassigned container is a normal outcome, not an error. For unassigned
 * outcomes {@code deck} is null, {@code startIndex} is -1 and {@code width}
 * is the width that could not be found.
 *
 * @param container  the container
 * @param deck       deck of the first occupied slot, null when unassigned
 * @param startIndex zero-based index of the first occupied slot
 * @param width      number of slots the container needs
 */
public record Assignment(Container container, Deck deck, int startIndex, int width) {

    public static final String UNASSIGNED = "UNASSIGNED";

    public static Assignment placed(Container container, SlotRun run) {
        return new Assignment(container, run.deck(), run.startIndex(), run.width());
    }

    public static Assignment unassigned(Container container, int width) {
        return new Assignment(container, null, -1, width);
    }

    public boolean isPlaced() {
        return deck != null;
    }

    /**
     * Report label: {@code main[3]} (one-based start slot) or {@code UNASSIGNED}.
     */
    public String label() {
        return isPlaced() ? deck.getLabel() + "[" + (startIndex + 1) + "]" : UNASSIGNED;
    }
}
