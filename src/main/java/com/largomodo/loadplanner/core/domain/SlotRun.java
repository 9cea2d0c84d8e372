package com.largomodo.loadplanner.core.domain;

import java.util.List;

/**
 * A run of consecutive free slots on one deck that could take a container.
 *
 * @param slots slots of the run, ordered by index (unmodifiable, never empty)
 */
public record SlotRun(List<Slot> slots) {

    /**
     * @throws IllegalArgumentException if the run is empty, spans decks, or has index gaps
     */
    public SlotRun {
        if (slots == null || slots.isEmpty()) {
            throw new IllegalArgumentException("A slot run needs at least one slot");
        }
        slots = List.copyOf(slots);
        Slot first = slots.get(0);
        for (int k = 1; k < slots.size(); k++) {
            Slot slot = slots.get(k);
            if (slot.getDeck() != first.getDeck() || slot.getIndex() != first.getIndex() + k) {
                throw new IllegalArgumentException("Slots are not consecutive on one deck: " + slots);
            }
        }
    }

    public Deck deck() {
        return slots.get(0).getDeck();
    }

    public int startIndex() {
        return slots.get(0).getIndex();
    }

    public int width() {
        return slots.size();
    }

    public double meanArm() {
        return slots.stream().mapToDouble(Slot::getArm).average().orElse(0.0);
    }

    /**
     * Moment of a container spread evenly over this run: {@code sum(weight / width * arm)}.
     */
    public double momentFor(double weight) {
        double share = weight / width();
        double moment = 0.0;
        for (Slot slot : slots) {
            moment += share * slot.getArm();
        }
        return moment;
    }
}
