package com.largomodo.loadplanner.core;

import com.largomodo.loadplanner.core.domain.Assignment;
import com.largomodo.loadplanner.core.domain.Deck;
import com.largomodo.loadplanner.core.domain.Slot;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Result of a placement run: one assignment per container in input order, the
 * final slot pool, and the aggregate totals.
 *
 * @param assignments  outcomes in container input order (unmodifiable)
 * @param slots        slot pool, main deck first (unmodifiable view; slots are final once the run ends)
 * @param totalWeight  sum of placed container weights
 * @param totalMoment  sum of per-slot weight times arm over placed containers
 */
public record LoadPlan(List<Assignment> assignments, List<Slot> slots, double totalWeight, double totalMoment) {

    public LoadPlan {
        assignments = List.copyOf(assignments);
        slots = List.copyOf(slots);
    }

    public List<Slot> slots(Deck deck) {
        return slots.stream().filter(slot -> slot.getDeck() == deck).toList();
    }

    public long placedCount() {
        return assignments.stream().filter(Assignment::isPlaced).count();
    }

    public List<Assignment> unassigned() {
        return assignments.stream().filter(a -> !a.isPlaced()).toList();
    }

    /**
     * CG arm of the placed load, empty when nothing with weight was placed.
     */
    public OptionalDouble centerOfGravity() {
        return totalWeight > 0 ? OptionalDouble.of(totalMoment / totalWeight) : OptionalDouble.empty();
    }
}
