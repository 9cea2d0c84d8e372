package com.largomodo.loadplanner.core.domain;

import java.util.OptionalDouble;

/**
 * Running weight and moment totals of the containers placed so far.
 * <p>
 * Moments are accumulated per occupied slot ({@code weight / width * arm} for
 * each slot of the run), so a multi-slot container contributes the arm of every
 * slot it covers rather than only its first one.
 */
public class LoadState {

    private double totalWeight;
    private double totalMoment;

    public void add(Container container, SlotRun run) {
        totalWeight += container.weight();
        totalMoment += run.momentFor(container.weight());
    }

    public double getTotalWeight() {
        return totalWeight;
    }

    public double getTotalMoment() {
        return totalMoment;
    }

    /**
     * Center-of-gravity arm of the current load, empty while no weight is loaded.
     */
    public OptionalDouble centerOfGravity() {
        return totalWeight > 0 ? OptionalDouble.of(totalMoment / totalWeight) : OptionalDouble.empty();
    }
}
