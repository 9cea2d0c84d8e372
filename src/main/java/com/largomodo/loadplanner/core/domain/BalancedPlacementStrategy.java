package com.largomodo.loadplanner.core.domain;

import java.util.List;
import java.util.Optional;

/**
 * Center-of-gravity placement: picks the run that keeps the resulting CG arm
 * closest to a target arm.
 * <p>
 * Each run is scored by {@code |(M + m) / (W + w) - target|} where M and W are the
 * totals already loaded and m is the container's moment over that run. The target
 * is the plain mean arm of every slot in the pool, fixed when the run starts.
 * Lower scores win; ties go to the earlier run. Still greedy: earlier containers
 * are never moved to improve the balance for later ones.
 */
public class BalancedPlacementStrategy implements PlacementStrategy {

    private final double targetArm;

    public BalancedPlacementStrategy(double targetArm) {
        this.targetArm = targetArm;
    }

    /**
     * Strategy targeting the mean arm of the given slots (0.0 for an empty pool).
     */
    public static BalancedPlacementStrategy forPool(List<Slot> pool) {
        return new BalancedPlacementStrategy(pool.stream().mapToDouble(Slot::getArm).average().orElse(0.0));
    }

    public double getTargetArm() {
        return targetArm;
    }

    @Override
    public Optional<SlotRun> select(Container container, List<SlotRun> runs, LoadState load) {
        SlotRun best = null;
        double bestScore = Double.MAX_VALUE;
        for (SlotRun run : runs) {
            double score = score(container, run, load);
            if (best == null || score < bestScore) {
                best = run;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    double score(Container container, SlotRun run, LoadState load) {
        double weight = load.getTotalWeight() + container.weight();
        if (weight <= 0) {
            // Nothing loaded and a weightless container: rank by where the run sits
            return Math.abs(run.meanArm() - targetArm);
        }
        double moment = load.getTotalMoment() + run.momentFor(container.weight());
        return Math.abs(moment / weight - targetArm);
    }
}
