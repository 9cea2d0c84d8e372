package com.largomodo.loadplanner.core.domain;

import java.util.List;
import java.util.Optional;

/**
 * Strategy interface for choosing where a container goes among its valid runs.
 * <p>
 * A run is configured with exactly one strategy; strategies are never mixed
 * within a run because they produce different assignments for the same input.
 */
public interface PlacementStrategy {
    /**
     * Selects one run for the container.
     *
     * @param container the container being placed
     * @param runs      every valid run, in slot pool order (main deck first, then by start index)
     * @param load      totals of the containers placed before this one
     * @return chosen run, empty when {@code runs} is empty
     */
    Optional<SlotRun> select(Container container, List<SlotRun> runs, LoadState load);
}
