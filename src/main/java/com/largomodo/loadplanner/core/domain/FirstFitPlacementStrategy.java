package com.largomodo.loadplanner.core.domain;

import java.util.List;
import java.util.Optional;

/**
 * First-fit placement: the earliest-starting valid run wins.
 * <p>
 * Deterministic and order preserving; no attempt is made to balance the load.
 */
public class FirstFitPlacementStrategy implements PlacementStrategy {

    @Override
    public Optional<SlotRun> select(Container container, List<SlotRun> runs, LoadState load) {
        return runs.isEmpty() ? Optional.empty() : Optional.of(runs.get(0));
    }
}
