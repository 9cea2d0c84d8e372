package com.largomodo.loadplanner.core;

import com.largomodo.loadplanner.core.domain.BalancedPlacementStrategy;
import com.largomodo.loadplanner.core.domain.FirstFitPlacementStrategy;
import com.largomodo.loadplanner.core.domain.PlacementStrategy;
import com.largomodo.loadplanner.core.domain.Slot;

import java.util.List;

/**
 * Placement policies selectable from the command line. One policy applies to a whole run.
 */
public enum StrategyType {
    /** Earliest valid run by slot pool order. */
    FIRST_FIT,
    /** Valid run keeping the load CG closest to the pool's mean arm. */
    CG_BALANCE;

    public PlacementStrategy create(List<Slot> pool) {
        return switch (this) {
            case FIRST_FIT -> new FirstFitPlacementStrategy();
            case CG_BALANCE -> BalancedPlacementStrategy.forPool(pool);
        };
    }
}
