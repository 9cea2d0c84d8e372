package com.largomodo.loadplanner.core;

import com.largomodo.loadplanner.core.domain.Container;
import com.largomodo.loadplanner.core.domain.SlotRun;

/**
 * Observer interface for per-container placement decisions.
 * <p>
 * All methods have default no-op implementations, so consumers override only
 * the events they care about.
 *
 * @see PlacementEngine
 */
public interface PlacementObserver {

    /**
     * Called after a container has been written into its slots.
     *
     * @param container the placed container
     * @param run       the slots it now occupies
     */
    default void onPlaced(Container container, SlotRun run) {}

    /**
     * Called when no valid run exists for a container.
     *
     * @param container the container left unassigned
     * @param width     the slot width that was searched for
     */
    default void onUnassigned(Container container, int width) {}
}
