package com.largomodo.loadplanner.core;

import com.largomodo.loadplanner.core.domain.Aircraft;
import com.largomodo.loadplanner.core.domain.Container;
import com.largomodo.loadplanner.core.domain.Deck;
import com.largomodo.loadplanner.core.domain.PlacementStrategy;
import com.largomodo.loadplanner.core.domain.Slot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Load planning pipeline for one aircraft:
 * 1. Build the slot pool (main deck, then lower deck)
 * 2. Create the configured placement strategy for that pool
 * 3. Place the containers in input order
 * <p>
 * Each call to {@link #plan} starts from fresh, empty slots, so a processor can
 * be reused for several aircraft or container lists.
 */
public class LoadPlanProcessor {

    private static final Logger log = LoggerFactory.getLogger(LoadPlanProcessor.class);

    private final SlotModelBuilder slotModelBuilder;
    private final ContainerWidthResolver widthResolver;
    private final StrategyType strategyType;
    private final PlacementObserver observer;

    public LoadPlanProcessor(SlotModelBuilder slotModelBuilder, ContainerWidthResolver widthResolver,
                             StrategyType strategyType, PlacementObserver observer) {
        if (slotModelBuilder == null || widthResolver == null || strategyType == null || observer == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.slotModelBuilder = slotModelBuilder;
        this.widthResolver = widthResolver;
        this.strategyType = strategyType;
        this.observer = observer;
    }

    /**
     * Plans the containers onto the aircraft.
     *
     * @param aircraft   aircraft to load
     * @param containers containers in loading order
     * @return finished plan; containers without room are reported as unassigned
     */
    public LoadPlan plan(Aircraft aircraft, List<Container> containers) {
        if (aircraft == null || containers == null) {
            throw new IllegalArgumentException("Aircraft and container list must not be null");
        }
        List<Slot> pool = slotModelBuilder.buildPool(aircraft);
        PlacementStrategy strategy = strategyType.create(pool);

        log.info("Planning {} ULD(s) on {} ({} main deck + {} lower deck slots, {})",
                containers.size(), aircraft.model(),
                countSlots(pool, Deck.MAIN), countSlots(pool, Deck.LOWER), strategyType);

        PlacementEngine engine = new PlacementEngine(pool, widthResolver, strategy, observer);
        LoadPlan plan = engine.place(containers);

        log.info("Placed {} of {} ULD(s)", plan.placedCount(), containers.size());
        return plan;
    }

    private static long countSlots(List<Slot> pool, Deck deck) {
        return pool.stream().filter(slot -> slot.getDeck() == deck).count();
    }
}
