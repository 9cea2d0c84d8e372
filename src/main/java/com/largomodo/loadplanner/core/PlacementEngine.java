package com.largomodo.loadplanner.core;

import com.largomodo.loadplanner.core.domain.Assignment;
import com.largomodo.loadplanner.core.domain.Container;
import com.largomodo.loadplanner.core.domain.Deck;
import com.largomodo.loadplanner.core.domain.LoadState;
import com.largomodo.loadplanner.core.domain.PlacementStrategy;
import com.largomodo.loadplanner.core.domain.Slot;
import com.largomodo.loadplanner.core.domain.SlotRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Greedy container-to-slot placement over a pooled slot sequence.
 * <p>
 * Containers are processed strictly in input order. For each one the engine
 * collects the free slots the container accepts (deck restriction and nose/tail
 * permission), finds every run of {@code width} candidates with consecutive
 * indices on a single deck, and lets the configured {@link PlacementStrategy}
 * choose among them. The chosen slots are occupied permanently: there is no
 * backtracking, and a later container never displaces an earlier one.
 * <p>
 * Decks keep separate index spaces, so runs never cross from the main deck to
 * the lower deck even when the pool lists them back to back.
 * <p>
 * "No fit" is a normal outcome recorded as {@link Assignment#unassigned}; the
 * engine does not throw for it. Worst case O(containers x slots x width).
 * <p>
 * The engine holds the only mutable reference to the slot pool for the run.
 * Not thread-safe.
 */
public class PlacementEngine {

    private static final Logger log = LoggerFactory.getLogger(PlacementEngine.class);

    private final List<Slot> pool;
    private final ContainerWidthResolver widthResolver;
    private final PlacementStrategy strategy;
    private final PlacementObserver observer;
    private final LoadState loadState = new LoadState();
    private final List<Assignment> assignments = new ArrayList<>();

    public PlacementEngine(List<Slot> pool, ContainerWidthResolver widthResolver,
                           PlacementStrategy strategy, PlacementObserver observer) {
        if (pool == null || widthResolver == null || strategy == null || observer == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.pool = new ArrayList<>(pool);
        this.widthResolver = widthResolver;
        this.strategy = strategy;
        this.observer = observer;
    }

    public PlacementEngine(List<Slot> pool, ContainerWidthResolver widthResolver, PlacementStrategy strategy) {
        this(pool, widthResolver, strategy, new PlacementObserver() {});
    }

    /**
     * Places containers in order and returns the plan covering every container
     * placed by this engine so far.
     *
     * @param containers containers in loading order, must not be null
     * @return plan with one assignment per container
     * @throws IllegalArgumentException if the list or an element is null
     */
    public LoadPlan place(List<Container> containers) {
        if (containers == null) {
            throw new IllegalArgumentException("Container list cannot be null");
        }
        for (Container container : containers) {
            if (container == null) {
                throw new IllegalArgumentException("Container list must not contain null entries");
            }
            assignments.add(placeOne(container));
        }
        return snapshot();
    }

    /**
     * Current plan without placing anything further.
     */
    public LoadPlan snapshot() {
        return new LoadPlan(assignments, pool, loadState.getTotalWeight(), loadState.getTotalMoment());
    }

    private Assignment placeOne(Container container) {
        int width = widthResolver.width(container.id());
        List<SlotRun> runs = findRuns(container, width);
        Optional<SlotRun> chosen = strategy.select(container, runs, loadState);

        if (chosen.isEmpty()) {
            log.debug("No run of {} free slot(s) for {} ({} candidates)", width, container.id(), runs.size());
            observer.onUnassigned(container, width);
            return Assignment.unassigned(container, width);
        }

        SlotRun run = chosen.get();
        double share = container.weight() / run.width();
        for (Slot slot : run.slots()) {
            slot.occupy(container.id(), share);
        }
        loadState.add(container, run);
        log.debug("Placed {} at {} over {} slot(s)", container.id(), run.slots().get(0).label(), run.width());
        observer.onPlaced(container, run);
        return Assignment.placed(container, run);
    }

    /**
     * Every run of {@code width} free, acceptable slots with consecutive indices
     * on one deck, in pool order (main deck first, then ascending start index).
     */
    List<SlotRun> findRuns(Container container, int width) {
        List<SlotRun> runs = new ArrayList<>();
        if (width < 1) {
            return runs;
        }
        for (Deck deck : Deck.values()) {
            List<Slot> candidates = pool.stream()
                    .filter(slot -> slot.getDeck() == deck)
                    .filter(slot -> !slot.isOccupied())
                    .filter(container::accepts)
                    .sorted(Comparator.comparingInt(Slot::getIndex))
                    .toList();

            for (int start = 0; start + width <= candidates.size(); start++) {
                // Indices are distinct and ascending, so the window is gap-free iff it spans exactly width-1
                int first = candidates.get(start).getIndex();
                int last = candidates.get(start + width - 1).getIndex();
                if (last - first == width - 1) {
                    runs.add(new SlotRun(candidates.subList(start, start + width)));
                }
            }
        }
        return runs;
    }
}
