package com.largomodo.loadplanner.core;

import com.largomodo.loadplanner.core.domain.Aircraft;
import com.largomodo.loadplanner.core.domain.Deck;
import com.largomodo.loadplanner.core.domain.DeckGeometry;
import com.largomodo.loadplanner.core.domain.Slot;
import com.largomodo.loadplanner.core.domain.SlotZone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Expands deck geometries into concrete slots.
 * <p>
 * Zone rule: slot i is NOSE when {@code i < noseSlots}, otherwise TAIL when
 * {@code i >= slotCount - tailSlots}, otherwise NORMAL. On decks too short for
 * both zones the nose check runs first and wins.
 * <p>
 * Decks whose catalog arms do not match the slot count get arms interpolated
 * linearly between the configured fore and aft arm of that deck.
 */
public class SlotModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(SlotModelBuilder.class);

    private final ArmRange mainDeckArms;
    private final ArmRange lowerDeckArms;

    public SlotModelBuilder(ArmRange mainDeckArms, ArmRange lowerDeckArms) {
        if (mainDeckArms == null || lowerDeckArms == null) {
            throw new IllegalArgumentException("Arm ranges must not be null");
        }
        this.mainDeckArms = mainDeckArms;
        this.lowerDeckArms = lowerDeckArms;
    }

    public static SlotModelBuilder withDefaults() {
        return new SlotModelBuilder(ArmRange.MAIN_DECK_DEFAULT, ArmRange.LOWER_DECK_DEFAULT);
    }

    /**
     * Linear interpolation of {@code n} arms from fore to aft.
     * <p>
     * {@code arm(i) = fore * (1 - t) + aft * t} with {@code t = i / (n - 1)}.
     * A single slot gets the midpoint; {@code n <= 0} gives an empty list.
     *
     * @return unmodifiable list of n arms
     */
    public static List<Double> interpolateArms(int n, double foreArm, double aftArm) {
        if (n <= 0) {
            return List.of();
        }
        if (n == 1) {
            return List.of((foreArm + aftArm) / 2.0);
        }
        List<Double> arms = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double t = (double) i / (double) (n - 1);
            arms.add(foreArm * (1 - t) + aftArm * t);
        }
        return Collections.unmodifiableList(arms);
    }

    public ArmRange armRange(Deck deck) {
        return deck == Deck.MAIN ? mainDeckArms : lowerDeckArms;
    }

    /**
     * Returns the geometry with a complete arm list, synthesizing arms when needed.
     */
    public DeckGeometry finalizeGeometry(Deck deck, DeckGeometry geometry) {
        if (geometry.hasCompleteArms()) {
            return geometry;
        }
        ArmRange range = armRange(deck);
        if (!geometry.slotArms().isEmpty()) {
            log.warn("{} deck lists {} arms for {} slots, interpolating {} to {} instead",
                    deck.getDisplayName(), geometry.slotArms().size(), geometry.slotCount(),
                    range.fore(), range.aft());
        } else {
            log.debug("{} deck has no slot arms, interpolating {} to {}",
                    deck.getDisplayName(), range.fore(), range.aft());
        }
        return geometry.withSlotArms(interpolateArms(geometry.slotCount(), range.fore(), range.aft()));
    }

    /**
     * Builds the slots of one deck, front to back.
     *
     * @return mutable list of {@code slotCount} new, empty slots
     */
    public List<Slot> build(Deck deck, DeckGeometry geometry) {
        DeckGeometry finalized = finalizeGeometry(deck, geometry);
        int count = finalized.slotCount();
        List<Slot> slots = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            slots.add(new Slot(deck, i, finalized.slotArms().get(i), zoneOf(i, finalized)));
        }
        return slots;
    }

    /**
     * Builds the pooled slot sequence of an aircraft: main deck slots followed by
     * lower deck slots, each front to back.
     */
    public List<Slot> buildPool(Aircraft aircraft) {
        List<Slot> pool = new ArrayList<>(build(Deck.MAIN, aircraft.mainDeck()));
        pool.addAll(build(Deck.LOWER, aircraft.lowerDeck()));
        return pool;
    }

    static SlotZone zoneOf(int index, DeckGeometry geometry) {
        if (index < geometry.noseSlots()) {
            return SlotZone.NOSE;
        }
        if (index >= geometry.slotCount() - geometry.tailSlots()) {
            return SlotZone.TAIL;
        }
        return SlotZone.NORMAL;
    }
}
