package com.largomodo.loadplanner.core.domain;

import java.util.List;

/**
 * Static layout template of one deck as read from the aircraft catalog.
 * <p>
 * The arm list may be empty or have the wrong length when the catalog omits
 * explicit arms; {@link #hasCompleteArms()} tells the slot builder whether
 * arms have to be synthesized.
 *
 * @param slotCount number of slots, front to back
 * @param rowLength row width in cells, used only to center the diagram
 * @param noseSlots number of leading slots in the nose zone
 * @param tailSlots number of trailing slots in the tail zone
 * @param slotArms  moment arm per slot, front to back (unmodifiable)
 */
public record DeckGeometry(int slotCount, int rowLength, int noseSlots, int tailSlots, List<Double> slotArms) {

    public static final int DEFAULT_ROW_LENGTH = 8;

    /**
     * Compact constructor that rejects negative counts and copies the arm list.
     *
     * @throws IllegalArgumentException if any count is negative
     */
    public DeckGeometry {
        if (slotCount < 0 || rowLength < 0 || noseSlots < 0 || tailSlots < 0) {
            throw new IllegalArgumentException(
                    "Deck counts must not be negative: slots=" + slotCount + ", rowLength=" + rowLength +
                            ", noseSlots=" + noseSlots + ", tailSlots=" + tailSlots);
        }
        slotArms = slotArms == null ? List.of() : List.copyOf(slotArms);
    }

    /**
     * Geometry of a deck without cargo positions.
     */
    public static DeckGeometry empty() {
        return new DeckGeometry(0, DEFAULT_ROW_LENGTH, 0, 0, List.of());
    }

    /**
     * Plain deck with no nose/tail zones and no explicit arms, as entered for a custom aircraft.
     */
    public static DeckGeometry ofSlots(int slotCount) {
        return new DeckGeometry(slotCount, DEFAULT_ROW_LENGTH, 0, 0, List.of());
    }

    public boolean hasCompleteArms() {
        return slotArms.size() == slotCount;
    }

    public DeckGeometry withSlotArms(List<Double> arms) {
        return new DeckGeometry(slotCount, rowLength, noseSlots, tailSlots, arms);
    }
}
