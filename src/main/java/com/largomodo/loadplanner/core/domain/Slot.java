package com.largomodo.loadplanner.core.domain;

/**
 * One physical cargo position.
 * <p>
 * Geometry (deck, index, arm, zone) is fixed at construction. Occupancy is the
 * only mutable state and moves one way, from empty to occupied; it is written
 * exclusively by the placement engine during a run.
 */
public final class Slot {

    private final Deck deck;
    private final int index;
    private final double arm;
    private final SlotZone zone;

    private String occupantId;
    private double allocatedWeight;

    public Slot(Deck deck, int index, double arm, SlotZone zone) {
        if (deck == null || zone == null) {
            throw new IllegalArgumentException("deck and zone must not be null");
        }
        if (index < 0) {
            throw new IllegalArgumentException("Slot index must not be negative: " + index);
        }
        this.deck = deck;
        this.index = index;
        this.arm = arm;
        this.zone = zone;
    }

    /**
     * Marks this slot as holding a share of a container.
     *
     * @param containerId occupant id
     * @param weight      weight share allocated to this slot
     * @throws IllegalStateException if the slot is already occupied
     */
    public void occupy(String containerId, double weight) {
        if (isOccupied()) {
            throw new IllegalStateException(
                    "Slot " + label() + " already holds " + occupantId + ", cannot place " + containerId);
        }
        this.occupantId = containerId;
        this.allocatedWeight = weight;
    }

    public boolean isOccupied() {
        return occupantId != null;
    }

    /**
     * @return occupant id, or null while empty
     */
    public String getOccupantId() {
        return occupantId;
    }

    public double getAllocatedWeight() {
        return allocatedWeight;
    }

    public Deck getDeck() {
        return deck;
    }

    public int getIndex() {
        return index;
    }

    public double getArm() {
        return arm;
    }

    public SlotZone getZone() {
        return zone;
    }

    /**
     * One-based label such as {@code main[3]}.
     */
    public String label() {
        return deck.getLabel() + "[" + (index + 1) + "]";
    }

    @Override
    public String toString() {
        return label() + (isOccupied() ? "=" + occupantId : "");
    }
}
