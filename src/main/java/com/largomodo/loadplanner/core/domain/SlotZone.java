package com.largomodo.loadplanner.core.domain;

/**
 * Zone classification of a slot. Nose and tail slots only accept containers
 * that permit special slots.
 */
public enum SlotZone {
    NORMAL(""),
    NOSE("N"),
    TAIL("T");

    private final String marker;

    SlotZone(String marker) {
        this.marker = marker;
    }

    public boolean isSpecial() {
        return this != NORMAL;
    }

    /**
     * Diagram marker shown in an empty slot of this zone (blank for normal slots).
     */
    public String getMarker() {
        return marker;
    }
}
