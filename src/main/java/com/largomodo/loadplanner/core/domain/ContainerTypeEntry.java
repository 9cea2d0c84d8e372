package com.largomodo.loadplanner.core.domain;

/**
 * One row of the container-type catalog.
 * <p>
 * Missing text fields are normalized to empty strings; an empty prefix matches
 * every container id. Width is kept as read so callers can see a bad catalog
 * value; the width resolver coerces non-positive widths to 1.
 *
 * @param prefix     container id prefix, matched literally
 * @param typeCode   display type code, e.g. {@code LD3}
 * @param widthSlots number of consecutive slots the container occupies
 * @param deckHint   informational deck hint, {@code Any} by default
 * @param notes      free text
 */
public record ContainerTypeEntry(String prefix, String typeCode, int widthSlots, String deckHint, String notes) {

    public ContainerTypeEntry {
        prefix = prefix == null ? "" : prefix;
        typeCode = typeCode == null ? "" : typeCode;
        deckHint = deckHint == null ? "Any" : deckHint;
        notes = notes == null ? "" : notes;
    }

    public boolean matches(String containerId) {
        return containerId != null && containerId.startsWith(prefix);
    }
}
