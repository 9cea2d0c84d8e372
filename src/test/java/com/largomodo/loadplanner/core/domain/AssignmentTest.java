package com.largomodo.loadplanner.core.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentTest {

    private final Container container = new Container("PGA1", 3000, DeckRestriction.MAIN, false);

    @Test
    void testPlacedTakesPositionFromRun() {
        SlotRun run = new SlotRun(List.of(
                new Slot(Deck.MAIN, 4, 24.0, SlotZone.NORMAL),
                new Slot(Deck.MAIN, 5, 26.0, SlotZone.NORMAL)));

        Assignment assignment = Assignment.placed(container, run);

        assertTrue(assignment.isPlaced());
        assertEquals(Deck.MAIN, assignment.deck());
        assertEquals(4, assignment.startIndex());
        assertEquals(2, assignment.width());
        assertEquals("main[5]", assignment.label());
    }

    @Test
    void testUnassignedKeepsRequiredWidth() {
        Assignment assignment = Assignment.unassigned(container, 2);

        assertFalse(assignment.isPlaced());
        assertNull(assignment.deck());
        assertEquals(-1, assignment.startIndex());
        assertEquals(2, assignment.width());
        assertEquals(Assignment.UNASSIGNED, assignment.label());
    }
}
