package com.largomodo.loadplanner.service;

import com.largomodo.loadplanner.core.ContainerWidthResolver;
import com.largomodo.loadplanner.core.LoadPlan;
import com.largomodo.loadplanner.core.PlacementEngine;
import com.largomodo.loadplanner.core.SlotModelBuilder;
import com.largomodo.loadplanner.core.domain.Aircraft;
import com.largomodo.loadplanner.core.domain.Container;
import com.largomodo.loadplanner.core.domain.ContainerTypeEntry;
import com.largomodo.loadplanner.core.domain.DeckGeometry;
import com.largomodo.loadplanner.core.domain.DeckRestriction;
import com.largomodo.loadplanner.core.domain.FirstFitPlacementStrategy;
import com.largomodo.loadplanner.core.domain.Slot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoadPlanRendererTest {

    private ContainerWidthResolver resolver;
    private LoadPlanRenderer renderer;
    private Aircraft aircraft;
    private LoadPlan plan;

    @BeforeEach
    void setUp() {
        resolver = new ContainerWidthResolver(List.of(
                new ContainerTypeEntry("PGA", "M6", 2, "Main", ""),
                new ContainerTypeEntry("ALF", "LD6", 2, "Lower", ""),
                new ContainerTypeEntry("AKE", "LD3", 1, "Lower", "")));
        renderer = new LoadPlanRenderer(resolver);

        // Main deck: nose slot, three interior slots, last slot; arms 18, 22.5, 27, 31.5, 36
        aircraft = new Aircraft("TEST-5", new DeckGeometry(5, 3, 1, 0, List.of()), DeckGeometry.empty(), 150000);
        List<Slot> pool = SlotModelBuilder.withDefaults().buildPool(aircraft);
        plan = new PlacementEngine(pool, resolver, new FirstFitPlacementStrategy()).place(List.of(
                new Container("PGA123", 3000, DeckRestriction.MAIN, false),
                new Container("AKE9", 100.5, DeckRestriction.MAIN, false),
                new Container("ALF1", 50, DeckRestriction.MAIN, false)));
    }

    @Test
    void testAssignmentTableAndTotals() {
        List<String> lines = renderer.renderAssignments(aircraft, plan);

        assertEquals("", lines.get(0));
        assertEquals("=== Assignment Results ===", lines.get(1));
        assertEquals(String.format("%-12s%-22s%s", "ULD ID", "Assigned Slot", "Weight(kg)"), lines.get(2));
        assertEquals("-".repeat(46), lines.get(3));
        assertEquals(String.format("%-12s%-22s%s", "PGA123", "main[2]", "3000"), lines.get(4));
        assertEquals(String.format("%-12s%-22s%s", "AKE9", "main[4]", "100.5"), lines.get(5));
        assertEquals(String.format("%-12s%-22s%s", "ALF1", "UNASSIGNED", "50"), lines.get(6));

        assertTrue(lines.contains("Aircraft: TEST-5 (MTOW 150000 kg)"));
        assertTrue(lines.contains("Placed: 2 of 3 ULD(s)"));
        assertTrue(lines.contains("Total weight (kg): 3100.5"), "Unassigned weight is excluded: " + lines);
        // 1500 * 22.5 + 1500 * 27 + 100.5 * 31.5
        assertTrue(lines.contains("Total moment: 77415.75"), lines.toString());
        assertTrue(lines.contains("CG arm: 24.97"), lines.toString());
    }

    @Test
    void testEmptyPlanHasNoCenterOfGravity() {
        LoadPlan empty = new PlacementEngine(SlotModelBuilder.withDefaults().buildPool(aircraft), resolver,
                new FirstFitPlacementStrategy()).place(List.of());

        List<String> lines = renderer.renderAssignments(aircraft, empty);

        assertTrue(lines.contains("CG arm: n/a"));
        assertTrue(lines.contains("Placed: 0 of 0 ULD(s)"));
    }

    @Test
    void testDiagramMergesMultiSlotContainer() {
        List<String> lines = renderer.renderDiagram(aircraft, plan, AnsiPalette.NONE);

        String pad = " ".repeat(11);
        List<String> expected = List.of(
                "",
                "=== Main Deck Load Plan (slots=5) ===",
                pad + "+----------+",
                pad + "|  N       |",
                pad + "|#1        |",
                pad + "|          |",
                pad + "+----------+",
                "+---------------------+----------+",
                "|PGA123[M6]           |AKE9[LD3] |",
                "|#2-#3                |#4        |",
                "|3000                 |100       |",
                "+---------------------+----------+",
                pad + "+----------+",
                pad + "|          |",
                pad + "|#5        |",
                pad + "|          |",
                pad + "+----------+",
                "",
                "=== Lower Deck Load Plan (slots=0) ===");
        assertEquals(expected, lines);
    }

    @Test
    void testPaletteColoursOccupantText() {
        List<String> lines = renderer.renderDiagram(aircraft, plan, AnsiPalette.defaults());

        assertTrue(lines.stream().anyMatch(line -> line.contains("\u001B[35mPGA123[M6]")),
                "M6 cells should be magenta: " + lines);
        assertTrue(lines.stream().noneMatch(line -> line.contains("\u001B[") && line.contains("  N  ")),
                "Empty nose cells stay plain");
    }

    @Test
    void testRowsPutFirstAndLastSlotAlone() {
        List<Slot> slots = SlotModelBuilder.withDefaults()
                .buildPool(new Aircraft("ROWS", DeckGeometry.ofSlots(9), DeckGeometry.empty(), 0));

        List<List<Slot>> rows = LoadPlanRenderer.rows(slots);

        assertEquals(List.of(1, 3, 3, 1, 1), rows.stream().map(List::size).toList());
        assertEquals(1, LoadPlanRenderer.rows(slots.subList(0, 1)).size());
        assertTrue(LoadPlanRenderer.rows(List.of()).isEmpty());
    }

    @Test
    void testFitTruncatesAndPads() {
        assertEquals("ABCDEFGHIJ", LoadPlanRenderer.fit("ABCDEFGHIJKL", 10));
        assertEquals("AB        ", LoadPlanRenderer.fit("AB", 10));
    }

    @Test
    void testFormatWeight() {
        assertEquals("1200", LoadPlanRenderer.formatWeight(1200.0));
        assertEquals("1200.5", LoadPlanRenderer.formatWeight(1200.5));
    }

    @Test
    void testNullResolverRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LoadPlanRenderer(null));
    }
}
