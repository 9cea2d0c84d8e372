package com.largomodo.loadplanner.service;

import com.largomodo.loadplanner.core.ContainerWidthResolver;
import com.largomodo.loadplanner.core.LoadPlan;
import com.largomodo.loadplanner.core.domain.Aircraft;
import com.largomodo.loadplanner.core.domain.Assignment;
import com.largomodo.loadplanner.core.domain.Deck;
import com.largomodo.loadplanner.core.domain.DeckGeometry;
import com.largomodo.loadplanner.core.domain.Slot;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Text rendering of a finished load plan: the assignment table with load totals,
 * and an ASCII bay diagram per deck.
 * <p>
 * Diagram layout: the first and the last slot of a deck sit alone on their rows,
 * interior slots go three to a row, and each row is centered on the deck's row
 * length. A cell is five lines tall:
 * <pre>
 * +----------+
 * |PMC01[M1] |
 * |#2        |
 * |4500      |
 * +----------+
 * </pre>
 * Neighbouring cells of a row holding the same container are drawn as one wide
 * cell labelled with the slot range and the summed weight.
 */
public class LoadPlanRenderer {

    static final int CELL_WIDTH = 10;
    private static final int SLOT_SPAN = CELL_WIDTH + 1;
    private static final int MAX_ROW_SLOTS = 3;
    private static final int TABLE_WIDTH = 46;

    private final ContainerWidthResolver widthResolver;

    public LoadPlanRenderer(ContainerWidthResolver widthResolver) {
        if (widthResolver == null) {
            throw new IllegalArgumentException("widthResolver must not be null");
        }
        this.widthResolver = widthResolver;
    }

    /**
     * Assignment table in container input order, followed by the load totals.
     */
    public List<String> renderAssignments(Aircraft aircraft, LoadPlan plan) {
        List<String> lines = new ArrayList<>();
        lines.add("");
        lines.add("=== Assignment Results ===");
        lines.add(tableRow("ULD ID", "Assigned Slot", "Weight(kg)"));
        lines.add("-".repeat(TABLE_WIDTH));
        for (Assignment assignment : plan.assignments()) {
            lines.add(tableRow(assignment.container().id(), assignment.label(),
                    formatWeight(assignment.container().weight())));
        }
        lines.add("");
        lines.add("Aircraft: " + aircraft.model() + " (MTOW " + aircraft.maxTakeoffWeight() + " kg)");
        lines.add("Placed: " + plan.placedCount() + " of " + plan.assignments().size() + " ULD(s)");
        lines.add("Total weight (kg): " + formatWeight(plan.totalWeight()));
        lines.add("Total moment: " + String.format(Locale.ROOT, "%.2f", plan.totalMoment()));
        lines.add("CG arm: " + (plan.centerOfGravity().isPresent()
                ? String.format(Locale.ROOT, "%.2f", plan.centerOfGravity().getAsDouble())
                : "n/a"));
        return lines;
    }

    /**
     * Bay diagram of both decks, main deck first.
     *
     * @param palette colours for occupant cells; {@link AnsiPalette#NONE} for plain text
     */
    public List<String> renderDiagram(Aircraft aircraft, LoadPlan plan, AnsiPalette palette) {
        List<String> lines = new ArrayList<>();
        for (Deck deck : Deck.values()) {
            lines.addAll(renderDeck(deck, aircraft.geometry(deck), plan.slots(deck), palette));
        }
        return lines;
    }

    List<String> renderDeck(Deck deck, DeckGeometry geometry, List<Slot> slots, AnsiPalette palette) {
        List<String> lines = new ArrayList<>();
        lines.add("");
        lines.add("=== " + deck.getDisplayName() + " Deck Load Plan (slots=" + slots.size() + ") ===");

        for (List<Slot> row : rows(slots)) {
            List<List<Slot>> cells = mergeCells(row);
            String pad = " ".repeat(Math.max(0, (geometry.rowLength() - row.size()) * SLOT_SPAN / 2));

            lines.add(pad + border(cells));

            StringBuilder idLine = new StringBuilder(pad);
            StringBuilder numberLine = new StringBuilder(pad);
            StringBuilder weightLine = new StringBuilder(pad);
            for (List<Slot> cell : cells) {
                int width = cellWidth(cell);
                Slot first = cell.get(0);
                String idText = fit(occupantText(first), width);
                if (first.isOccupied()) {
                    idText = palette.colorize(widthResolver.typeCode(first.getOccupantId()).orElse(null), idText);
                }
                idLine.append('|').append(idText);
                numberLine.append('|').append(fit(slotNumbers(cell), width));
                weightLine.append('|').append(fit(weightText(cell), width));
            }
            lines.add(idLine.append('|').toString());
            lines.add(numberLine.append('|').toString());
            lines.add(weightLine.append('|').toString());

            lines.add(pad + border(cells));
        }
        return lines;
    }

    /**
     * Groups a deck's slots into rows: first slot alone, interior slots by up to three, last slot alone.
     */
    static List<List<Slot>> rows(List<Slot> slots) {
        List<List<Slot>> rows = new ArrayList<>();
        if (slots.isEmpty()) {
            return rows;
        }
        rows.add(List.of(slots.get(0)));
        int idx = 1;
        while (idx < slots.size() - 1) {
            int rowSize = Math.min(MAX_ROW_SLOTS, slots.size() - 1 - idx);
            rows.add(List.copyOf(slots.subList(idx, idx + rowSize)));
            idx += rowSize;
        }
        if (idx < slots.size()) {
            rows.add(List.of(slots.get(slots.size() - 1)));
        }
        return rows;
    }

    /**
     * Splits a row into cells, joining neighbours that hold the same container.
     */
    static List<List<Slot>> mergeCells(List<Slot> row) {
        List<List<Slot>> cells = new ArrayList<>();
        List<Slot> current = new ArrayList<>();
        for (Slot slot : row) {
            if (!current.isEmpty() && sameOccupant(current.get(current.size() - 1), slot)) {
                current.add(slot);
            } else {
                if (!current.isEmpty()) {
                    cells.add(current);
                }
                current = new ArrayList<>();
                current.add(slot);
            }
        }
        if (!current.isEmpty()) {
            cells.add(current);
        }
        return cells;
    }

    private static boolean sameOccupant(Slot a, Slot b) {
        return a.isOccupied() && b.isOccupied() && a.getOccupantId().equals(b.getOccupantId());
    }

    private String occupantText(Slot slot) {
        if (slot.isOccupied()) {
            Optional<String> type = widthResolver.typeCode(slot.getOccupantId());
            return slot.getOccupantId() + type.map(code -> "[" + code + "]").orElse("");
        }
        return slot.getZone().isSpecial() ? "  " + slot.getZone().getMarker() + "  " : "";
    }

    private static String slotNumbers(List<Slot> cell) {
        String first = "#" + (cell.get(0).getIndex() + 1);
        if (cell.size() == 1) {
            return first;
        }
        return first + "-#" + (cell.get(cell.size() - 1).getIndex() + 1);
    }

    private static String weightText(List<Slot> cell) {
        if (!cell.get(0).isOccupied()) {
            return "";
        }
        double weight = cell.stream().mapToDouble(Slot::getAllocatedWeight).sum();
        return String.valueOf((long) weight);
    }

    private static int cellWidth(List<Slot> cell) {
        return cell.size() * SLOT_SPAN - 1;
    }

    private static String border(List<List<Slot>> cells) {
        StringBuilder line = new StringBuilder();
        for (List<Slot> cell : cells) {
            line.append('+').append("-".repeat(cellWidth(cell)));
        }
        return line.append('+').toString();
    }

    /**
     * Truncates or right-pads text to exactly {@code width} characters.
     */
    static String fit(String text, int width) {
        if (text.length() >= width) {
            return text.substring(0, width);
        }
        return text + " ".repeat(width - text.length());
    }

    private static String tableRow(String id, String slot, String weight) {
        return String.format(Locale.ROOT, "%-12s%-22s%-10s", id, slot, weight).stripTrailing();
    }

    /**
     * Weight without a trailing {@code .0}: {@code 1200}, {@code 1200.5}.
     */
    static String formatWeight(double weight) {
        DecimalFormat format = new DecimalFormat("0.##", DecimalFormatSymbols.getInstance(Locale.ROOT));
        return format.format(weight);
    }
}
