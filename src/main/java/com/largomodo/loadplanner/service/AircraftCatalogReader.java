package com.largomodo.loadplanner.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.largomodo.loadplanner.core.domain.Aircraft;
import com.largomodo.loadplanner.core.domain.DeckGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Reads the aircraft catalog ({@code aircraft_db.json}) into a model-keyed map.
 * <p>
 * Record fields: {@code model}, {@code mtw}, and {@code mainDeck} / {@code lowerDeck}
 * objects with {@code slots}, {@code rowLength} (default 8), {@code noseSlots},
 * {@code tailSlots} and optional {@code slotArms}. Missing numbers default to
 * zero, a missing deck is an empty deck. Arms are kept as listed; the slot model
 * builder fills in arms that do not match the slot count.
 * <p>
 * Records without a model are skipped; a repeated model replaces the earlier one.
 * The map is sorted by model name.
 */
public class AircraftCatalogReader extends JsonCatalogReader<SortedMap<String, Aircraft>> {

    public static final String BUNDLED_RESOURCE = "/catalog/aircraft_db.json";

    private static final Logger log = LoggerFactory.getLogger(AircraftCatalogReader.class);

    public AircraftCatalogReader(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    protected SortedMap<String, Aircraft> fromArray(JsonNode array) {
        TreeMap<String, Aircraft> aircraft = new TreeMap<>();
        for (JsonNode node : array) {
            if (!node.isObject()) {
                continue;
            }
            String model = textField(node, "model", "");
            if (model.isBlank()) {
                log.debug("Skipping aircraft record without a model");
                continue;
            }
            try {
                aircraft.put(model, new Aircraft(model,
                        deck(node.get("mainDeck")),
                        deck(node.get("lowerDeck")),
                        intField(node, "mtw", 0)));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping aircraft {}: {}", model, e.getMessage());
            }
        }
        return Collections.unmodifiableSortedMap(aircraft);
    }

    private static DeckGeometry deck(JsonNode node) {
        if (node == null || !node.isObject()) {
            return DeckGeometry.empty();
        }
        List<Double> arms = new ArrayList<>();
        JsonNode armsNode = node.get("slotArms");
        if (armsNode != null && armsNode.isArray()) {
            for (JsonNode arm : armsNode) {
                if (arm.isNumber()) {
                    arms.add(arm.asDouble());
                }
            }
        }
        return new DeckGeometry(
                intField(node, "slots", 0),
                intField(node, "rowLength", DeckGeometry.DEFAULT_ROW_LENGTH),
                intField(node, "noseSlots", 0),
                intField(node, "tailSlots", 0),
                arms);
    }

    @Override
    protected SortedMap<String, Aircraft> emptyCatalog() {
        return Collections.emptySortedMap();
    }

    @Override
    protected String catalogName() {
        return "aircraft catalog";
    }

    @Override
    protected String describe(SortedMap<String, Aircraft> catalog) {
        return catalog.size() + " aircraft model(s)";
    }
}
