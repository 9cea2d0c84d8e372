package com.largomodo.loadplanner.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.largomodo.loadplanner.core.domain.ContainerTypeEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads the container-type catalog ({@code ulddb.json}).
 * <p>
 * Record fields: {@code Prefix}, {@code ULD Type}, {@code Width (slots)} (default 1),
 * {@code Deck} (default {@code Any}) and {@code Notes}. File order is kept because
 * the first matching prefix wins.
 */
public class ContainerTypeCatalogReader extends JsonCatalogReader<List<ContainerTypeEntry>> {

    public static final String BUNDLED_RESOURCE = "/catalog/ulddb.json";

    public ContainerTypeCatalogReader(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    protected List<ContainerTypeEntry> fromArray(JsonNode array) {
        List<ContainerTypeEntry> entries = new ArrayList<>();
        for (JsonNode node : array) {
            if (!node.isObject()) {
                continue;
            }
            entries.add(new ContainerTypeEntry(
                    textField(node, "Prefix", ""),
                    textField(node, "ULD Type", ""),
                    intField(node, "Width (slots)", 1),
                    textField(node, "Deck", "Any"),
                    textField(node, "Notes", "")));
        }
        return Collections.unmodifiableList(entries);
    }

    @Override
    protected List<ContainerTypeEntry> emptyCatalog() {
        return List.of();
    }

    @Override
    protected String catalogName() {
        return "container-type catalog";
    }

    @Override
    protected String describe(List<ContainerTypeEntry> catalog) {
        return catalog.size() + " container type(s)";
    }
}
