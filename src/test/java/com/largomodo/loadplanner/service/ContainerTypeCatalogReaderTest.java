package com.largomodo.loadplanner.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.largomodo.loadplanner.core.ContainerWidthResolver;
import com.largomodo.loadplanner.core.domain.ContainerTypeEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContainerTypeCatalogReaderTest {

    @TempDir
    Path tempDir;

    private final ContainerTypeCatalogReader reader = new ContainerTypeCatalogReader(new ObjectMapper());

    @Test
    void testReadsFieldsInFileOrder() throws IOException {
        Path file = tempDir.resolve("ulddb.json");
        Files.writeString(file, String.join("\n",
                "[",
                "  {\"Prefix\": \"PGA\", \"ULD Type\": \"M6\", \"Width (slots)\": 2, \"Deck\": \"Main\", \"Notes\": \"20 ft pallet\"},",
                "  {\"Prefix\": \"AKE\", \"ULD Type\": \"LD3\"}",
                "]"));

        ReadResult<List<ContainerTypeEntry>> result = reader.read(file);

        assertFalse(result.hasWarnings());
        List<ContainerTypeEntry> entries = result.value();
        assertEquals(2, entries.size());
        assertEquals(new ContainerTypeEntry("PGA", "M6", 2, "Main", "20 ft pallet"), entries.get(0));

        ContainerTypeEntry ake = entries.get(1);
        assertEquals("AKE", ake.prefix());
        assertEquals(1, ake.widthSlots(), "Width defaults to one slot");
        assertEquals("Any", ake.deckHint());
        assertEquals("", ake.notes());
    }

    @Test
    void testMissingFileGivesEmptyCatalogAndWarning() {
        ReadResult<List<ContainerTypeEntry>> result = reader.read(tempDir.resolve("absent.json"));

        assertTrue(result.value().isEmpty());
        assertTrue(result.warnings().get(0).startsWith("Could not load container-type catalog"));
    }

    @Test
    void testBundledCatalogResolvesKnownPrefixes() {
        ReadResult<List<ContainerTypeEntry>> result = reader.readResource(ContainerTypeCatalogReader.BUNDLED_RESOURCE);
        ContainerWidthResolver resolver = new ContainerWidthResolver(result.value());

        assertFalse(result.hasWarnings());
        assertEquals(1, resolver.width("AKE12345AB"));
        assertEquals(2, resolver.width("PGA00001XX"));
        assertEquals("LD3", resolver.typeCode("AKE12345AB").orElseThrow());
        assertEquals(1, resolver.width("ZZZ999"), "Unknown prefixes are single width");
    }
}
