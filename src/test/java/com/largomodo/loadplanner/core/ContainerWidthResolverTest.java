package com.largomodo.loadplanner.core;

import com.largomodo.loadplanner.core.domain.ContainerTypeEntry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContainerWidthResolverTest {

    private static final List<ContainerTypeEntry> CATALOG = List.of(
            new ContainerTypeEntry("AKH", "LD3-45", 1, "Lower", ""),
            new ContainerTypeEntry("ALF", "LD6", 2, "Lower", ""),
            new ContainerTypeEntry("AL", "LD11", 3, "Lower", ""),
            new ContainerTypeEntry("PGA", "M6", 0, "Main", "bad width"),
            new ContainerTypeEntry("PRA", "M6", -2, "Main", "bad width"));

    @Test
    void testEmptyCatalogDefaultsToOneSlot() {
        assertEquals(1, ContainerWidthResolver.width("LD3-ABC123", List.of()));
        assertEquals(1, new ContainerWidthResolver(null).width("LD3-ABC123"));
    }

    @Test
    void testUnmatchedIdDefaultsToOneSlot() {
        ContainerWidthResolver resolver = new ContainerWidthResolver(CATALOG);

        assertEquals(1, resolver.width("PMC12345"));
        assertEquals(Optional.empty(), resolver.typeCode("PMC12345"));
    }

    @Test
    void testFirstMatchingPrefixWinsInCatalogOrder() {
        ContainerWidthResolver resolver = new ContainerWidthResolver(CATALOG);

        // "ALF" comes before the shorter "AL" prefix, so it wins
        assertEquals(2, resolver.width("ALF10001"));
        assertEquals(Optional.of("LD6"), resolver.typeCode("ALF10001"));
        assertEquals(3, resolver.width("ALP10001"));
    }

    @Test
    void testLaterShorterPrefixShadowsNothingWhenListedFirst() {
        List<ContainerTypeEntry> reversed = List.of(
                new ContainerTypeEntry("AL", "LD11", 3, "Lower", ""),
                new ContainerTypeEntry("ALF", "LD6", 2, "Lower", ""));

        assertEquals(3, ContainerWidthResolver.width("ALF10001", reversed));
    }

    @Test
    void testPrefixMatchIsLiteralAndCaseSensitive() {
        ContainerWidthResolver resolver = new ContainerWidthResolver(CATALOG);

        assertEquals(1, resolver.width("alf10001"));
        assertEquals(1, resolver.width("XALF10001"), "Prefix must match at the start of the id");
    }

    @Test
    void testNonPositiveCatalogWidthIsCoercedToOne() {
        ContainerWidthResolver resolver = new ContainerWidthResolver(CATALOG);

        assertEquals(1, resolver.width("PGA001"));
        assertEquals(1, resolver.width("PRA001"));
    }

    @Test
    void testResolutionIsDeterministic() {
        ContainerWidthResolver resolver = new ContainerWidthResolver(CATALOG);

        for (int i = 0; i < 5; i++) {
            assertEquals(2, resolver.width("ALF10001"));
        }
    }

    @Test
    void testEmptyPrefixMatchesEverything() {
        ContainerWidthResolver resolver = new ContainerWidthResolver(
                List.of(new ContainerTypeEntry(null, null, 2, null, null)));

        assertEquals(2, resolver.width("ANYTHING"));
        assertEquals(Optional.empty(), resolver.typeCode("ANYTHING"), "Blank type code is not reported");
    }

    @Test
    void testNullIdHasDefaultWidth() {
        assertEquals(1, new ContainerWidthResolver(CATALOG).width(null));
    }
}
