package com.largomodo.loadplanner.core;

import com.largomodo.loadplanner.core.domain.ContainerTypeEntry;

import java.util.List;
import java.util.Optional;

/**
 * Resolves a container id to its catalog entry by literal prefix match.
 * <p>
 * Entries are scanned in catalog order and the first whose prefix starts the id
 * wins, so more specific prefixes must come first in the catalog. Ids matching
 * nothing occupy a single slot. Stateless after construction; safe to share.
 */
public class ContainerWidthResolver {

    public static final int DEFAULT_WIDTH = 1;

    private final List<ContainerTypeEntry> catalog;

    public ContainerWidthResolver(List<ContainerTypeEntry> catalog) {
        this.catalog = catalog == null ? List.of() : List.copyOf(catalog);
    }

    /**
     * Slot width of a container id against a catalog, without building a resolver.
     */
    public static int width(String containerId, List<ContainerTypeEntry> catalog) {
        return new ContainerWidthResolver(catalog).width(containerId);
    }

    public Optional<ContainerTypeEntry> lookup(String containerId) {
        if (containerId == null) {
            return Optional.empty();
        }
        for (ContainerTypeEntry entry : catalog) {
            if (entry.matches(containerId)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    /**
     * @return slot width, always at least 1
     */
    public int width(String containerId) {
        return lookup(containerId)
                .map(entry -> Math.max(DEFAULT_WIDTH, entry.widthSlots()))
                .orElse(DEFAULT_WIDTH);
    }

    /**
     * Type code of the matching entry, empty when nothing matches or the code is blank.
     */
    public Optional<String> typeCode(String containerId) {
        return lookup(containerId)
                .map(ContainerTypeEntry::typeCode)
                .filter(code -> !code.isBlank());
    }
}
