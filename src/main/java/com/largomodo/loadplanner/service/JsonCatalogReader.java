package com.largomodo.loadplanner.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Base for read-only reference catalogs stored as a JSON array of objects.
 * <p>
 * Failure handling is local: a missing file, unreadable JSON or a root that is
 * not an array yields the empty catalog plus a warning instead of an exception.
 * Individual fields are read leniently (see {@link #intField} and friends), so a
 * record missing a field falls back to that field's default.
 *
 * @param <T> catalog type
 */
public abstract class JsonCatalogReader<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonCatalogReader.class);

    private final ObjectMapper objectMapper;

    protected JsonCatalogReader(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper must not be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * Reads a catalog file from disk.
     */
    public ReadResult<T> read(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, file.toString());
        } catch (NoSuchFileException e) {
            return degraded(file.toString(), "file not found");
        } catch (IOException e) {
            log.debug("Reading {} failed", file, e);
            return degraded(file.toString(), e.getMessage());
        }
    }

    /**
     * Reads a catalog bundled on the classpath.
     *
     * @param resourcePath absolute classpath reference (leading slash required)
     */
    public ReadResult<T> readResource(String resourcePath) {
        try (InputStream in = JsonCatalogReader.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                return degraded(resourcePath, "bundled resource not found");
            }
            return parse(in, resourcePath);
        } catch (IOException e) {
            log.debug("Reading resource {} failed", resourcePath, e);
            return degraded(resourcePath, e.getMessage());
        }
    }

    private ReadResult<T> parse(InputStream in, String source) throws IOException {
        JsonNode root = objectMapper.readTree(in);
        if (root == null || !root.isArray()) {
            return degraded(source, "expected a JSON array at the top level");
        }
        T catalog = fromArray(root);
        log.debug("Loaded {} from {}", describe(catalog), source);
        return ReadResult.ok(catalog);
    }

    private ReadResult<T> degraded(String source, String reason) {
        return ReadResult.degraded(emptyCatalog(),
                "Could not load " + catalogName() + " from " + source + " (" + reason + "), using an empty catalog");
    }

    /**
     * Converts the root array into the catalog; unusable records are skipped.
     */
    protected abstract T fromArray(JsonNode array);

    protected abstract T emptyCatalog();

    protected abstract String catalogName();

    protected abstract String describe(T catalog);

    protected static int intField(JsonNode node, String name, int defaultValue) {
        JsonNode value = node.get(name);
        return value != null && value.isNumber() ? value.asInt() : defaultValue;
    }

    protected static String textField(JsonNode node, String name, String defaultValue) {
        JsonNode value = node.get(name);
        return value != null && value.isTextual() ? value.asText() : defaultValue;
    }
}
