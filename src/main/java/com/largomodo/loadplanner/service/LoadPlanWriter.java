package com.largomodo.loadplanner.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Persists rendered plan lines as a plain text file, replacing any previous plan.
 */
public class LoadPlanWriter {

    /**
     * @param target file to write; parent directories are created as needed
     * @param lines  lines without line terminators
     * @throws IOException if the file cannot be written
     */
    public void write(Path target, List<String> lines) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(target, lines, StandardCharsets.UTF_8);
    }
}
