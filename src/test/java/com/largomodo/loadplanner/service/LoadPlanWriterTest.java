package com.largomodo.loadplanner.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoadPlanWriterTest {

    @TempDir
    Path tempDir;

    private final LoadPlanWriter writer = new LoadPlanWriter();

    @Test
    void testCreatesParentDirectories() throws IOException {
        Path target = tempDir.resolve("plans").resolve("today").resolve("loadplan.txt");

        writer.write(target, List.of("line one", "line two"));

        assertEquals(List.of("line one", "line two"), Files.readAllLines(target, StandardCharsets.UTF_8));
    }

    @Test
    void testReplacesExistingPlan() throws IOException {
        Path target = tempDir.resolve("loadplan.txt");
        Files.writeString(target, "old plan\nwith more lines\nthan the new one\n");

        writer.write(target, List.of("new plan"));

        assertEquals(List.of("new plan"), Files.readAllLines(target));
    }

    @Test
    void testUnwritableTargetThrows() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "a file, not a directory");

        assertThrows(IOException.class, () -> writer.write(blocker.resolve("loadplan.txt"), List.of("x")));
    }
}
