package com.largomodo.loadplanner.service;

import com.largomodo.loadplanner.core.domain.Container;
import com.largomodo.loadplanner.core.domain.DeckRestriction;
import com.largomodo.loadplanner.util.InputParsers;
import com.largomodo.loadplanner.util.ParseResult;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a batch container list.
 * <p>
 * One container per line: {@code id,weight[,deck[,special]]}. The deck token and
 * the nose/tail permission use the same rules as interactive input ({@code MAIN} /
 * {@code LOWER} / anything else is ANY; {@code y} / {@code yes} allows special slots).
 * Blank lines and lines starting with {@code #} are ignored.
 * <p>
 * Invalid lines are skipped and reported as warnings; line order is the loading
 * order. I/O failures on the file itself propagate.
 */
public class ContainerListReader {

    public ReadResult<List<Container>> read(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, file.getFileName().toString());
        }
    }

    public ReadResult<List<Container>> read(Reader source, String sourceName) throws IOException {
        BufferedReader reader = new BufferedReader(source);
        List<Container> containers = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            ParseResult<Container> parsed = parseLine(trimmed);
            if (parsed.isOk()) {
                containers.add(parsed.value());
            } else {
                warnings.add(sourceName + ":" + lineNumber + ": " + parsed.error() + " Skipping '" + trimmed + "'");
            }
        }
        return new ReadResult<>(List.copyOf(containers), warnings);
    }

    static ParseResult<Container> parseLine(String line) {
        String[] fields = line.split(",", -1);
        if (fields.length < 2 || fields.length > 4) {
            return ParseResult.failure("Expected id,weight[,deck[,special]].");
        }
        ParseResult<String> id = InputParsers.parseIdentifier(fields[0]);
        if (!id.isOk()) {
            return ParseResult.failure(id.error());
        }
        ParseResult<Double> weight = InputParsers.parseWeight(fields[1]);
        if (!weight.isOk()) {
            return ParseResult.failure(weight.error());
        }
        DeckRestriction deck = fields.length > 2
                ? InputParsers.parseDeckRestriction(fields[2]).value()
                : DeckRestriction.ANY;
        boolean special = fields.length > 3 && InputParsers.parseSpecialPermission(fields[3]).value();
        return ParseResult.ok(new Container(id.value(), weight.value(), deck, special));
    }
}
