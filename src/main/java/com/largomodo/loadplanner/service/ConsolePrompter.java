package com.largomodo.loadplanner.service;

import com.largomodo.loadplanner.core.domain.Container;
import com.largomodo.loadplanner.core.domain.DeckRestriction;
import com.largomodo.loadplanner.util.InputParsers;
import com.largomodo.loadplanner.util.ParseResult;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Line-oriented interactive input.
 * <p>
 * Every prompt validates its answer and asks again until the answer parses;
 * invalid input never escapes as an exception. The only failure is the input
 * stream ending mid-prompt, reported as {@link EOFException}.
 */
public class ConsolePrompter {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsolePrompter(BufferedReader in, PrintStream out) {
        if (in == null || out == null) {
            throw new IllegalArgumentException("Input and output streams must not be null");
        }
        this.in = in;
        this.out = out;
    }

    /**
     * Prints {@code message} and reads one raw line.
     *
     * @throws EOFException if input ended
     */
    public String promptLine(String message) throws IOException {
        out.print(message);
        out.flush();
        String line = in.readLine();
        if (line == null) {
            throw new EOFException("Input ended while waiting for: " + message.strip());
        }
        return line;
    }

    /**
     * Prompts until {@code parser} accepts the answer, printing its error message after each rejection.
     */
    public <T> T prompt(String message, Function<String, ParseResult<T>> parser) throws IOException {
        while (true) {
            ParseResult<T> result = parser.apply(promptLine(message));
            if (result.isOk()) {
                return result.value();
            }
            out.println(result.error());
        }
    }

    public int promptCount(String message) throws IOException {
        return prompt(message, InputParsers::parseCount);
    }

    /**
     * Asks for the number of containers, then for each container's id, weight,
     * deck and nose/tail permission.
     */
    public List<Container> promptContainers() throws IOException {
        int count = promptCount("Number of ULDs: ");
        List<Container> containers = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String id = prompt("ULD #" + (i + 1) + " ID: ", InputParsers::parseIdentifier);
            double weight = prompt("ULD " + id + " weight (kg): ", InputParsers::parseWeight);
            DeckRestriction deck = prompt("ULD type (MAIN / LOWER / ANY): ", InputParsers::parseDeckRestriction);
            boolean special = prompt("Allow nose/tail? (y/n): ", InputParsers::parseSpecialPermission);
            containers.add(new Container(id, weight, deck, special));
        }
        return containers;
    }
}
