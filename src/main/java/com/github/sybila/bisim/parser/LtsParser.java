package com.github.sybila.bisim.parser;

import com.github.sybila.bisim.lts.ExplicitTransitionSystem;
import com.github.sybila.bisim.lts.InvalidModelException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads the line based model format:
 *
 * <pre>
 * # comment
 * s0 a s1
 * s1 b s0
 * </pre>
 *
 * Every line holds one transition as three whitespace separated tokens: source, action, target.
 * Blank lines and lines starting with {@code #} are ignored. Any other line which is not a
 * triplet is reported and skipped. The source of the first transition is the initial state.
 */
public final class LtsParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(LtsParser.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final String COMMENT = "#";

    // Only provides static methods.
    private LtsParser() {}

    @NotNull
    public static ParsedLts parse(@NotNull Path path) throws IOException, LtsParseException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader, path.toString());
        }
    }

    @NotNull
    public static ParsedLts parse(@NotNull String text) throws LtsParseException {
        try {
            return parse(new StringReader(text), "<string>");
        } catch (IOException e) {
            throw new UncheckedIOException("Reading from a string failed", e);
        }
    }

    @NotNull
    public static ParsedLts parse(@NotNull Reader reader) throws IOException, LtsParseException {
        return parse(reader, "<reader>");
    }

    @NotNull
    private static ParsedLts parse(@NotNull Reader reader, @NotNull String origin) throws IOException, LtsParseException {
        ExplicitTransitionSystem.Builder<String, String> builder = ExplicitTransitionSystem.builder();
        List<MalformedLine> malformed = new ArrayList<>();
        BufferedReader lines = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        int lineNumber = 0;
        int transitions = 0;
        String line;
        while ((line = lines.readLine()) != null) {
            lineNumber += 1;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith(COMMENT)) continue;
            String[] tokens = WHITESPACE.split(trimmed);
            if (tokens.length != 3) {
                LOGGER.warn("{}:{}: expected 'source action target', skipping: {}", origin, lineNumber, trimmed);
                malformed.add(new MalformedLine(lineNumber, line));
                continue;
            }
            if (transitions == 0) {
                builder.setInitialState(tokens[0]);
            }
            builder.addTransition(tokens[0], tokens[1], tokens[2]);
            transitions += 1;
        }
        if (transitions == 0) {
            throw new LtsParseException(LtsParseException.Kind.NO_VALID_TRANSITIONS,
                    origin + ": no valid transitions found");
        }
        ExplicitTransitionSystem<String, String> system;
        try {
            system = builder.build();
        } catch (InvalidModelException e) {
            throw new LtsParseException(LtsParseException.Kind.INVALID_MODEL, origin + ": " + e.getMessage(), e);
        }
        LOGGER.debug("Loaded {} from {} ({} malformed lines)", system, origin, malformed.size());
        return new ParsedLts(system, malformed);
    }
}
