package org.godog.scrambler.labels;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The run-wide registry of identifiers that must never be renamed.
 * <p>
 * It is seeded with the engine's reserved names and grows when source files ban additional
 * names through directives. Names banned that way are also remembered as explicitly banned.
 */
public class BannedLabels {

    private static final Logger LOG = LoggerFactory.getLogger(BannedLabels.class);
    private static final String DEFAULT_RESOURCE = "godot_labels.txt";

    private final Set<String> banned = new HashSet<>();
    private final Set<String> explicitlyBanned = new HashSet<>();

    /**
     * Creates a registry with the given initial names.
     * @param initial The reserved names.
     */
    public BannedLabels(Collection<String> initial) {
        banned.addAll(initial);
    }

    /**
     * Creates a registry seeded with the engine names shipped on the classpath.
     * @return A new registry.
     */
    public static BannedLabels withEngineDefaults() {
        try (InputStream in = BannedLabels.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                BannedLabels labels = new BannedLabels(parse(reader.lines().collect(Collectors.toList())));
                LOG.debug("Loaded {} engine labels from {}", labels.banned.size(), DEFAULT_RESOURCE);
                return labels;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Adds the names listed in a file, one per line, to this registry.
     * @param file The file to read; blank lines and lines starting with '#' are skipped.
     * @throws IOException if the file cannot be read.
     */
    public void addFromFile(Path file) throws IOException {
        List<String> names = parse(Files.readAllLines(file, StandardCharsets.UTF_8));
        banned.addAll(names);
        LOG.debug("Loaded {} additional banned labels from {}", names.size(), file);
    }

    /**
     * Checks whether a name is banned.
     * @param name The identifier.
     * @return {@code true} if the name must not be renamed.
     */
    public boolean contains(String name) {
        return banned.contains(name);
    }

    /**
     * Bans a name on behalf of a source directive.
     * @param name The identifier.
     */
    public void banExplicitly(String name) {
        banned.add(name);
        explicitlyBanned.add(name);
    }

    /**
     * Checks whether a name was banned through a source directive.
     * @param name The identifier.
     * @return {@code true} if {@link #banExplicitly(String)} was called for it.
     */
    public boolean isExplicitlyBanned(String name) {
        return explicitlyBanned.contains(name);
    }

    private static List<String> parse(List<String> lines) {
        return lines.stream()
                .map(String::trim)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .collect(Collectors.toList());
    }
}
