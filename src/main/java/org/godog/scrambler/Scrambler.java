package org.godog.scrambler;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.godog.scrambler.api.FileMode;
import org.godog.scrambler.api.ScrambleErrorCode;
import org.godog.scrambler.api.ScrambleException;
import org.godog.scrambler.api.ScrambleReport;
import org.godog.scrambler.api.ScramblerOptions;
import org.godog.scrambler.internal.i18n.Messages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The main entry point for scrambling. Orchestrates a whole project run: discovery,
 * rewriting of every mapped file in a fixed order, and copying of everything else.
 * <p>
 * A scrambler owns one {@link ScrambleContext}; label mappings therefore stay consistent
 * across all files it processes.
 */
public class Scrambler {

    private static final Logger LOG = LoggerFactory.getLogger(Scrambler.class);

    /** Scripts create the mappings that shaders and scenes only look up. */
    private static final List<FileMode> PROCESSING_ORDER = List.of(FileMode.SCRIPT, FileMode.GENERIC, FileMode.SCENE_RESOURCE);

    private final ScrambleContext context;
    private final ScramblePipeline pipeline;

    /**
     * Creates a scrambler with a fresh context.
     * @param options The run options.
     * @throws IOException if the extra banned label file cannot be read.
     */
    public Scrambler(ScramblerOptions options) throws IOException {
        this(ScrambleContext.create(options));
    }

    public Scrambler(ScrambleContext context) {
        this.context = context;
        this.pipeline = new ScramblePipeline(context);
    }

    public ScrambleContext getContext() {
        return context;
    }

    /**
     * Scrambles a single source text with the shared context.
     * @param source The file content.
     * @param mode The file mode.
     * @param fileName The logical file name.
     * @return The scrambled content.
     * @throws ScrambleException if the file cannot be scrambled.
     */
    public String scramble(String source, FileMode mode, String fileName) throws ScrambleException {
        return pipeline.scramble(source, mode, fileName);
    }

    /**
     * Scrambles a whole project tree into an output directory.
     * @param inputDir The project root.
     * @param outputDir The directory the scrambled tree is written to.
     * @return The run report.
     * @throws IOException if the input tree cannot be listed.
     */
    public ScrambleReport scrambleProject(Path inputDir, Path outputDir) throws IOException {
        ScramblerOptions options = context.getOptions();
        List<Path> files = listFiles(inputDir);

        Map<FileMode, List<Path>> byMode = new EnumMap<>(FileMode.class);
        List<Path> copied = new ArrayList<>();
        for (Path file : files) {
            Optional<FileMode> mode = modeOf(file);
            if (mode.isPresent()) {
                byMode.computeIfAbsent(mode.get(), m -> new ArrayList<>()).add(file);
            } else {
                copied.add(file);
            }
        }
        LOG.info("Scrambling {} files from {} ({} copied unchanged)", files.size() - copied.size(), inputDir, copied.size());

        List<ScrambleException> failures = new ArrayList<>();
        DiscoveryPass discovery = new DiscoveryPass(context);
        for (Path file : byMode.getOrDefault(FileMode.SCRIPT, List.of())) {
            try {
                discovery.scan(Files.readString(file, StandardCharsets.UTF_8), displayName(inputDir, file));
            } catch (IOException e) {
                failures.add(ioFailure(inputDir, file, e));
            }
        }
        if (!failures.isEmpty() && options.failFast()) {
            return report(List.of(), List.of(), failures);
        }
        LOG.debug("Discovered user types {}", context.getUserTypes().all());

        List<Path> scrambled = new ArrayList<>();
        boolean aborted = false;
        for (FileMode mode : PROCESSING_ORDER) {
            for (Path file : byMode.getOrDefault(mode, List.of())) {
                if (aborted) break;
                String name = displayName(inputDir, file);
                try {
                    String source = readFile(inputDir, file);
                    String output = pipeline.scramble(source, mode, name);
                    writeFile(outputDir.resolve(inputDir.relativize(file)), output, name);
                    scrambled.add(file);
                    LOG.info("Scrambled {} as {}", name, mode);
                } catch (ScrambleException e) {
                    LOG.error("{}", e.getMessage());
                    failures.add(e);
                    aborted = options.failFast();
                }
            }
        }

        List<Path> copiedDone = new ArrayList<>();
        if (!aborted) {
            for (Path file : copied) {
                Path target = outputDir.resolve(inputDir.relativize(file));
                Files.createDirectories(target.getParent());
                Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
                copiedDone.add(file);
            }
        }

        if (options.labelMapFile() != null) {
            writeLabelMap(options.labelMapFile());
        }

        ScrambleReport report = report(scrambled, copiedDone, failures);
        LOG.info("Scrambled {} files, copied {}, {} failed, {} public labels",
                report.scrambledFiles().size(), report.copiedFiles().size(), failures.size(), report.publicLabelCount());
        if (report.preservedBlocksDetected()) {
            LOG.info("Preserved preprocessor comments were kept; run the platform preprocessor on the output.");
        }
        return report;
    }

    /**
     * Writes the public label map as a JSON object of source name to label.
     * @param file The target file.
     * @throws IOException if the file cannot be written.
     */
    public void writeLabelMap(Path file) throws IOException {
        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(context.getLabels().snapshot(), writer);
        }
        LOG.info("Wrote {} public labels to {}", context.getLabels().size(), file);
    }

    private ScrambleReport report(List<Path> scrambled, List<Path> copied, List<ScrambleException> failures) {
        return new ScrambleReport(List.copyOf(scrambled), List.copyOf(copied), List.copyOf(failures),
                context.getLabels().size(), context.isPreservedBlocksDetected());
    }

    private List<Path> listFiles(Path inputDir) throws IOException {
        List<String> excluded = context.getOptions().excludedDirectories();
        try (Stream<Path> walk = Files.walk(inputDir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> {
                        Path relative = inputDir.relativize(p);
                        for (int i = 0; i < relative.getNameCount() - 1; i++) {
                            if (excluded.contains(relative.getName(i).toString())) return false;
                        }
                        return true;
                    })
                    .sorted(Comparator.comparing(p -> inputDir.relativize(p).toString().replace('\\', '/')))
                    .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private Optional<FileMode> modeOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) return Optional.empty();
        return Optional.ofNullable(context.getOptions().fileModes().get(name.substring(dot + 1).toLowerCase(Locale.ROOT)));
    }

    private static String displayName(Path inputDir, Path file) {
        return inputDir.relativize(file).toString().replace('\\', '/');
    }

    private static String readFile(Path inputDir, Path file) throws ScrambleException {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw ioFailure(inputDir, file, e);
        }
    }

    private static void writeFile(Path target, String content, String name) throws ScrambleException {
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ScrambleException(ScrambleErrorCode.IO_ERROR_WRITING_FILE, name,
                    Messages.get("io.writeFailed", target), e);
        }
    }

    private static ScrambleException ioFailure(Path inputDir, Path file, IOException e) {
        String name = displayName(inputDir, file);
        return new ScrambleException(ScrambleErrorCode.IO_ERROR_READING_FILE, name, Messages.get("io.readFailed", file), e);
    }
}
