package org.godog.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.godog.cli.CommandLineInterface;
import org.godog.scrambler.Scrambler;
import org.godog.scrambler.api.ScrambleException;
import org.godog.scrambler.api.ScrambleReport;
import org.godog.scrambler.api.ScramblerOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "scramble", description = "Scrambles the identifiers of a Godot project into an output directory.")
public class ScrambleCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED_FILES = 1;
    static final int EXIT_USAGE = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-i", "--input"}, required = true, description = "The project directory to scramble.")
    private Path input;

    @Option(names = {"-o", "--output"}, required = true, description = "The directory the scrambled project is written to.")
    private Path output;

    @Option(names = "--melt", description = "Validate res:// paths to scenes, resources and scripts against the project.")
    private boolean melt;

    @Option(names = "--keep-type-casting", description = "Keep type annotations and casts.")
    private boolean keepTypeCasting;

    @Option(names = "--seed", description = "Seed of the label generator.")
    private Long seed;

    @Option(names = "--label-map", description = "Write the public label map as JSON to this file.")
    private Path labelMap;

    @Option(names = "--no-fail-fast", description = "Continue with the remaining files after a failure.")
    private boolean noFailFast;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (!Files.isDirectory(input)) {
            err.println("Input is not a directory: " + input);
            return EXIT_USAGE;
        }

        ScramblerOptions options;
        try {
            Config config = parent.getConfig();
            options = applyOverrides(ScramblerOptions.fromConfig(config));
        } catch (ConfigException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        ScrambleReport report;
        try {
            Scrambler scrambler = new Scrambler(options);
            report = scrambler.scrambleProject(input, output);
        } catch (IOException e) {
            err.println("Failed to scramble " + input + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        out.printf("Scrambled %d files, copied %d files, %d public labels.%n",
                report.scrambledFiles().size(), report.copiedFiles().size(), report.publicLabelCount());
        if (report.preservedBlocksDetected()) {
            out.println("Preserved preprocessor blocks were found; run the platform preprocessor on the output.");
        }
        for (ScrambleException failure : report.failures()) {
            err.println(failure.getErrorCode() + " " + failure.getMessage());
        }
        return report.isSuccessful() ? EXIT_OK : EXIT_FAILED_FILES;
    }

    private ScramblerOptions applyOverrides(ScramblerOptions options) {
        ScramblerOptions result = options.withProjectDir(input);
        if (melt) result = result.withMeltEnabled(true);
        if (keepTypeCasting) result = result.withRemoveTypeCasting(false);
        if (seed != null) result = result.withLabelSeed(seed);
        if (labelMap != null) result = result.withLabelMapFile(labelMap);
        if (noFailFast) result = result.withFailFast(false);
        return result;
    }
}
