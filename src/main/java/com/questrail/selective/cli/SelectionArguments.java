package com.questrail.selective.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Unmatched;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Extracts selection file paths from a host's command line.
 * <p>
 * Recognises {@code -c <path>}, {@code --config <path>} and
 * {@code --config=<path>}, repeatable, in the order given. Every other
 * argument belongs to the host test runner and is collected untouched.
 */
@Command(name = "selective-unittest", description = "Selection file options of a test run")
public final class SelectionArguments {

    @Option(names = {"--config", "-c"},
            paramLabel = "<path>",
            description = "Selection file; may be repeated, files are merged")
    private List<Path> configPaths = new ArrayList<>();

    @Unmatched
    private List<String> hostArguments = new ArrayList<>();

    public List<Path> configPaths() {
        return List.copyOf(configPaths);
    }

    /**
     * Arguments that are not selection options, in their original order.
     */
    public List<String> hostArguments() {
        return List.copyOf(hostArguments);
    }

    /**
     * Parses {@code args}.
     *
     * @throws IllegalArgumentException if a config option has no value
     */
    public static SelectionArguments parse(String... args) {
        Objects.requireNonNull(args, "args");

        SelectionArguments parsed = new SelectionArguments();
        CommandLine commandLine = new CommandLine(parsed);
        commandLine.setUnmatchedOptionsArePositionalParams(true);
        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException e) {
            throw new IllegalArgumentException("Invalid selection arguments: " + e.getMessage(), e);
        }
        return parsed;
    }
}
