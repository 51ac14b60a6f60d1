package com.questrail.selective.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SelectionConfigLoader
 * -----------------------------------------------------------------------------
 * Parses one or more selection files into a single {@link SelectionSpec}.
 *
 * <h2>File grammar</h2>
 * Each line is trimmed; empty lines are ignored. A non-empty line is one of:
 * <pre>
 *   utb:&lt;name&gt;   | utb: &lt;name&gt;      include test block
 *   xutb:&lt;name&gt;  | xutb: &lt;name&gt;     exclude test block
 *   utm:&lt;name&gt;   | utm: &lt;name&gt;      include module
 *   xutm:&lt;name&gt;  | xutm: &lt;name&gt;     exclude module
 * </pre>
 * Prefixes are case-sensitive. The name is the trimmed remainder of the line.
 * A recognised prefix followed by a blank name is dropped. Any other line is
 * kept as an {@link UnknownEntry} tagged with its source file.
 *
 * <h2>Failure semantics</h2>
 * Only file access can fail ({@link SelectionConfigException}). Content is
 * never rejected; undecodable bytes are replaced rather than reported.
 */
public final class SelectionConfigLoader
{
    private static final Logger log = LoggerFactory.getLogger(SelectionConfigLoader.class);

    /**
     * Loads and merges every file in {@code paths}, in order.
     *
     * @param paths the selection files; an empty list yields {@link SelectionSpec#empty()}
     * @return the merged, immutable selection
     * @throws SelectionConfigException if a path does not exist or cannot be read
     */
    public SelectionSpec load(List<Path> paths) {
        Objects.requireNonNull(paths, "paths");

        SelectionSpec.Builder builder = SelectionSpec.builder();
        for (Path path : paths) {
            List<String> lines = readLines(path);
            log.debug("Read {} line(s) from selection file {}", lines.size(), path);
            parseInto(builder, lines, path.toString());
        }

        SelectionSpec spec = builder.build();
        log.info("Selection loaded from {} file(s): {}", paths.size(), spec);
        return spec;
    }

    /**
     * Parses in-memory lines as if they had been read from {@code sourceName}.
     */
    public SelectionSpec parseLines(List<String> lines, String sourceName) {
        Objects.requireNonNull(lines, "lines");
        Objects.requireNonNull(sourceName, "sourceName");

        SelectionSpec.Builder builder = SelectionSpec.builder();
        parseInto(builder, lines, sourceName);
        return builder.build();
    }

    /**
     * Classifies a single line.
     *
     * @return the entry, or empty if the line is blank, unrecognised, or has a
     *         recognised prefix with a blank name
     */
    public static Optional<SelectionEntry> classify(String line) {
        Objects.requireNonNull(line, "line");
        String trimmed = line.trim();

        Optional<SelectionKind> kind = SelectionKind.ofLine(trimmed);
        if (kind.isEmpty()) {
            return Optional.empty();
        }
        String value = trimmed.substring(kind.get().prefix().length()).trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new SelectionEntry(kind.get(), value));
    }

    private void parseInto(SelectionSpec.Builder builder, List<String> lines, String sourceName) {
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty()) {
                continue;
            }

            Optional<SelectionEntry> entry = classify(line);
            if (entry.isPresent()) {
                builder.add(entry.get());
            } else if (SelectionKind.ofLine(line).isPresent()) {
                log.debug("Dropping selection line with blank name: '{}' ({})", line, sourceName);
            } else {
                log.warn("Unknown selection line: '{}' ({})", line, sourceName);
                builder.addUnknown(new UnknownEntry(line, sourceName));
            }
        }
    }

    private static List<String> readLines(Path path) {
        Objects.requireNonNull(path, "path");
        if (Files.notExists(path)) {
            throw SelectionConfigException.notFound(path);
        }
        try {
            byte[] bytes = Files.readAllBytes(path);
            return new String(bytes, StandardCharsets.UTF_8).lines().toList();
        } catch (NoSuchFileException e) {
            throw SelectionConfigException.notFound(path);
        } catch (IOException e) {
            throw SelectionConfigException.readFailed(path, e);
        }
    }
}
