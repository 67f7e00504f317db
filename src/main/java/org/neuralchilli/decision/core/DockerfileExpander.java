package org.neuralchilli.decision.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads Dockerfiles, expanding the non-standard {@code % include <path>} first line.
 * Includes are resolved relative to the including file and expanded transitively.
 */
@ApplicationScoped
public class DockerfileExpander {

    private static final Logger log = LoggerFactory.getLogger(DockerfileExpander.class);

    static final String INCLUDE_MARKER = "% include";

    public String expand(Path dockerfile) {
        return expand(dockerfile.toAbsolutePath().normalize(), new LinkedHashSet<>());
    }

    private String expand(Path dockerfile, Set<Path> stack) {
        if (!stack.add(dockerfile)) {
            throw new IllegalStateException("Dockerfile include cycle: " + stack + " -> " + dockerfile);
        }

        String contents;
        try {
            contents = Files.readString(dockerfile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read Dockerfile: " + dockerfile, e);
        }

        if (!contents.startsWith(INCLUDE_MARKER)) {
            stack.remove(dockerfile);
            return contents;
        }

        int newline = contents.indexOf('\n');
        String includeLine = newline >= 0 ? contents.substring(0, newline) : contents;
        String rest = newline >= 0 ? contents.substring(newline + 1) : "";
        String included = includeLine.substring(INCLUDE_MARKER.length()).strip();

        Path includedPath = dockerfile.resolveSibling(included).normalize();
        log.debug("Dockerfile {} includes {}", dockerfile.getFileName(), includedPath);

        String expanded = expand(includedPath, stack) + "\n" + rest;
        stack.remove(dockerfile);
        return expanded;
    }

    /**
     * Image name of a {@code <name>.dockerfile} path
     */
    public static String imageName(Path dockerfile) {
        String basename = dockerfile.getFileName().toString();
        String suffix = ".dockerfile";
        if (!basename.endsWith(suffix)) {
            throw new IllegalArgumentException("Dockerfile name must end with " + suffix + ": " + basename);
        }
        return basename.substring(0, basename.length() - suffix.length());
    }
}
