package org.neuralchilli.decision.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.decision.config.DecisionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * {@link SourceTree} backed by {@code git rev-parse HEAD:<directory>}.
 */
@ApplicationScoped
public class GitSourceTree implements SourceTree {

    private static final Logger log = LoggerFactory.getLogger(GitSourceTree.class);

    @Inject
    DecisionConfig config;

    @Override
    public String treeHash(String directory) {
        ProcessBuilder builder = new ProcessBuilder("git", "rev-parse", "HEAD:" + directory)
                .directory(new File(config.repositoryRoot()))
                .redirectErrorStream(true);

        try {
            Process process = builder.start();
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).strip();
            if (!process.waitFor(30, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IllegalStateException("git rev-parse timed out for " + directory);
            }
            if (process.exitValue() != 0) {
                throw new IllegalStateException("git rev-parse HEAD:" + directory + " failed: " + output);
            }
            log.debug("Tree hash of {}: {}", directory, output);
            return output;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to run git for " + directory, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while hashing " + directory, e);
        }
    }
}
