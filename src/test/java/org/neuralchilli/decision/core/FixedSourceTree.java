package org.neuralchilli.decision.core;

import io.quarkus.test.Mock;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.decision.util.Hashes;

/**
 * Source tree hashes derived from the directory name, so Quarkus tests never call git.
 */
@Mock
@ApplicationScoped
public class FixedSourceTree implements SourceTree {

    @Override
    public String treeHash(String directory) {
        return Hashes.sha1Hex(directory);
    }
}
