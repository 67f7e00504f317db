package org.neuralchilli.decision.domain.payload;

import org.neuralchilli.decision.util.TextFunctions;

/**
 * Public artifact of another task downloaded at the start of a docker-worker task.
 * The download script is only rendered once the upstream task has an id.
 */
public record ArtifactFetch(String label, String artifact, String directory) {

    public static final String QUEUE_URL = "https://queue.taskcluster.net/v1";

    public ArtifactFetch {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Fetched task label cannot be null or empty");
        }
        if (artifact == null || artifact.isBlank()) {
            throw new IllegalArgumentException("Fetched artifact name cannot be null or empty for " + label);
        }
        if (directory == null) {
            directory = "";
        }
    }

    public String filePath() {
        String name = TextFunctions.urlBasename(artifact);
        if (directory.isEmpty()) {
            return name;
        }
        return directory.endsWith("/") ? directory + name : directory + "/" + name;
    }

    String script(RenderContext context) {
        String url = QUEUE_URL + "/task/" + context.taskIdFor(label) + "/artifacts/public/" + artifact;
        return "mkdir -p $(dirname " + filePath() + ")\n"
                + "curl --retry 5 --connect-timeout 10 -Lf " + url + " -o " + filePath();
    }
}
