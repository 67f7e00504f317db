package org.neuralchilli.decision.domain.payload;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptworkerPayloadTest {

    private final FixedRenderContext context = FixedRenderContext.of(Map.of(
            "build-release", "BuildTaskId",
            "signing-release", "SigningTaskId"));

    @Test
    void shouldRenderSigningFormatsPerArtifact() {
        SigningPayload payload = new SigningPayload(0, List.of("autograph_gpg"), List.of(
                new UpstreamArtifact("build-release", null, List.of("public/app.aar"))));

        Map<String, Object> rendered = payload.render(context);

        assertThat(rendered.get("maxRunTime")).isEqualTo(600);
        assertThat(rendered.get("upstreamArtifacts")).isEqualTo(List.of(Map.of(
                "taskId", "BuildTaskId",
                "taskType", "build",
                "paths", List.of("public/app.aar"),
                "formats", List.of("autograph_gpg"))));
        assertThat(payload.referencedLabels()).containsExactly("build-release");
    }

    @Test
    void shouldRequireFormatsAndArtifacts() {
        SigningPayload payload = new SigningPayload(0, List.of(), List.of(
                new UpstreamArtifact("build-release", "build", List.of())));

        assertThat(payload.violations()).containsExactly(
                "payload.formats: at least one signing format is required",
                "payload.upstream-artifacts: no paths listed for build-release");
    }

    @Test
    void shouldRenderBeetmoverRelease() {
        BeetmoverPayload payload = new BeetmoverPayload(0, "appservices", "0.42.1", "full-megazord",
                List.of(new UpstreamArtifact("signing-release", "signing", List.of("public/app.aar.asc"))));

        Map<String, Object> rendered = payload.render(context);

        assertThat(rendered)
                .containsEntry("version", "0.42.1")
                .containsEntry("artifact_id", "full-megazord")
                .containsEntry("releaseProperties", Map.of("appName", "appservices"))
                .containsEntry("features", Map.of("chainOfTrust", true));
        assertThat(payload.violations()).isEmpty();
    }

    @Test
    void shouldRequireBeetmoverFields() {
        BeetmoverPayload payload = new BeetmoverPayload(0, null, " ", "x", List.of());

        assertThat(payload.violations()).containsExactly(
                "payload.app-name: required",
                "payload.app-version: required",
                "payload.upstream-artifacts: nothing to publish");
    }

    @Test
    void shouldParseImplementationNames() {
        assertThat(WorkerImplementation.fromString("Docker-Worker")).isEqualTo(WorkerImplementation.DOCKER_WORKER);
        assertThat(new SucceedPayload().render(context)).isEmpty();
    }
}
