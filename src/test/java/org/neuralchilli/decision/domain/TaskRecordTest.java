package org.neuralchilli.decision.domain;

import org.junit.jupiter.api.Test;
import org.neuralchilli.decision.domain.payload.SucceedPayload;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskRecordTest {

    @Test
    void shouldApplyDefaults() {
        TaskRecord task = TaskRecord.builder("build-linux")
                .kind("build")
                .payload(new SucceedPayload())
                .build();

        assertThat(task.provisionerId()).isEqualTo("aws-provisioner-v1");
        assertThat(task.workerType()).isEqualTo("github-worker");
        assertThat(task.deadlineIn()).isEqualTo("1 day");
        assertThat(task.expiresIn()).isEqualTo("1 year");
        assertThat(task.indexAndArtifactsExpireIn()).isEqualTo("1 year");
        assertThat(task.cache().isCached()).isFalse();
        assertThat(task.description()).isEmpty();
    }

    @Test
    void shouldRejectInvalidLabel() {
        assertThatThrownBy(() -> TaskRecord.builder("Build Linux")
                .kind("build")
                .payload(new SucceedPayload())
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must match pattern");
    }

    @Test
    void shouldRejectSelfDependency() {
        assertThatThrownBy(() -> TaskFixtures.task("a", "a"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot depend on itself");
    }

    @Test
    void shouldRejectMissingPayload() {
        assertThatThrownBy(() -> TaskRecord.builder("a").kind("build").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("payload");
    }

    @Test
    void shouldReturnNewRecordOnChange() {
        TaskRecord original = TaskFixtures.task("a", "b");

        TaskRecord changed = original.withAddedDependencies(List.of("c")).withAttribute("component", "x");

        assertThat(original.dependencies()).containsExactly("b");
        assertThat(original.attributes()).isEmpty();
        assertThat(changed.dependencies()).containsExactly("b", "c");
        assertThat(changed.attribute("component")).isEqualTo("x");
    }

    @Test
    void shouldFreezeAttributes() {
        TaskRecord task = TaskFixtures.task("a", Map.of("platforms", List.of("linux")));

        assertThatThrownBy(() -> task.attributes().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
        @SuppressWarnings("unchecked")
        List<Object> platforms = (List<Object>) task.attribute("platforms");
        assertThatThrownBy(() -> platforms.add("mac"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldReadBooleanAttributes() {
        TaskRecord task = TaskFixtures.task("a", Map.of("normal-ci", false, "full-ci", "true"));

        assertThat(task.booleanAttribute("normal-ci", true)).isFalse();
        assertThat(task.booleanAttribute("full-ci", false)).isTrue();
        assertThat(task.booleanAttribute("release-only", false)).isFalse();
    }

    @Test
    void shouldDetectNotifications() {
        TaskRecord plain = TaskFixtures.task("a");
        TaskRecord routed = plain.withAddedRoute("notify.email.dev@example.com.on-failed");
        TaskRecord extra = plain.withExtra(Map.of("notify", Map.of("email", Map.of("subject", "x"))));

        assertThat(plain.hasNotifications()).isFalse();
        assertThat(routed.hasNotifications()).isTrue();
        assertThat(extra.hasNotifications()).isTrue();
    }

    @Test
    void shouldStartEveryVariantFromAFreshBuilder() {
        // Given: A task
        TaskRecord original = TaskFixtures.task("a", "b");

        // When: Deriving two variants through toBuilder
        TaskRecord renamed = original.toBuilder().label("renamed").build();
        TaskRecord described = original.toBuilder().description("Other").build();

        // Then: Neither variant sees the other's changes, and the original is untouched
        assertThat(renamed.description()).isEqualTo("Task a");
        assertThat(described.label()).isEqualTo("a");
        assertThat(original.label()).isEqualTo("a");
        assertThat(original.description()).isEqualTo("Task a");
    }
}
