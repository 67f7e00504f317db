package org.neuralchilli.decision.core.transform;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.decision.core.KeyedByResolver;
import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.service.TransformException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.neuralchilli.decision.domain.TaskFixtures.task;

class ResolveKeyedByTransformTest {

    private ResolveKeyedByTransform transform;

    @BeforeEach
    void setUp() {
        transform = new ResolveKeyedByTransform();
        transform.resolver = new KeyedByResolver();
    }

    @Test
    void shouldResolveAttributes() {
        TaskRecord input = task("build", Map.of(
                "platform", "linux",
                "run-on", Map.of("by-platform", Map.of("linux", "docker", "default", "generic"))));

        List<TaskRecord> result = transform.apply(TransformContexts.context(), List.of(input));

        assertThat(result.get(0).attribute("run-on")).isEqualTo("docker");
        assertThat(result.get(0).attribute("platform")).isEqualTo("linux");
    }

    @Test
    void shouldReportUnresolvableAttribute() {
        TaskRecord input = task("build", Map.of("run-on", Map.of("by-trigger", Map.of("cron", "x"))));

        assertThatThrownBy(() -> transform.apply(TransformContexts.context(), List.of(input)))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("attributes.run-on");
    }
}
