package com.platform.driftcontrol.observability;

import com.platform.driftcontrol.config.RemediationProperties;
import com.platform.driftcontrol.error.ValidationException;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TracingConfig Tests")
class TracingConfigTest {

    private final TracingConfig tracingConfig = new TracingConfig();

    @Test
    @DisplayName("disabled tracing yields non-recording spans")
    void disabledIsNoop() {
        // Given
        RemediationProperties properties = new RemediationProperties();

        // When
        OpenTelemetry openTelemetry = tracingConfig.openTelemetry(properties, "drift-control");
        Span span = tracingConfig.tracer(openTelemetry).spanBuilder("remediation.plan").startSpan();

        // Then
        assertThat(span.isRecording()).isFalse();
        span.end();
    }

    @Test
    @DisplayName("resource identifies the remediation deployment")
    void remediationResource() {
        // Given
        RemediationProperties properties = new RemediationProperties();
        properties.setDryRun(false);
        properties.setMaxConcurrent(4);
        properties.getTerraform().setWorkingDirectory("infra/prod");

        // When
        Resource resource = TracingConfig.remediationResource("drift-control", properties);

        // Then
        assertThat(resource.getAttribute(TracingConfig.SERVICE_NAME)).isEqualTo("drift-control");
        assertThat(resource.getAttribute(TracingConfig.DRY_RUN)).isFalse();
        assertThat(resource.getAttribute(TracingConfig.MAX_CONCURRENT)).isEqualTo(4L);
        assertThat(resource.getAttribute(TracingConfig.WORKING_DIRECTORY))
            .isEqualTo(Path.of("infra/prod").toAbsolutePath().normalize().toString());
    }

    @Test
    @DisplayName("sampler is parent based over a trace id ratio")
    void samplerDescription() {
        Sampler sampler = TracingConfig.sampler(0.25);

        assertThat(sampler.getDescription()).startsWith("ParentBased{root:TraceIdRatioBased");
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.5, Double.NaN})
    @DisplayName("sampling ratios outside [0, 1] are rejected")
    void rejectsInvalidRatio(double ratio) {
        assertThatThrownBy(() -> TracingConfig.sampler(ratio))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("tracing.samplingRatio");
    }
}
