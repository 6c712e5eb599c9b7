package com.platform.driftcontrol.observability;

import com.platform.driftcontrol.config.RemediationProperties;
import com.platform.driftcontrol.error.ValidationException;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Span export for remediation runs, configured under {@code drift.remediation.tracing}.
 *
 * The exported resource identifies the remediation deployment (dry-run mode, Terraform
 * working directory, concurrency) so traces from different targets can be told apart.
 */
@Slf4j
@Configuration
public class TracingConfig {

    static final String INSTRUMENTATION_SCOPE = "com.platform.driftcontrol.remediation";

    static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    static final AttributeKey<Boolean> DRY_RUN = AttributeKey.booleanKey("remediation.dry_run");
    static final AttributeKey<String> WORKING_DIRECTORY = AttributeKey.stringKey("remediation.terraform.working_directory");
    static final AttributeKey<Long> MAX_CONCURRENT = AttributeKey.longKey("remediation.max_concurrent");

    @Bean
    public OpenTelemetry openTelemetry(RemediationProperties properties,
                                       @Value("${spring.application.name:drift-control}") String serviceName) {
        RemediationProperties.Tracing tracing = properties.getTracing();
        if (!tracing.isEnabled()) {
            log.info("Remediation tracing is disabled");
            return OpenTelemetry.noop();
        }

        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
            .setResource(remediationResource(serviceName, properties))
            .setSampler(sampler(tracing.getSamplingRatio()))
            .addSpanProcessor(BatchSpanProcessor.builder(
                OtlpGrpcSpanExporter.builder().setEndpoint(tracing.getEndpoint()).build()).build())
            .build();

        log.info("Remediation spans exported to {} (sampling ratio {})", tracing.getEndpoint(), tracing.getSamplingRatio());
        return OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setPropagators(ContextPropagators.noop())
            .build();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_SCOPE);
    }

    static Resource remediationResource(String serviceName, RemediationProperties properties) {
        Attributes attributes = Attributes.builder()
            .put(SERVICE_NAME, serviceName)
            .put(DRY_RUN, properties.isDryRun())
            .put(WORKING_DIRECTORY, Path.of(properties.getTerraform().getWorkingDirectory()).toAbsolutePath().normalize().toString())
            .put(MAX_CONCURRENT, properties.getMaxConcurrent())
            .build();
        return Resource.getDefault().merge(Resource.create(attributes));
    }

    /**
     * Root spans are sampled by trace id ratio; child spans follow their parent.
     *
     * @throws ValidationException when the ratio is outside [0, 1]
     */
    static Sampler sampler(double ratio) {
        if (Double.isNaN(ratio) || ratio < 0.0 || ratio > 1.0) {
            throw new ValidationException("tracing.samplingRatio", ratio, "must be between 0 and 1");
        }
        return Sampler.parentBased(Sampler.traceIdRatioBased(ratio));
    }
}
