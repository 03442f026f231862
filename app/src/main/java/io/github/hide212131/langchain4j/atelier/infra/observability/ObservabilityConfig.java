package io.github.hide212131.langchain4j.atelier.infra.observability;

import io.github.hide212131.langchain4j.atelier.infra.logging.WorkflowLogger;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Session tracing setup. Spans are exported over OTLP/HTTP with Basic authentication (a LangFuse
 * project, typically) when an endpoint and both credentials are configured; otherwise every tracer
 * handed out is a no-op.
 *
 * <p>Environment variables:</p>
 * <ul>
 *   <li>LANGFUSE_OTLP_ENDPOINT: OTLP HTTP endpoint.</li>
 *   <li>LANGFUSE_OTLP_USERNAME or LANGFUSE_PUBLIC_KEY: user for Basic auth.</li>
 *   <li>LANGFUSE_OTLP_PASSWORD or LANGFUSE_SECRET_KEY: password for Basic auth.</li>
 *   <li>LANGFUSE_SERVICE_NAME: service name, defaults to langchain4j-atelier.</li>
 *   <li>LANGFUSE_ENVIRONMENT: environment label, defaults to "default".</li>
 *   <li>ATELIER_OTLP_TIMEOUT_SECONDS: export timeout, defaults to 30.</li>
 * </ul>
 */
public final class ObservabilityConfig implements AutoCloseable {

    static final String DEFAULT_SERVICE_NAME = "langchain4j-atelier";
    static final Duration DEFAULT_EXPORT_TIMEOUT = Duration.ofSeconds(30);
    private static final String INSTRUMENTATION_SCOPE = "io.github.hide212131.langchain4j.atelier";
    private static final WorkflowLogger LOG = new WorkflowLogger(ObservabilityConfig.class);

    private final OpenTelemetry openTelemetry;
    private final OpenTelemetrySdk sdk;
    private final boolean enabled;

    private ObservabilityConfig(OpenTelemetry openTelemetry, OpenTelemetrySdk sdk) {
        this.openTelemetry = openTelemetry;
        this.sdk = sdk;
        this.enabled = sdk != null;
    }

    public static ObservabilityConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static ObservabilityConfig fromEnvironment(EnvironmentVariables environment) {
        return ExportSettings.read(environment)
                .map(ObservabilityConfig::exporting)
                .orElseGet(ObservabilityConfig::disabled);
    }

    public static ObservabilityConfig disabled() {
        return new ObservabilityConfig(OpenTelemetry.noop(), null);
    }

    private static ObservabilityConfig exporting(ExportSettings settings) {
        OtlpHttpSpanExporter exporter = OtlpHttpSpanExporter.builder()
                .setEndpoint(settings.endpoint())
                .setTimeout(settings.timeout().toMillis(), TimeUnit.MILLISECONDS)
                .setHeaders(settings::headers)
                .build();
        Resource resource = Resource.getDefault().merge(Resource.create(Attributes.of(
                AttributeKey.stringKey("service.name"), settings.serviceName(),
                AttributeKey.stringKey("langfuse.environment"), settings.environmentName())));
        OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                .setTracerProvider(SdkTracerProvider.builder()
                        .addSpanProcessor(BatchSpanProcessor.builder(exporter).build())
                        .setResource(resource)
                        .build())
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .build();
        LOG.info("Session tracing enabled: endpoint={} service={}", settings.endpoint(), settings.serviceName());
        return new ObservabilityConfig(sdk, sdk);
    }

    public OpenTelemetry openTelemetry() {
        return openTelemetry;
    }

    public Tracer tracer() {
        return openTelemetry.getTracer(INSTRUMENTATION_SCOPE);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public SessionTracer sessionTracer() {
        return new SessionTracer(tracer(), enabled);
    }

    /** Flushes pending spans. A no-op when tracing is disabled. */
    @Override
    public void close() {
        if (sdk != null) {
            sdk.getSdkTracerProvider().shutdown().join(DEFAULT_EXPORT_TIMEOUT.toSeconds(), TimeUnit.SECONDS);
        }
    }

    record ExportSettings(
            String endpoint,
            String username,
            String password,
            String serviceName,
            String environmentName,
            Duration timeout) {

        static Optional<ExportSettings> read(EnvironmentVariables environment) {
            String endpoint = firstNonBlank(environment.get("LANGFUSE_OTLP_ENDPOINT"));
            if (endpoint == null) {
                LOG.debug("OTLP endpoint is not configured; session tracing disabled");
                return Optional.empty();
            }
            String username = firstNonBlank(
                    environment.get("LANGFUSE_OTLP_USERNAME"), environment.get("LANGFUSE_PUBLIC_KEY"));
            String password = firstNonBlank(
                    environment.get("LANGFUSE_OTLP_PASSWORD"), environment.get("LANGFUSE_SECRET_KEY"));
            if (username == null || password == null) {
                LOG.warn("OTLP endpoint {} is set but credentials are incomplete; session tracing disabled", endpoint);
                return Optional.empty();
            }
            return Optional.of(new ExportSettings(
                    endpoint,
                    username,
                    password,
                    firstNonBlank(environment.get("LANGFUSE_SERVICE_NAME"), DEFAULT_SERVICE_NAME),
                    firstNonBlank(environment.get("LANGFUSE_ENVIRONMENT"), "default"),
                    timeout(environment.get("ATELIER_OTLP_TIMEOUT_SECONDS"))));
        }

        Map<String, String> headers() {
            String credentials = Base64.getEncoder()
                    .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
            return Map.of("Authorization", "Basic " + credentials);
        }

        private static Duration timeout(String raw) {
            if (raw == null || raw.isBlank()) {
                return DEFAULT_EXPORT_TIMEOUT;
            }
            try {
                long seconds = Long.parseLong(raw.trim());
                if (seconds <= 0) {
                    throw new IllegalStateException("ATELIER_OTLP_TIMEOUT_SECONDS must be positive: " + raw);
                }
                return Duration.ofSeconds(seconds);
            } catch (NumberFormatException e) {
                throw new IllegalStateException("ATELIER_OTLP_TIMEOUT_SECONDS is not a number: " + raw, e);
            }
        }
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return null;
    }

    @FunctionalInterface
    interface EnvironmentVariables {
        String get(String key);
    }
}
