package io.github.hide212131.langchain4j.atelier.runtime.provider;

import io.github.hide212131.langchain4j.atelier.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.atelier.runtime.usage.ModelCatalog;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically pings every registered backend with its cheapest model so the health tracker has fresh data
 * between sessions. Outcomes are recorded by the gateways themselves.
 */
public final class ProviderHealthProbe implements AutoCloseable {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(60);
    static final String PING_PROMPT = "Respond with only the word OK";
    static final int PING_MAX_TOKENS = 10;

    private static final WorkflowLogger LOG = new WorkflowLogger(ProviderHealthProbe.class);

    private final ProviderRegistry registry;
    private final Duration interval;
    private ScheduledExecutorService scheduler;

    public ProviderHealthProbe(ProviderRegistry registry) {
        this(registry, DEFAULT_INTERVAL);
    }

    public ProviderHealthProbe(ProviderRegistry registry, Duration interval) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    /**
     * Schedules {@link #probeAll()} every interval, the first run one interval from now. Idempotent.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "provider-health-probe");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::probeAll, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Provider health probe started for {} every {} ms", registry.types(), interval.toMillis());
    }

    /**
     * Pings each backend once. Returns the number of backends that answered.
     */
    public int probeAll() {
        int healthy = 0;
        for (ProviderGateway gateway : registry.gateways()) {
            Optional<String> model = ModelCatalog.cheapestModel(gateway.type());
            if (model.isEmpty()) {
                continue;
            }
            try {
                gateway.generate(new GenerationRequest("", PING_PROMPT, model.get(), 0.0, PING_MAX_TOKENS));
                healthy++;
            } catch (ProviderException e) {
                LOG.warn("Health ping to {} ({}) failed: {}", gateway.type(), model.get(), e.getMessage());
            }
        }
        return healthy;
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
