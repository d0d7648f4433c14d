package fr.lapetina.sct.chatbot.infrastructure.metrics;

import fr.lapetina.sct.chatbot.infrastructure.config.Settings;
import fr.lapetina.sct.chatbot.infrastructure.config.SettingsLoadListener;
import fr.lapetina.sct.chatbot.infrastructure.config.ValueSource;
import fr.lapetina.sct.chatbot.infrastructure.config.exception.OverrideFileException;
import fr.lapetina.sct.chatbot.infrastructure.config.exception.SettingsException;
import fr.lapetina.sct.chatbot.infrastructure.config.exception.SettingsLoadException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Settings load metrics using Micrometer.
 *
 * Provides:
 * - Load outcome counter and duration timer
 * - Failure counters by error type
 * - Field counts by value source
 * - Info gauge tagged with the environment and application version
 * - Prometheus exposition
 */
public final class SettingsMetrics implements SettingsLoadListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SettingsMetrics.class);

    private static final String OVERRIDE_FILE_ERROR = "override_file";

    private final MeterRegistry registry;
    private final String prefix;
    private final Timer loadTimer;

    private final Map<ValueSource, AtomicInteger> fieldsBySource = new EnumMap<>(ValueSource.class);
    private final AtomicInteger info = new AtomicInteger(0);

    public SettingsMetrics(String prefix) {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT), prefix);
    }

    public SettingsMetrics(MeterRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix;

        this.loadTimer = Timer.builder(prefix + "_settings_load_duration")
                .description("Time spent loading settings")
                .register(registry);

        for (ValueSource source : ValueSource.values()) {
            AtomicInteger count = new AtomicInteger(0);
            fieldsBySource.put(source, count);
            Gauge.builder(prefix + "_settings_fields", count, AtomicInteger::get)
                    .description("Number of settings fields by value source")
                    .tag("source", source.name().toLowerCase())
                    .register(registry);
        }

        log.info("SettingsMetrics initialized with prefix: {}", prefix);
    }

    @Override
    public void onLoaded(Settings settings, Duration elapsed) {
        loadTimer.record(elapsed);
        outcomeCounter("success").increment();

        fieldsBySource.values().forEach(count -> count.set(0));
        for (String name : settings.asMap().keySet()) {
            fieldsBySource.get(settings.getSource(name)).incrementAndGet();
        }

        if (settings.getSchema().contains("ENVIRONMENT") && settings.getSchema().contains("APP_VERSION")) {
            info.set(1);
            Gauge.builder(prefix + "_settings_info", info, AtomicInteger::get)
                    .description("Loaded settings identity")
                    .tag("environment", settings.getString("ENVIRONMENT"))
                    .tag("version", settings.getString("APP_VERSION"))
                    .register(registry);
        }
    }

    @Override
    public void onLoadFailed(SettingsLoadException failure, Duration elapsed) {
        loadTimer.record(elapsed);
        outcomeCounter("failure").increment();

        for (SettingsException cause : failure.getFailures()) {
            failureCounter(cause.getErrorType().name().toLowerCase()).increment();
        }
    }

    @Override
    public void onOverrideFileFailed(OverrideFileException failure, Duration elapsed) {
        loadTimer.record(elapsed);
        outcomeCounter("failure").increment();
        failureCounter(OVERRIDE_FILE_ERROR).increment();
    }

    private Counter failureCounter(String errorType) {
        return Counter.builder(prefix + "_settings_load_failures_total")
                .description("Settings load failures by error type")
                .tag("error_type", errorType)
                .register(registry);
    }

    private Counter outcomeCounter(String outcome) {
        return Counter.builder(prefix + "_settings_load_total")
                .description("Settings load attempts by outcome")
                .tag("outcome", outcome)
                .register(registry);
    }

    /**
     * Returns Prometheus-formatted metrics, or an empty string for non-Prometheus registries.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry) {
            return ((PrometheusMeterRegistry) registry).scrape();
        }
        return "";
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
