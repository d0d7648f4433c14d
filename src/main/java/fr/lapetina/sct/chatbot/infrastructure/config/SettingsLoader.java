package fr.lapetina.sct.chatbot.infrastructure.config;

import fr.lapetina.sct.chatbot.infrastructure.config.exception.MissingRequiredFieldException;
import fr.lapetina.sct.chatbot.infrastructure.config.exception.OverrideFileException;
import fr.lapetina.sct.chatbot.infrastructure.config.exception.SettingsException;
import fr.lapetina.sct.chatbot.infrastructure.config.exception.SettingsLoadException;
import fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldSpec;
import fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldValidator;
import fr.lapetina.sct.chatbot.infrastructure.config.schema.SettingsSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Schema-driven settings loader.
 *
 * For every field, in declaration order:
 * - look the name up in the environment, then in the override file, then use the default
 * - fail with a missing-field error when none applies
 * - coerce the raw value to the declared type
 * - run the field validators
 *
 * Any failure aborts the load; no partially filled {@link Settings} is ever returned.
 */
public final class SettingsLoader {

    private static final Logger log = LoggerFactory.getLogger(SettingsLoader.class);

    private final Path overrideFile;
    private final LoadMode mode;
    private final List<SettingsLoadListener> listeners;
    private final ValueCoercer coercer;
    private final OverrideFileReader fileReader;

    private SettingsLoader(Builder builder) {
        this.overrideFile = builder.overrideFile;
        this.mode = builder.mode;
        this.listeners = List.copyOf(builder.listeners);
        this.coercer = builder.coercer;
        this.fileReader = builder.fileReader;
    }

    /**
     * Creates a fail-fast loader without an override file.
     */
    public static SettingsLoader withDefaults() {
        return builder().build();
    }

    /**
     * Loads settings from the live process environment.
     *
     * @throws SettingsLoadException if any field is missing or invalid
     */
    public Settings load(SettingsSchema schema) {
        return load(schema, System.getenv());
    }

    /**
     * Loads settings from the given environment and the configured override file.
     *
     * @param schema Fields to load
     * @param env Environment variables; keys match field names exactly
     * @return The loaded settings
     * @throws SettingsLoadException if any field is missing or invalid
     * @throws OverrideFileException if the override file exists but cannot be read
     */
    public Settings load(SettingsSchema schema, Map<String, String> env) {
        Objects.requireNonNull(schema, "Schema is required");
        Objects.requireNonNull(env, "Environment is required");

        long start = System.nanoTime();
        Map<String, RawValue> overrides = readOverrides(start);

        Map<String, Object> values = new LinkedHashMap<>();
        Map<String, ValueSource> sources = new LinkedHashMap<>();
        List<SettingsException> failures = new ArrayList<>();

        for (FieldSpec field : schema.getFields()) {
            try {
                resolve(field, env, overrides, values, sources);
            } catch (SettingsException e) {
                failures.add(e);
                log.debug("Field {} rejected: {}", field.name(), e.getMessage());
                if (mode == LoadMode.FAIL_FAST) {
                    break;
                }
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        if (!failures.isEmpty()) {
            SettingsLoadException failure = new SettingsLoadException(failures);
            notifyFailure(failure, elapsed);
            throw failure;
        }

        Settings settings = new Settings(schema, values, sources);
        logSummary(sources, elapsed);
        notifyLoaded(settings, elapsed);
        return settings;
    }

    private Map<String, RawValue> readOverrides(long start) {
        if (overrideFile == null) {
            return Map.of();
        }
        try {
            return fileReader.read(overrideFile);
        } catch (OverrideFileException e) {
            notifyOverrideFileFailure(e, Duration.ofNanos(System.nanoTime() - start));
            throw e;
        }
    }

    private void resolve(
            FieldSpec field,
            Map<String, String> env,
            Map<String, RawValue> overrides,
            Map<String, Object> values,
            Map<String, ValueSource> sources
    ) {
        RawValue raw;
        ValueSource source;

        String fromEnv = env.get(field.name());
        if (fromEnv != null) {
            raw = RawValue.ofText(fromEnv);
            source = ValueSource.ENVIRONMENT;
        } else if (overrides.containsKey(field.name())) {
            raw = overrides.get(field.name());
            source = ValueSource.OVERRIDE_FILE;
        } else if (field.hasDefault()) {
            values.put(field.name(), field.defaultValue());
            sources.put(field.name(), ValueSource.DEFAULT);
            return;
        } else {
            throw new MissingRequiredFieldException(field.name());
        }

        Object value = coercer.coerce(field, raw);
        for (FieldValidator validator : field.validators()) {
            value = validator.validate(field, value);
        }

        values.put(field.name(), value);
        sources.put(field.name(), source);
        log.debug("Resolved {}={} from {}", field.name(), field.display(value), source);
    }

    private void logSummary(Map<String, ValueSource> sources, Duration elapsed) {
        Map<ValueSource, Integer> counts = new EnumMap<>(ValueSource.class);
        for (ValueSource source : ValueSource.values()) {
            counts.put(source, 0);
        }
        sources.values().forEach(source -> counts.merge(source, 1, Integer::sum));

        log.info("Settings loaded: {} fields ({} from environment, {} from override file, {} defaults) in {} ms",
                sources.size(),
                counts.get(ValueSource.ENVIRONMENT),
                counts.get(ValueSource.OVERRIDE_FILE),
                counts.get(ValueSource.DEFAULT),
                elapsed.toMillis());
    }

    private void notifyLoaded(Settings settings, Duration elapsed) {
        for (SettingsLoadListener listener : listeners) {
            try {
                listener.onLoaded(settings, elapsed);
            } catch (Exception e) {
                log.error("Error notifying settings load listener", e);
            }
        }
    }

    private void notifyFailure(SettingsLoadException failure, Duration elapsed) {
        for (SettingsLoadListener listener : listeners) {
            try {
                listener.onLoadFailed(failure, elapsed);
            } catch (Exception e) {
                log.error("Error notifying settings load listener", e);
            }
        }
    }

    private void notifyOverrideFileFailure(OverrideFileException failure, Duration elapsed) {
        for (SettingsLoadListener listener : listeners) {
            try {
                listener.onOverrideFileFailed(failure, elapsed);
            } catch (Exception e) {
                log.error("Error notifying settings load listener", e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path overrideFile;
        private LoadMode mode = LoadMode.FAIL_FAST;
        private final List<SettingsLoadListener> listeners = new ArrayList<>();
        private ValueCoercer coercer = new ValueCoercer();
        private OverrideFileReader fileReader = new OverrideFileReader();

        /**
         * Override file consulted when an environment variable is absent. A missing file is not an error.
         */
        public Builder overrideFile(Path overrideFile) {
            this.overrideFile = overrideFile;
            return this;
        }

        public Builder mode(LoadMode mode) {
            this.mode = Objects.requireNonNull(mode, "Mode is required");
            return this;
        }

        public Builder listener(SettingsLoadListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "Listener is required"));
            return this;
        }

        public Builder coercer(ValueCoercer coercer) {
            this.coercer = Objects.requireNonNull(coercer, "Coercer is required");
            return this;
        }

        public Builder fileReader(OverrideFileReader fileReader) {
            this.fileReader = Objects.requireNonNull(fileReader, "File reader is required");
            return this;
        }

        public SettingsLoader build() {
            return new SettingsLoader(this);
        }
    }
}
