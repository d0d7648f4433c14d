package fr.lapetina.sct.chatbot.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.sct.chatbot.api.dto.FieldReport;
import fr.lapetina.sct.chatbot.api.dto.SettingsSnapshot;
import fr.lapetina.sct.chatbot.infrastructure.config.Settings;
import fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldSpec;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders loaded settings as JSON with secret values masked.
 */
public final class SettingsReport {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SettingsReport() {
        this(Clock.systemUTC());
    }

    public SettingsReport(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Builds the redacted snapshot of the given settings.
     */
    public SettingsSnapshot snapshot(Settings settings) {
        List<FieldReport> fields = new ArrayList<>(settings.getSchema().size());
        for (FieldSpec field : settings.getSchema().getFields()) {
            fields.add(new FieldReport(
                    field.name(),
                    field.type().getDisplayName(),
                    field.required(),
                    field.secret(),
                    settings.getSource(field.name()).name(),
                    reportedValue(field, settings.get(field.name())),
                    field.description()
            ));
        }

        String environment = settings.getSchema().contains("ENVIRONMENT")
                ? settings.getString("ENVIRONMENT")
                : null;
        boolean production = environment != null && settings.isProduction();
        boolean development = environment != null && settings.isDevelopment();

        return new SettingsSnapshot(clock.instant(), environment, production, development, fields);
    }

    /**
     * Serializes the redacted snapshot of the given settings.
     */
    public String toJson(Settings settings) {
        try {
            return objectMapper.writeValueAsString(snapshot(settings));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize settings report", e);
        }
    }

    private static Object reportedValue(FieldSpec field, Object value) {
        Object unwrapped = value instanceof Optional ? ((Optional<?>) value).orElse(null) : value;
        if (unwrapped != null && field.secret()) {
            return FieldSpec.MASKED_VALUE;
        }
        return unwrapped;
    }
}
