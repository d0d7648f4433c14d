package fr.lapetina.sct.chatbot.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * Redacted view of loaded settings, serialized to JSON for diagnostics.
 */
public record SettingsSnapshot(
        Instant generatedAt,
        String environment,
        boolean production,
        boolean development,
        List<FieldReport> fields
) {
    public SettingsSnapshot {
        fields = fields != null ? List.copyOf(fields) : List.of();
    }
}
