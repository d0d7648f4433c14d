package fr.lapetina.sct.chatbot.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.sct.chatbot.api.dto.FieldReport;
import fr.lapetina.sct.chatbot.api.dto.SettingsSnapshot;
import fr.lapetina.sct.chatbot.infrastructure.config.Settings;
import fr.lapetina.sct.chatbot.infrastructure.config.SettingsLoader;
import fr.lapetina.sct.chatbot.infrastructure.config.schema.ChatbotSettingsSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SettingsReportTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private SettingsReport report;
    private Settings settings;

    @BeforeEach
    void setUp() {
        report = new SettingsReport(Clock.fixed(NOW, ZoneOffset.UTC));

        Map<String, String> env = new HashMap<>();
        env.put("AZURE_TENANT_ID", "tenant");
        env.put("AZURE_CLIENT_ID", "client");
        env.put("AZURE_CLIENT_SECRET", "very-secret");
        env.put("AZURE_OPENAI_ENDPOINT", "https://openai.example");
        env.put("AZURE_OPENAI_API_KEY", "sk-123");
        env.put("AZURE_WORKSPACE_ID", "workspace");
        env.put("REDIS_HOST", "redis");
        env.put("JWT_ISSUER", "issuer");
        env.put("ENVIRONMENT", "PRODUCTION");
        settings = SettingsLoader.withDefaults().load(ChatbotSettingsSchema.definition(), env);
    }

    @Test
    @DisplayName("should mask secrets and report sources")
    void shouldMaskSecrets() {
        SettingsSnapshot snapshot = report.snapshot(settings);

        assertThat(snapshot.generatedAt()).isEqualTo(NOW);
        assertThat(snapshot.production()).isTrue();
        assertThat(snapshot.development()).isFalse();
        assertThat(snapshot.fields()).hasSize(settings.getSchema().size());

        FieldReport secret = field(snapshot, "AZURE_CLIENT_SECRET");
        assertThat(secret.value()).isEqualTo("********");
        assertThat(secret.secret()).isTrue();
        assertThat(secret.source()).isEqualTo("ENVIRONMENT");

        FieldReport password = field(snapshot, "REDIS_PASSWORD");
        assertThat(password.value()).isNull();
        assertThat(password.source()).isEqualTo("DEFAULT");

        assertThat(field(snapshot, "PORT").value()).isEqualTo(8000);
    }

    @Test
    @DisplayName("should serialize the snapshot without secret values")
    void shouldSerializeWithoutSecrets() throws Exception {
        String json = report.toJson(settings);

        assertThat(json).doesNotContain("very-secret", "sk-123");

        JsonNode root = new ObjectMapper().readTree(json);
        assertThat(root.get("generatedAt").asText()).isEqualTo("2026-01-15T10:00:00Z");
        assertThat(root.get("environment").asText()).isEqualTo("PRODUCTION");
        assertThat(root.get("fields").size()).isEqualTo(settings.getSchema().size());
        assertThat(root.get("fields").get(0).get("name").asText()).isEqualTo("APP_NAME");
        assertThat(root.get("fields").get(0).get("type").asText()).isEqualTo("string");
    }

    private static FieldReport field(SettingsSnapshot snapshot, String name) {
        return snapshot.fields().stream()
                .filter(f -> f.name().equals(name))
                .findFirst()
                .orElseThrow();
    }
}
