package fr.lapetina.sct.chatbot.infrastructure.config.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SettingsSchemaTest {

    @Test
    @DisplayName("should keep fields in declaration order")
    void shouldKeepDeclarationOrder() {
        SettingsSchema schema = SettingsSchema.builder()
                .field(FieldSpec.withDefault("B", FieldType.STRING, "b", "second letter"))
                .field(FieldSpec.required("A", FieldType.INTEGER, "first letter"))
                .build();

        assertThat(schema.getFields()).extracting(FieldSpec::name).containsExactly("B", "A");
        assertThat(schema.getRequiredFields()).extracting(FieldSpec::name).containsExactly("A");
        assertThat(schema.getField("A")).isPresent();
        assertThat(schema.getField("C")).isEmpty();
        assertThat(schema.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reject duplicate field names")
    void shouldRejectDuplicateNames() {
        SettingsSchema.Builder builder = SettingsSchema.builder()
                .field(FieldSpec.withDefault("PORT", FieldType.INTEGER, 1, "port"))
                .field(FieldSpec.withDefault("PORT", FieldType.STRING, "1", "port again"));

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("PORT");
    }

    @Test
    @DisplayName("should reject defaults that do not match the field type")
    void shouldRejectIllTypedDefaults() {
        assertThatThrownBy(() -> FieldSpec.withDefault("PORT", FieldType.INTEGER, "8000", "port"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FieldSpec.withDefault("TEMP", FieldType.FLOAT, 1, "temp"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FieldSpec.withDefault("LIST", FieldType.STRING_LIST, List.of(1, 2), "list"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FieldSpec.withDefault("OPT", FieldType.OPTIONAL_STRING, "x", "opt"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FieldSpec.withDefault("NAME", FieldType.STRING, null, "name"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should copy list defaults immutably")
    void shouldCopyListDefaults() {
        List<String> methods = new ArrayList<>(List.of("GET"));
        FieldSpec field = FieldSpec.withDefault("METHODS", FieldType.STRING_LIST, methods, "methods");
        methods.add("POST");

        assertThat(field.defaultValue()).isEqualTo(List.of("GET"));
    }

    @Test
    @DisplayName("should mask secret values only")
    void shouldMaskSecretValues() {
        FieldSpec secret = FieldSpec.optionalString("PASSWORD", "password").asSecret();
        FieldSpec plain = FieldSpec.withDefault("HOST", FieldType.STRING, "localhost", "host");

        assertThat(secret.display(Optional.of("pw"))).isEqualTo(FieldSpec.MASKED_VALUE);
        assertThat(secret.display(Optional.empty())).isEqualTo("null");
        assertThat(plain.display("localhost")).isEqualTo("localhost");
    }

    @Test
    @DisplayName("should declare the chatbot service fields")
    void shouldDeclareChatbotFields() {
        SettingsSchema schema = ChatbotSettingsSchema.definition();

        assertThat(schema.getRequiredFields()).extracting(FieldSpec::name).containsExactly(
                "AZURE_TENANT_ID", "AZURE_CLIENT_ID", "AZURE_CLIENT_SECRET",
                "AZURE_OPENAI_ENDPOINT", "AZURE_OPENAI_API_KEY",
                "AZURE_WORKSPACE_ID", "REDIS_HOST", "JWT_ISSUER");
        assertThat(schema.getFields()).filteredOn(FieldSpec::secret).extracting(FieldSpec::name)
                .containsExactly("AZURE_CLIENT_SECRET", "AZURE_OPENAI_API_KEY",
                        "REDIS_PASSWORD", "APPLICATIONINSIGHTS_CONNECTION_STRING");
        assertThat(schema.getField("LOG_LEVEL").orElseThrow().validators()).hasSize(1);
        assertThat(schema.getField("CORS_ORIGINS").orElseThrow().validators()).hasSize(1);
        assertThat(schema.getFields()).allSatisfy(field -> assertThat(field.description()).isNotBlank());
    }
}
