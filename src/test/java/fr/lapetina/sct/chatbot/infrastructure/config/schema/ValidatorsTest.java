package fr.lapetina.sct.chatbot.infrastructure.config.schema;

import fr.lapetina.sct.chatbot.infrastructure.config.exception.InvalidEnumValueException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidatorsTest {

    private static final FieldSpec LEVEL = FieldSpec.withDefault("LOG_LEVEL", FieldType.STRING, "INFO", "level");
    private static final FieldSpec ORIGINS =
            FieldSpec.withDefault("CORS_ORIGINS", FieldType.STRING_LIST, List.of(), "origins");

    @Test
    @DisplayName("should normalize accepted tokens to upper case")
    void shouldNormalizeAcceptedTokens() {
        FieldValidator validator = Validators.oneOfIgnoreCase("debug", "INFO");

        assertThat(validator.validate(LEVEL, "debug")).isEqualTo("DEBUG");
        assertThat(validator.validate(LEVEL, "Info")).isEqualTo("INFO");
    }

    @Test
    @DisplayName("should reject tokens outside the allowed set")
    void shouldRejectUnknownTokens() {
        FieldValidator validator = Validators.oneOfIgnoreCase("DEBUG", "INFO");

        assertThatThrownBy(() -> validator.validate(LEVEL, "bogus"))
                .isInstanceOf(InvalidEnumValueException.class)
                .hasMessageContaining("LOG_LEVEL")
                .hasMessageContaining("[DEBUG, INFO]")
                .hasMessageContaining("bogus");
    }

    @Test
    @DisplayName("should trim list elements and keep their order")
    void shouldTrimListElements() {
        Object trimmed = Validators.trimmedList().validate(ORIGINS, List.of(" b ", "a", "  c"));

        assertThat(trimmed).isEqualTo(List.of("b", "a", "c"));
    }
}
