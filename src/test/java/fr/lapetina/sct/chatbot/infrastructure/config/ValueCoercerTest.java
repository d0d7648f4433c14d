package fr.lapetina.sct.chatbot.infrastructure.config;

import fr.lapetina.sct.chatbot.infrastructure.config.exception.TypeCoercionException;
import fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldSpec;
import fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueCoercerTest {

    private static final FieldSpec FLAG = FieldSpec.withDefault("DEBUG", FieldType.BOOLEAN, false, "flag");
    private static final FieldSpec PORT = FieldSpec.withDefault("PORT", FieldType.INTEGER, 8000, "port");
    private static final FieldSpec TEMPERATURE =
            FieldSpec.withDefault("TEMPERATURE", FieldType.FLOAT, 0.7, "temperature");
    private static final FieldSpec ORIGINS =
            FieldSpec.withDefault("ORIGINS", FieldType.STRING_LIST, List.of(), "origins");
    private static final FieldSpec PASSWORD = FieldSpec.optionalString("PASSWORD", "password");
    private static final FieldSpec NAME = FieldSpec.withDefault("NAME", FieldType.STRING, "app", "name");

    private ValueCoercer coercer;

    @BeforeEach
    void setUp() {
        coercer = new ValueCoercer();
    }

    @ParameterizedTest
    @ValueSource(strings = {"true", "True", "TRUE", " true ", "1", "yes", "on"})
    @DisplayName("should coerce true tokens to true")
    void shouldCoerceTrueTokens(String raw) {
        assertThat(coercer.coerce(FLAG, RawValue.ofText(raw))).isEqualTo(true);
    }

    @ParameterizedTest
    @ValueSource(strings = {"false", "False", "FALSE", "0", "no", "off"})
    @DisplayName("should coerce false tokens to false")
    void shouldCoerceFalseTokens(String raw) {
        assertThat(coercer.coerce(FLAG, RawValue.ofText(raw))).isEqualTo(false);
    }

    @ParameterizedTest
    @ValueSource(strings = {"bogus", "truthy", "", "2", "enabled"})
    @DisplayName("should reject unknown boolean tokens")
    void shouldRejectUnknownBooleanTokens(String raw) {
        assertThatThrownBy(() -> coercer.coerce(FLAG, RawValue.ofText(raw)))
                .isInstanceOf(TypeCoercionException.class)
                .satisfies(e -> {
                    TypeCoercionException failure = (TypeCoercionException) e;
                    assertThat(failure.getField()).isEqualTo("DEBUG");
                    assertThat(failure.getRawValue()).isEqualTo(raw);
                    assertThat(failure.getTargetType()).isEqualTo(FieldType.BOOLEAN);
                });
    }

    @Test
    @DisplayName("should parse integers and trim whitespace")
    void shouldParseIntegers() {
        assertThat(coercer.coerce(PORT, RawValue.ofText("9000"))).isEqualTo(9000);
        assertThat(coercer.coerce(PORT, RawValue.ofText(" -1 "))).isEqualTo(-1);
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "80.5", "", "99999999999"})
    @DisplayName("should reject non-integer text")
    void shouldRejectNonInteger(String raw) {
        assertThatThrownBy(() -> coercer.coerce(PORT, RawValue.ofText(raw)))
                .isInstanceOf(TypeCoercionException.class)
                .hasMessageContaining("PORT")
                .hasMessageContaining("integer");
    }

    @Test
    @DisplayName("should parse floats")
    void shouldParseFloats() {
        assertThat(coercer.coerce(TEMPERATURE, RawValue.ofText("0.25"))).isEqualTo(0.25);
        assertThat(coercer.coerce(TEMPERATURE, RawValue.ofText("1"))).isEqualTo(1.0);
        assertThat(coercer.coerce(TEMPERATURE, RawValue.ofText("1e-2"))).isEqualTo(0.01);
    }

    @ParameterizedTest
    @ValueSource(strings = {"warm", "1f", "NaN", "0x10", ""})
    @DisplayName("should reject non-numeric float text")
    void shouldRejectNonNumericFloat(String raw) {
        assertThatThrownBy(() -> coercer.coerce(TEMPERATURE, RawValue.ofText(raw)))
                .isInstanceOf(TypeCoercionException.class);
    }

    @Test
    @DisplayName("should split comma separated lists and trim elements")
    void shouldSplitCommaSeparatedList() {
        assertThat(coercer.coerce(ORIGINS, RawValue.ofText("a, b ,c")))
                .isEqualTo(List.of("a", "b", "c"));
    }

    @Test
    @DisplayName("should coerce empty text to an empty list")
    void shouldCoerceEmptyTextToEmptyList() {
        assertThat(coercer.coerce(ORIGINS, RawValue.ofText(""))).isEqualTo(List.of());
        assertThat(coercer.coerce(ORIGINS, RawValue.ofText("   "))).isEqualTo(List.of());
    }

    @Test
    @DisplayName("should keep interior empty elements")
    void shouldKeepInteriorEmptyElements() {
        assertThat(coercer.coerce(ORIGINS, RawValue.ofText("a,,b")))
                .isEqualTo(List.of("a", "", "b"));
    }

    @Test
    @DisplayName("should pass structural lists through unchanged")
    void shouldPassStructuralListThrough() {
        List<String> elements = List.of(" a ", "b,c");

        assertThat(coercer.coerce(ORIGINS, RawValue.ofList(elements))).isEqualTo(elements);
    }

    @Test
    @DisplayName("should read JSON array text as a structural list")
    void shouldReadJsonArrayText() {
        assertThat(coercer.coerce(ORIGINS, RawValue.ofText("[\"http://a\", \"http://b\"]")))
                .isEqualTo(List.of("http://a", "http://b"));
    }

    @Test
    @DisplayName("should reject malformed JSON array text")
    void shouldRejectMalformedJsonArray() {
        assertThatThrownBy(() -> coercer.coerce(ORIGINS, RawValue.ofText("[a, b]")))
                .isInstanceOf(TypeCoercionException.class);
        assertThatThrownBy(() -> coercer.coerce(ORIGINS, RawValue.ofText("[[\"a\"]]")))
                .isInstanceOf(TypeCoercionException.class);
    }

    @Test
    @DisplayName("should treat only empty optional strings as unset")
    void shouldTreatEmptyOptionalAsUnset() {
        assertThat(coercer.coerce(PASSWORD, RawValue.ofText(""))).isEqualTo(Optional.empty());
        assertThat(coercer.coerce(PASSWORD, RawValue.ofText("  "))).isEqualTo(Optional.of("  "));
        assertThat(coercer.coerce(PASSWORD, RawValue.ofText(" s3cret "))).isEqualTo(Optional.of(" s3cret "));
    }

    @Test
    @DisplayName("should keep strings verbatim")
    void shouldKeepStringsVerbatim() {
        assertThat(coercer.coerce(NAME, RawValue.ofText(" my app "))).isEqualTo(" my app ");
    }

    @Test
    @DisplayName("should reject a list for a scalar field")
    void shouldRejectListForScalar() {
        assertThatThrownBy(() -> coercer.coerce(PORT, RawValue.ofList(List.of("1", "2"))))
                .isInstanceOf(TypeCoercionException.class);
    }

    @Test
    @DisplayName("should mask secret values in coercion errors")
    void shouldMaskSecretValues() {
        FieldSpec secretPort = PORT.asSecret();

        assertThatThrownBy(() -> coercer.coerce(secretPort, RawValue.ofText("hunter2")))
                .isInstanceOf(TypeCoercionException.class)
                .hasMessageNotContaining("hunter2")
                .hasMessageContaining(FieldSpec.MASKED_VALUE);
    }
}
