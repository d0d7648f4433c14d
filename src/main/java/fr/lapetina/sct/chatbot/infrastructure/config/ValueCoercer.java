package fr.lapetina.sct.chatbot.infrastructure.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.sct.chatbot.infrastructure.config.exception.TypeCoercionException;
import fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldSpec;
import fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Converts raw source values into the Java type declared by a field.
 *
 * Rules:
 * - boolean: case-insensitive true/false tokens, anything else fails
 * - integer/float: decimal parse of the trimmed text
 * - list: structural lists (YAML sequence, JSON array text) pass through,
 *   other text is split on commas and each element trimmed
 * - optional string: empty text means unset, anything else is kept as written, never fails
 */
public final class ValueCoercer {

    private static final Set<String> TRUE_TOKENS = Set.of("true", "1", "yes", "on", "t", "y");
    private static final Set<String> FALSE_TOKENS = Set.of("false", "0", "no", "off", "f", "n");

    private final ObjectMapper objectMapper;

    public ValueCoercer() {
        this(new ObjectMapper());
    }

    public ValueCoercer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Coerces a raw value into the field's declared type.
     *
     * @throws TypeCoercionException if the value cannot be converted
     */
    public Object coerce(FieldSpec field, RawValue raw) {
        if (field.type() == FieldType.STRING_LIST) {
            return raw.isList() ? raw.elements() : toList(field, raw.text());
        }
        if (raw.isList()) {
            throw failure(field, raw.toString());
        }

        String text = raw.text();
        return switch (field.type()) {
            case STRING -> text;
            case OPTIONAL_STRING -> text.isEmpty() ? Optional.empty() : Optional.of(text);
            case BOOLEAN -> toBoolean(field, text);
            case INTEGER -> toInteger(field, text);
            case FLOAT -> toDouble(field, text);
            case STRING_LIST -> throw new IllegalStateException("Unreachable");
        };
    }

    private Boolean toBoolean(FieldSpec field, String text) {
        String token = text.trim().toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(token)) {
            return Boolean.TRUE;
        }
        if (FALSE_TOKENS.contains(token)) {
            return Boolean.FALSE;
        }
        throw failure(field, text);
    }

    private Integer toInteger(FieldSpec field, String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw failure(field, text);
        }
    }

    private Double toDouble(FieldSpec field, String text) {
        // BigDecimal rejects Java literal forms such as "1f", "0x1p3" and "NaN"
        double value;
        try {
            value = new BigDecimal(text.trim()).doubleValue();
        } catch (NumberFormatException e) {
            throw failure(field, text);
        }
        if (Double.isInfinite(value)) {
            throw failure(field, text);
        }
        return value;
    }

    private List<String> toList(FieldSpec field, String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
            return fromJsonArray(field, text);
        }
        return Arrays.stream(text.split(",", -1))
                .map(String::trim)
                .toList();
    }

    private List<String> fromJsonArray(FieldSpec field, String text) {
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw failure(field, text);
        }
        if (node == null || !node.isArray()) {
            throw failure(field, text);
        }

        List<String> elements = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (element.isContainerNode()) {
                throw failure(field, text);
            }
            elements.add(element.isNull() ? "" : element.asText());
        }
        return List.copyOf(elements);
    }

    private static TypeCoercionException failure(FieldSpec field, String rawValue) {
        return new TypeCoercionException(field.name(), field.display(rawValue), field.type());
    }
}
