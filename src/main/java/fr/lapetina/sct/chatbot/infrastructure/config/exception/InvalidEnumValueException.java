package fr.lapetina.sct.chatbot.infrastructure.config.exception;

import java.util.List;

/**
 * Thrown when a value is not one of the tokens a field accepts.
 */
public final class InvalidEnumValueException extends SettingsException {

    private final String value;
    private final List<String> allowedValues;

    public InvalidEnumValueException(String field, String value, List<String> allowedValues) {
        super(SettingsErrorType.INVALID_ENUM_VALUE, field,
                field + " must be one of " + allowedValues + " but was '" + value + "'");
        this.value = value;
        this.allowedValues = List.copyOf(allowedValues);
    }

    public String getValue() {
        return value;
    }

    public List<String> getAllowedValues() {
        return allowedValues;
    }
}
