package fr.lapetina.sct.chatbot.infrastructure.config.exception;

import fr.lapetina.sct.chatbot.infrastructure.config.schema.FieldType;

/**
 * Thrown when a raw textual value cannot be converted into the declared field type.
 *
 * The raw value is kept for diagnostics; callers pass a masked value for secret fields.
 */
public final class TypeCoercionException extends SettingsException {

    private final String rawValue;
    private final FieldType targetType;

    public TypeCoercionException(String field, String rawValue, FieldType targetType) {
        super(SettingsErrorType.TYPE_COERCION, field,
                "Cannot convert value '" + rawValue + "' of field " + field
                        + " to " + targetType.getDisplayName());
        this.rawValue = rawValue;
        this.targetType = targetType;
    }

    public String getRawValue() {
        return rawValue;
    }

    public FieldType getTargetType() {
        return targetType;
    }
}
