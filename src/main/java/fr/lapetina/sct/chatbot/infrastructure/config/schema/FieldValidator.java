package fr.lapetina.sct.chatbot.infrastructure.config.schema;

import fr.lapetina.sct.chatbot.infrastructure.config.exception.SettingsException;

/**
 * Field-specific check applied to a value after type coercion.
 */
@FunctionalInterface
public interface FieldValidator {

    /**
     * Validates and optionally normalizes a coerced value.
     *
     * @param field The field being loaded
     * @param value The coerced value, an instance of the field's Java type
     * @return The value to freeze into the settings (possibly normalized)
     * @throws SettingsException if the value is not acceptable
     */
    Object validate(FieldSpec field, Object value);
}
