package fr.lapetina.sct.chatbot.infrastructure.config.exception;

/**
 * Thrown when a required field is absent from the environment and the override file.
 */
public final class MissingRequiredFieldException extends SettingsException {

    public MissingRequiredFieldException(String field) {
        super(SettingsErrorType.MISSING_REQUIRED_FIELD, field,
                "Missing required field: " + field);
    }
}
