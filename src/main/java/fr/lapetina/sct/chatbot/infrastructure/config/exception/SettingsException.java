package fr.lapetina.sct.chatbot.infrastructure.config.exception;

/**
 * Base class for a single-field settings failure.
 */
public abstract class SettingsException extends RuntimeException {

    private final SettingsErrorType errorType;
    private final String field;

    protected SettingsException(SettingsErrorType errorType, String field, String message) {
        super(message);
        this.errorType = errorType;
        this.field = field;
    }

    public SettingsErrorType getErrorType() {
        return errorType;
    }

    /**
     * Name of the schema field that failed.
     */
    public String getField() {
        return field;
    }
}
