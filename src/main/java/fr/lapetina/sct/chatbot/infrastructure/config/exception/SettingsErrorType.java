package fr.lapetina.sct.chatbot.infrastructure.config.exception;

/**
 * Error taxonomy for settings loading.
 * Every value is fatal at startup; the type is used for logging and metrics tags.
 */
public enum SettingsErrorType {
    /** No source supplied a value and the field declares no default */
    MISSING_REQUIRED_FIELD,

    /** A present value cannot be parsed as the declared type */
    TYPE_COERCION,

    /** A correctly typed value is outside the field's accepted token set */
    INVALID_ENUM_VALUE
}
