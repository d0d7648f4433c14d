package fr.lapetina.sct.chatbot.infrastructure.config;

/**
 * Where the value of a field came from, in precedence order.
 */
public enum ValueSource {
    ENVIRONMENT,
    OVERRIDE_FILE,
    DEFAULT
}
