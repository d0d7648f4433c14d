package fr.lapetina.sct.chatbot.infrastructure.config.exception;

/**
 * Exception for an override file that exists but cannot be read or parsed.
 */
public final class OverrideFileException extends RuntimeException {

    public OverrideFileException(String message) {
        super(message);
    }

    public OverrideFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
