package fr.lapetina.sct.chatbot.infrastructure.config.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The single failure surfaced by the loader.
 *
 * Holds one field failure in fail-fast mode, or every failure in collect-all mode,
 * in schema declaration order. The first failure is also the cause.
 */
public final class SettingsLoadException extends RuntimeException {

    private final List<SettingsException> failures;

    public SettingsLoadException(List<SettingsException> failures) {
        super(buildMessage(failures), failures.isEmpty() ? null : failures.get(0));
        this.failures = List.copyOf(failures);
    }

    public List<SettingsException> getFailures() {
        return failures;
    }

    private static String buildMessage(List<SettingsException> failures) {
        if (failures.size() == 1) {
            return "Settings could not be loaded: " + failures.get(0).getMessage();
        }
        return failures.stream()
                .map(f -> "  - " + f.getMessage())
                .collect(Collectors.joining("\n",
                        "Settings could not be loaded (" + failures.size() + " errors):\n", ""));
    }
}
