package fr.lapetina.sct.chatbot.infrastructure.config.schema;

import fr.lapetina.sct.chatbot.infrastructure.config.exception.InvalidEnumValueException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Built-in field validators.
 */
public final class Validators {

    private Validators() {
        // Utility class
    }

    /**
     * Accepts a value matching one of the tokens case-insensitively and normalizes it
     * to its upper-case form.
     *
     * @param allowed Accepted tokens
     */
    public static FieldValidator oneOfIgnoreCase(String... allowed) {
        List<String> canonical = Arrays.stream(allowed)
                .map(token -> token.toUpperCase(Locale.ROOT))
                .toList();

        return (field, value) -> {
            String text = (String) value;
            String upper = text.toUpperCase(Locale.ROOT);
            if (!canonical.contains(upper)) {
                throw new InvalidEnumValueException(field.name(), text, canonical);
            }
            return upper;
        };
    }

    /**
     * Trims every element of a list value, keeping the original order.
     * Used for origin lists that may arrive pre-split or as comma-separated text.
     */
    public static FieldValidator trimmedList() {
        return (field, value) -> {
            List<?> elements = (List<?>) value;
            return elements.stream()
                    .map(element -> element.toString().trim())
                    .toList();
        };
    }
}
