package fr.lapetina.sct.chatbot.infrastructure.config;

import java.util.List;

/**
 * Uncoerced value of a field as found in a source.
 *
 * Environment values are always text. The override file may also supply a
 * structural list (a YAML sequence), which list coercion passes through unchanged.
 */
public record RawValue(String text, List<String> elements) {

    public RawValue {
        if ((text == null) == (elements == null)) {
            throw new IllegalArgumentException("Exactly one of text or elements must be set");
        }
        elements = elements != null ? List.copyOf(elements) : null;
    }

    public static RawValue ofText(String text) {
        return new RawValue(text, null);
    }

    public static RawValue ofList(List<String> elements) {
        return new RawValue(null, elements);
    }

    public boolean isList() {
        return elements != null;
    }

    @Override
    public String toString() {
        return isList() ? elements.toString() : text;
    }
}
