package fr.lapetina.sct.chatbot.infrastructure.config.schema;

import java.util.List;
import java.util.Optional;

/**
 * Declared type of a settings field.
 * Each type is backed by one immutable Java type that loaded values and defaults must have.
 */
public enum FieldType {
    STRING("string", String.class),
    INTEGER("integer", Integer.class),
    FLOAT("float", Double.class),
    BOOLEAN("boolean", Boolean.class),
    STRING_LIST("list of strings", List.class),
    OPTIONAL_STRING("optional string", Optional.class);

    private final String displayName;
    private final Class<?> javaType;

    FieldType(String displayName, Class<?> javaType) {
        this.displayName = displayName;
        this.javaType = javaType;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Class<?> getJavaType() {
        return javaType;
    }
}
