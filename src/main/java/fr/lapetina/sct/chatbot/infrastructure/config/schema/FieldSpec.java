package fr.lapetina.sct.chatbot.infrastructure.config.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes one configuration field: name, type, default and documentation.
 * A field without a default is required. Immutable.
 */
public record FieldSpec(
        String name,
        FieldType type,
        Object defaultValue,
        boolean required,
        String description,
        boolean secret,
        List<FieldValidator> validators
) {
    public static final String MASKED_VALUE = "********";

    public FieldSpec {
        Objects.requireNonNull(name, "Name is required");
        Objects.requireNonNull(type, "Type is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
        if (required && defaultValue != null) {
            throw new IllegalArgumentException("Required field " + name + " cannot declare a default");
        }
        if (!required) {
            defaultValue = checkDefault(name, type, defaultValue);
        }
        description = description != null ? description : "";
        validators = validators != null ? List.copyOf(validators) : List.of();
    }

    /**
     * Declares a field that must be supplied by the environment or the override file.
     */
    public static FieldSpec required(String name, FieldType type, String description) {
        return new FieldSpec(name, type, null, true, description, false, null);
    }

    /**
     * Declares a field that falls back to {@code defaultValue} when no source supplies it.
     */
    public static FieldSpec withDefault(String name, FieldType type, Object defaultValue, String description) {
        return new FieldSpec(name, type, defaultValue, false, description, false, null);
    }

    /**
     * Declares an optional string that is unset unless a source supplies it.
     */
    public static FieldSpec optionalString(String name, String description) {
        return withDefault(name, FieldType.OPTIONAL_STRING, Optional.empty(), description);
    }

    /**
     * Returns a copy whose value is masked in logs, reports and error messages.
     */
    public FieldSpec asSecret() {
        return new FieldSpec(name, type, defaultValue, required, description, true, validators);
    }

    /**
     * Returns a copy with additional validators, run after the existing ones.
     */
    public FieldSpec validatedBy(FieldValidator... extra) {
        List<FieldValidator> all = new ArrayList<>(validators);
        all.addAll(List.of(extra));
        return new FieldSpec(name, type, defaultValue, required, description, secret, all);
    }

    public boolean hasDefault() {
        return !required;
    }

    /**
     * Returns the text to show for a value of this field.
     */
    public String display(Object value) {
        if (value instanceof Optional) {
            value = ((Optional<?>) value).orElse(null);
        }
        if (secret && value != null) {
            return MASKED_VALUE;
        }
        return String.valueOf(value);
    }

    private static Object checkDefault(String name, FieldType type, Object defaultValue) {
        if (defaultValue == null || !type.getJavaType().isInstance(defaultValue)) {
            throw new IllegalArgumentException("Default of field " + name
                    + " must be a " + type.getJavaType().getSimpleName() + " but was " + defaultValue);
        }
        if (type == FieldType.STRING_LIST) {
            List<?> list = (List<?>) defaultValue;
            for (Object element : list) {
                if (!(element instanceof String)) {
                    throw new IllegalArgumentException("Default of field " + name
                            + " must only contain strings but contained " + element);
                }
            }
            return List.copyOf(list);
        }
        if (type == FieldType.OPTIONAL_STRING) {
            Optional<?> optional = (Optional<?>) defaultValue;
            if (optional.isPresent() && !(optional.get() instanceof String)) {
                throw new IllegalArgumentException("Default of field " + name + " must wrap a string");
            }
        }
        return defaultValue;
    }
}
