package fr.lapetina.sct.chatbot.infrastructure.config.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, name-unique set of field specifications.
 *
 * The loader walks the fields in declaration order, so adding a field here is
 * enough to have it loaded, coerced and validated.
 */
public final class SettingsSchema {

    private final List<FieldSpec> fields;
    private final Map<String, FieldSpec> fieldsByName;

    private SettingsSchema(List<FieldSpec> fields) {
        Map<String, FieldSpec> byName = new LinkedHashMap<>();
        for (FieldSpec field : fields) {
            if (byName.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException("Duplicate field name in schema: " + field.name());
            }
        }
        this.fields = List.copyOf(fields);
        this.fieldsByName = Collections.unmodifiableMap(byName);
    }

    public List<FieldSpec> getFields() {
        return fields;
    }

    public Optional<FieldSpec> getField(String name) {
        return Optional.ofNullable(fieldsByName.get(name));
    }

    public boolean contains(String name) {
        return fieldsByName.containsKey(name);
    }

    public int size() {
        return fields.size();
    }

    /**
     * Returns the fields that have no default, in declaration order.
     */
    public List<FieldSpec> getRequiredFields() {
        return fields.stream()
                .filter(FieldSpec::required)
                .toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<FieldSpec> fields = new ArrayList<>();

        public Builder field(FieldSpec field) {
            fields.add(field);
            return this;
        }

        public Builder fields(List<FieldSpec> more) {
            fields.addAll(more);
            return this;
        }

        /**
         * Builds the schema.
         *
         * @throws IllegalArgumentException if two fields share a name
         */
        public SettingsSchema build() {
            return new SettingsSchema(fields);
        }
    }
}
