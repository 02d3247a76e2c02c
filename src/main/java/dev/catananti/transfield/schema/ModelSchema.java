package dev.catananti.transfield.schema;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Physical schema of a model: the stored fields (one per language for every
 * translatable field) and the accessors installed under the canonical names.
 */
@Getter
public final class ModelSchema {

    private final String name;
    private final boolean abstractModel;
    private final Map<String, FieldDefinition> fields;
    private final Set<String> translatableFields;
    private final Map<String, TranslatedFieldAccessor> accessors;
    private final boolean strictAssignment;
    @Getter(AccessLevel.NONE)
    private final String defaultLanguageField;

    ModelSchema(String name, boolean abstractModel, Map<String, FieldDefinition> fields,
                Set<String> translatableFields, Map<String, TranslatedFieldAccessor> accessors,
                String defaultLanguageField, boolean strictAssignment) {
        this.name = name;
        this.abstractModel = abstractModel;
        Map<String, FieldDefinition> frozenFields = new LinkedHashMap<>();
        fields.forEach((fieldName, field) -> frozenFields.put(fieldName, field.frozen()));
        this.fields = Collections.unmodifiableMap(frozenFields);
        this.translatableFields = Collections.unmodifiableSet(translatableFields);
        this.accessors = Collections.unmodifiableMap(new LinkedHashMap<>(accessors));
        this.defaultLanguageField = defaultLanguageField;
        this.strictAssignment = strictAssignment;
    }

    public Optional<String> getDefaultLanguageField() {
        return Optional.ofNullable(defaultLanguageField);
    }

    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    public Optional<FieldDefinition> field(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    public boolean isTranslatable(String fieldName) {
        return accessors.containsKey(fieldName);
    }

    public Optional<TranslatedFieldAccessor> accessor(String fieldName) {
        return Optional.ofNullable(accessors.get(fieldName));
    }

    /**
     * Name of the logical field a stored field belongs to: {@code title} for
     * {@code title_en}, the field's own name for ordinary fields.
     *
     * @throws IllegalArgumentException when the schema has no such field
     */
    public String canonicalFieldName(String fieldName) {
        FieldDefinition field = fields.get(fieldName);
        if (field == null) {
            throw new IllegalArgumentException("Model " + name + " has no field " + fieldName);
        }
        return field.getOriginalFieldName() != null ? field.getOriginalFieldName() : fieldName;
    }

    /**
     * Stored fields of a translatable field keyed by language code, in configured order.
     */
    public Map<String, String> concreteFieldNames(String canonicalName) {
        Map<String, String> byLanguage = new LinkedHashMap<>();
        fields.forEach((fieldName, field) -> {
            if (canonicalName.equals(field.getOriginalFieldName())) {
                byLanguage.put(field.getLanguage(), fieldName);
            }
        });
        return byLanguage;
    }
}
