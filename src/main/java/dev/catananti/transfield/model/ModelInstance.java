package dev.catananti.transfield.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.catananti.transfield.exception.UnassignableValueException;
import dev.catananti.transfield.language.LanguageNames;
import dev.catananti.transfield.schema.EmptyValues;
import dev.catananti.transfield.schema.FieldValues;
import dev.catananti.transfield.schema.ModelSchema;
import dev.catananti.transfield.schema.TranslatedFieldAccessor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * One record of a model. Stored fields are read and written directly; the
 * canonical name of a translatable field goes through its accessor and
 * resolves to the best available language.
 */
@Slf4j
public class ModelInstance implements FieldValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, String>> TRANSLATIONS_TYPE = new TypeReference<>(){};

    @Getter
    private final ModelSchema schema;
    private final Map<String, Object> values = new LinkedHashMap<>();

    public ModelInstance(ModelSchema schema) {
        if (schema.isAbstractModel()) {
            throw new IllegalArgumentException("Abstract model " + schema.getName() + " cannot be instantiated");
        }
        this.schema = schema;
        schema.getFields().forEach((fieldName, field) -> values.put(fieldName, field.initialValue()));
    }

    public Object get(String name) {
        Optional<TranslatedFieldAccessor> accessor = schema.accessor(name);
        if (accessor.isPresent()) {
            return accessor.get().resolve(this).orElse(null);
        }
        return getFieldValue(name);
    }

    public void set(String name, Object value) {
        Optional<TranslatedFieldAccessor> accessor = schema.accessor(name);
        if (accessor.isEmpty()) {
            setFieldValue(name, value);
            return;
        }
        if (!accessor.get().assign(this, value)) {
            List<String> chain = accessor.get().languageChain(this);
            if (schema.isStrictAssignment()) {
                throw new UnassignableValueException(schema.getName(), name, chain);
            }
            log.warn("Discarding value for {}.{}: no field for any of {}", schema.getName(), name, chain);
        }
    }

    /**
     * Value of a translatable field in one language, without fallback.
     */
    public Object get(String name, String language) {
        return getFieldValue(concreteName(name, language));
    }

    public void set(String name, String language, Object value) {
        setFieldValue(concreteName(name, language), value);
    }

    /**
     * Non-empty values of a translatable field keyed by language, in configured order.
     */
    public Map<String, String> translations(String name) {
        Map<String, String> translations = new LinkedHashMap<>();
        translatableFieldNames(name).forEach((language, fieldName) -> {
            Object value = values.get(fieldName);
            if (!EmptyValues.isEmpty(value)) {
                translations.put(language, value.toString());
            }
        });
        return Collections.unmodifiableMap(translations);
    }

    /**
     * Write every language of {@code translations} that the model stores; other languages are skipped.
     */
    public void applyTranslations(String name, Map<String, String> translations) {
        Map<String, String> fieldNames = translatableFieldNames(name);
        translations.forEach((language, value) -> {
            String fieldName = fieldNames.get(language.toLowerCase(Locale.ROOT));
            if (fieldName == null) {
                log.debug("Skipping {} translation of {}.{}: language not stored", language, schema.getName(), name);
            } else {
                values.put(fieldName, value);
            }
        });
    }

    /**
     * {@link #translations(String)} as a JSON object, e.g. {@code {"en":"Hello","fr":"Bonjour"}}.
     */
    public String translationsJson(String name) {
        try {
            return MAPPER.writeValueAsString(translations(name));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize translations of " + schema.getName() + "." + name, e);
        }
    }

    /**
     * Apply a JSON object of language code to text.
     *
     * @throws IllegalArgumentException when {@code json} is not such an object
     */
    public void applyTranslationsJson(String name, String json) {
        Map<String, String> translations;
        try {
            translations = MAPPER.readValue(json, TRANSLATIONS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Translations of " + schema.getName() + "." + name + " must be a JSON object of strings", e);
        }
        applyTranslations(name, translations);
    }

    /**
     * Check every stored value against its field declaration.
     *
     * @return error messages keyed by field name, empty when the record is valid
     */
    public Map<String, List<String>> validate() {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        schema.getFields().forEach((fieldName, field) -> {
            List<String> fieldErrors = field.validate(values.get(fieldName));
            if (!fieldErrors.isEmpty()) {
                errors.put(fieldName, fieldErrors);
            }
        });
        return errors;
    }

    public Map<String, Object> getValues() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public Object getFieldValue(String fieldName) {
        requireField(fieldName);
        return values.get(fieldName);
    }

    @Override
    public void setFieldValue(String fieldName, Object value) {
        requireField(fieldName);
        values.put(fieldName, value);
    }

    private Map<String, String> translatableFieldNames(String name) {
        if (!schema.isTranslatable(name)) {
            throw new IllegalArgumentException(name + " is not a translatable field of " + schema.getName());
        }
        return schema.concreteFieldNames(name);
    }

    private String concreteName(String name, String language) {
        translatableFieldNames(name);
        return LanguageNames.concreteName(name, language.toLowerCase(Locale.ROOT));
    }

    private void requireField(String fieldName) {
        if (!schema.hasField(fieldName)) {
            throw new IllegalArgumentException("Model " + schema.getName() + " has no field " + fieldName);
        }
    }

    @Override
    public String toString() {
        return schema.getName() + values;
    }
}
