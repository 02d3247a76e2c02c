package dev.catananti.transfield.schema;

import dev.catananti.transfield.config.LanguageSettings;
import dev.catananti.transfield.language.ActiveLanguage;
import dev.catananti.transfield.language.LanguageNames;
import lombok.Getter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Virtual field standing in for a translatable field's canonical name.
 * <p>
 * Candidate languages, in order: the active language, its primary subtag, the
 * record's default language (its default-language field when declared and set,
 * otherwise the fallback language) and that language's primary subtag.
 * Reads return the first non-empty value; writes go to the first language that
 * has a field.
 * </p>
 */
public final class TranslatedFieldAccessor {

    @Getter
    private final String fieldName;
    private final LanguageSettings settings;
    private final ActiveLanguage activeLanguage;

    TranslatedFieldAccessor(String fieldName, LanguageSettings settings, ActiveLanguage activeLanguage) {
        this.fieldName = fieldName;
        this.settings = settings;
        this.activeLanguage = activeLanguage;
    }

    public Optional<Object> resolve(FieldValues record) {
        ModelSchema schema = record.getSchema();
        for (String language : languageChain(record)) {
            String concreteName = LanguageNames.concreteName(fieldName, language);
            if (schema.hasField(concreteName)) {
                Object value = record.getFieldValue(concreteName);
                if (!EmptyValues.isEmpty(value)) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * @return {@code false} when no language in the chain has a field, in which case nothing is written
     */
    public boolean assign(FieldValues record, Object value) {
        ModelSchema schema = record.getSchema();
        for (String language : languageChain(record)) {
            String concreteName = LanguageNames.concreteName(fieldName, language);
            if (schema.hasField(concreteName)) {
                record.setFieldValue(concreteName, value);
                return true;
            }
        }
        return false;
    }

    public List<String> languageChain(FieldValues record) {
        Set<String> chain = new LinkedHashSet<>();
        String current = activeLanguage.currentLanguage();
        if (current != null && !current.isBlank()) {
            String code = current.trim().toLowerCase(Locale.ROOT);
            chain.add(code);
            chain.add(LanguageNames.primarySubtag(code));
        }
        String defaultLanguage = defaultLanguage(record);
        chain.add(defaultLanguage);
        chain.add(LanguageNames.primarySubtag(defaultLanguage));
        return List.copyOf(chain);
    }

    private String defaultLanguage(FieldValues record) {
        Optional<String> defaultLanguageField = record.getSchema().getDefaultLanguageField();
        if (defaultLanguageField.isPresent()) {
            Object value = record.getFieldValue(defaultLanguageField.get());
            if (!EmptyValues.isEmpty(value)) {
                return value.toString().trim().toLowerCase(Locale.ROOT);
            }
        }
        return settings.getFallbackLanguage();
    }
}
