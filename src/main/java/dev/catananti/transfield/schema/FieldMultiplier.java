package dev.catananti.transfield.schema;

import dev.catananti.transfield.config.LanguageSettings;
import dev.catananti.transfield.language.LanguageNames;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands one logical field into one field per language.
 * <p>
 * Only the fallback-language field keeps the declared nullability and
 * requiredness; every other language is optional.
 * </p>
 */
@Slf4j
public class FieldMultiplier {

    public Map<String, FieldDefinition> multiply(FieldDefinition logicalField, String canonicalName,
                                                 LanguageSettings settings, boolean translateLabels) {
        return multiply(logicalField, canonicalName, settings.getLanguageCodes(),
                settings.getFallbackLanguage(), translateLabels);
    }

    public Map<String, FieldDefinition> multiply(FieldDefinition logicalField, String canonicalName,
                                                 List<String> languages, String fallbackLanguage,
                                                 boolean translateLabels) {
        Map<String, FieldDefinition> concreteFields = new LinkedHashMap<>();
        for (String language : languages) {
            FieldDefinition.FieldDefinitionBuilder builder = logicalField.copy().toBuilder()
                    .originalFieldName(canonicalName)
                    .language(language);
            if (!language.equals(fallbackLanguage)) {
                if (!logicalField.isNullable() && !logicalField.hasDefault()) {
                    builder.nullable(true);
                }
                builder.blank(true);
            }
            if (logicalField.getLabel() != null && translateLabels) {
                builder.label(logicalField.getLabel() + " (" + language + ")");
            }
            concreteFields.put(LanguageNames.concreteName(canonicalName, language), builder.build());
        }
        log.debug("Expanded {} into {}", canonicalName, concreteFields.keySet());
        return concreteFields;
    }
}
