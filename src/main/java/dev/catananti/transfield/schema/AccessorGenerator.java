package dev.catananti.transfield.schema;

import dev.catananti.transfield.config.LanguageSettings;
import dev.catananti.transfield.language.ActiveLanguage;
import lombok.RequiredArgsConstructor;

/**
 * Builds the read/write accessor installed under a translatable field's canonical name.
 */
@RequiredArgsConstructor
public class AccessorGenerator {

    private final LanguageSettings settings;
    private final ActiveLanguage activeLanguage;

    public TranslatedFieldAccessor generate(String canonicalName) {
        return new TranslatedFieldAccessor(canonicalName, settings, activeLanguage);
    }
}
