package dev.catananti.transfield.config;

import dev.catananti.transfield.exception.TranslationConfigException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Process-wide language configuration: the ordered supported languages and the
 * fallback language. Read-only once built.
 */
@Getter
public final class LanguageSettings {

    private final List<Language> languages;
    private final String fallbackLanguage;
    private final boolean translateLabels;
    private final boolean strictAssignment;

    public LanguageSettings(List<Language> languages, String fallbackLanguage,
                            boolean translateLabels, boolean strictAssignment) {
        if (languages == null || languages.isEmpty()) {
            throw new TranslationConfigException(null, "At least one language must be configured");
        }
        Set<String> seen = new HashSet<>();
        for (Language language : languages) {
            if (!seen.add(language.code())) {
                throw new TranslationConfigException(null, "Language configured twice: " + language.code());
            }
        }
        String fallback = fallbackLanguage == null ? "" : fallbackLanguage.trim().toLowerCase(Locale.ROOT);
        if (!seen.contains(fallback)) {
            throw new TranslationConfigException(null,
                    "Fallback language '" + fallbackLanguage + "' is not one of the configured languages " + seen);
        }
        this.languages = List.copyOf(languages);
        this.fallbackLanguage = fallback;
        this.translateLabels = translateLabels;
        this.strictAssignment = strictAssignment;
    }

    public static LanguageSettings of(String fallbackLanguage, String... codes) {
        List<Language> languages = new ArrayList<>();
        for (String code : codes) {
            languages.add(Language.of(code));
        }
        return new LanguageSettings(languages, fallbackLanguage, true, false);
    }

    public List<String> getLanguageCodes() {
        return languages.stream().map(Language::code).toList();
    }

    /**
     * Check if a language code is configured.
     */
    public boolean isSupported(String code) {
        return code != null && getLanguageCodes().contains(code.toLowerCase(Locale.ROOT));
    }

    public boolean isFallback(String code) {
        return fallbackLanguage.equalsIgnoreCase(code);
    }
}
