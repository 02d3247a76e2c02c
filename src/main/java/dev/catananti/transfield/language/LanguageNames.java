package dev.catananti.transfield.language;

import dev.catananti.transfield.config.LanguageSettings;

import java.util.List;
import java.util.Locale;

/**
 * Naming rule shared by field expansion and value resolution:
 * {@code title} in {@code en-us} is stored as {@code title_en_us}.
 */
public final class LanguageNames {

    private LanguageNames() {}

    public static String normalize(String languageCode) {
        return languageCode.replace('-', '_');
    }

    public static String concreteName(String canonicalName, String languageCode) {
        return canonicalName + "_" + normalize(languageCode);
    }

    /**
     * The language part of a code, i.e. everything before the first region
     * separator: {@code fr-ca} gives {@code fr}, {@code zh-hans-cn} gives {@code zh}.
     */
    public static String primarySubtag(String languageCode) {
        for (int i = 0; i < languageCode.length(); i++) {
            char c = languageCode.charAt(i);
            if (c == '-' || c == '_') {
                return languageCode.substring(0, i);
            }
        }
        return languageCode;
    }

    public static List<String> concreteNamesInEachLanguage(String canonicalName, LanguageSettings settings) {
        return settings.getLanguageCodes().stream()
                .map(code -> concreteName(canonicalName, code))
                .toList();
    }

    public static String fallbackName(String canonicalName, LanguageSettings settings) {
        return concreteName(canonicalName, settings.getFallbackLanguage());
    }

    /**
     * Name of the field that holds {@code canonicalName} in the language
     * currently active for the calling thread.
     */
    public static String activeName(String canonicalName, ActiveLanguage activeLanguage) {
        return concreteName(canonicalName, activeLanguage.currentLanguage().toLowerCase(Locale.ROOT));
    }
}
