package dev.catananti.transfield.language;

import dev.catananti.transfield.config.LanguageSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.i18n.LocaleContextHolder;

import java.util.Locale;

/**
 * Reads the active language from Spring's thread-bound {@link LocaleContextHolder},
 * turning e.g. {@code Locale.CANADA_FRENCH} into {@code fr-ca}.
 */
@Slf4j
@RequiredArgsConstructor
public class LocaleContextActiveLanguage implements ActiveLanguage {

    private static final String UNDETERMINED = "und";

    private final LanguageSettings settings;

    @Override
    public String currentLanguage() {
        Locale locale = LocaleContextHolder.getLocale();
        String code = toLanguageCode(locale);
        if (code == null) {
            log.trace("No usable locale in context, using fallback '{}'", settings.getFallbackLanguage());
            return settings.getFallbackLanguage();
        }
        return code;
    }

    static String toLanguageCode(Locale locale) {
        if (locale == null) {
            return null;
        }
        String tag = locale.toLanguageTag();
        if (tag.isEmpty() || UNDETERMINED.equals(tag)) {
            return null;
        }
        return tag.toLowerCase(Locale.ROOT);
    }
}
