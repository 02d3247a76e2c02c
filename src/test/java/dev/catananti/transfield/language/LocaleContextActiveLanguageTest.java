package dev.catananti.transfield.language;

import dev.catananti.transfield.config.LanguageSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.i18n.LocaleContextHolder;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LocaleContextActiveLanguage Tests")
class LocaleContextActiveLanguageTest {

    private final LocaleContextActiveLanguage activeLanguage =
            new LocaleContextActiveLanguage(LanguageSettings.of("fr", "en", "fr"));

    @AfterEach
    void tearDown() {
        LocaleContextHolder.resetLocaleContext();
    }

    @Test
    @DisplayName("Should read language from the thread-bound locale")
    void shouldReadLocaleFromContext() {
        LocaleContextHolder.setLocale(Locale.FRENCH);

        assertThat(activeLanguage.currentLanguage()).isEqualTo("fr");
    }

    @Test
    @DisplayName("Should lower-case regional locales into language codes")
    void shouldLowerCaseRegionalLocale() {
        LocaleContextHolder.setLocale(Locale.CANADA_FRENCH);

        assertThat(activeLanguage.currentLanguage()).isEqualTo("fr-ca");
    }

    @Test
    @DisplayName("Should use the fallback language for the root locale")
    void shouldFallBackForRootLocale() {
        LocaleContextHolder.setLocale(Locale.ROOT);

        assertThat(activeLanguage.currentLanguage()).isEqualTo("fr");
    }

    @Test
    void toLanguageCode_null_returnsNull() {
        assertThat(LocaleContextActiveLanguage.toLanguageCode(null)).isNull();
    }
}
