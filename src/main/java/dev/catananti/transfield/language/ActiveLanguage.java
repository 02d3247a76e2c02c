package dev.catananti.transfield.language;

/**
 * Supplies the language code active for the calling context.
 */
@FunctionalInterface
public interface ActiveLanguage {

    String currentLanguage();
}
