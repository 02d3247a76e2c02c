package dev.catananti.transfield.config;

import java.util.Locale;
import java.util.Objects;

/**
 * A supported language: its code (e.g. {@code en}, {@code pt-br}) and a display label.
 */
public record Language(String code, String label) {

    public Language {
        Objects.requireNonNull(code, "code");
        code = code.trim().toLowerCase(Locale.ROOT);
        if (code.isEmpty()) {
            throw new IllegalArgumentException("Language code must not be blank");
        }
        label = label == null || label.isBlank() ? code : label.trim();
    }

    public static Language of(String code) {
        return new Language(code, null);
    }

    /**
     * Parse a {@code code:label} entry; the label is optional.
     */
    public static Language parse(String entry) {
        int separator = entry.indexOf(':');
        if (separator < 0) {
            return of(entry);
        }
        return new Language(entry.substring(0, separator), entry.substring(separator + 1));
    }
}
