package dev.catananti.transfield.exception;

/**
 * Raised at declaration time when the translatable-field marker or the language
 * configuration is malformed. Aborts schema construction.
 */
public class TranslationConfigException extends TranslationSchemaException {

    public TranslationConfigException(String modelName, String message) {
        super(modelName, message);
    }
}
