package dev.catananti.transfield.exception;

/**
 * Base type for every error raised while declaring or using translatable fields.
 */
public class TranslationSchemaException extends RuntimeException {

    private final String modelName;

    public TranslationSchemaException(String modelName, String message) {
        super(message);
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
