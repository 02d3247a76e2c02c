package dev.catananti.transfield.exception;

/**
 * Raised when the translatable-field marker names something that is not a field
 * declared by the model itself.
 */
public class FieldNotFoundException extends TranslationSchemaException {

    private final String fieldName;

    public FieldNotFoundException(String modelName, String fieldName) {
        super(modelName, String.format(
                "There is no field %s in model %s, as specified in its translatable fields", fieldName, modelName));
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
