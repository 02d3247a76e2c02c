package dev.catananti.transfield.exception;

import java.util.List;

/**
 * Thrown by strict schemas when a write through a canonical name finds no
 * concrete field anywhere in the language chain.
 */
public class UnassignableValueException extends TranslationSchemaException {

    private final String fieldName;
    private final List<String> languageChain;

    public UnassignableValueException(String modelName, String fieldName, List<String> languageChain) {
        super(modelName, String.format(
                "No concrete field of %s.%s matches any of the languages %s", modelName, fieldName, languageChain));
        this.fieldName = fieldName;
        this.languageChain = List.copyOf(languageChain);
    }

    public String getFieldName() {
        return fieldName;
    }

    public List<String> getLanguageChain() {
        return languageChain;
    }
}
