package dev.catananti.transfield.schema;

/**
 * One allowed value of a field with its display label.
 */
public record Choice(Object value, String label) {

    public static Choice of(Object value) {
        return new Choice(value, String.valueOf(value));
    }
}
