package dev.catananti.transfield.schema;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;

/**
 * What counts as "no value" when resolving a translation.
 */
public final class EmptyValues {

    private EmptyValues() {}

    public static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.length() == 0;
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return value.getClass().isArray() && Array.getLength(value) == 0;
    }
}
