package dev.catananti.transfield.schema;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Set;

/**
 * Copies collection-shaped values (lists, sets, maps, arrays) recursively.
 * <p>
 * Cloneable collections keep their implementation, so a {@code LinkedList}
 * stays a {@code LinkedList} and a {@code TreeSet} keeps its comparator.
 * Other collections, e.g. {@code List.of(...)}, are rebuilt as
 * {@code ArrayList}, {@code LinkedHashSet} or {@code LinkedHashMap}.
 * Anything else is returned as-is and is expected to be immutable.
 * </p>
 */
final class DeepCopy {

    private DeepCopy() {}

    @SuppressWarnings("unchecked")
    static Object of(Object value) {
        if (value instanceof List<?> list) {
            List<Object> copy = (List<Object>) cloneOf(list);
            if (copy == null) {
                copy = new ArrayList<>(list.size());
                for (Object element : list) {
                    copy.add(of(element));
                }
                return copy;
            }
            ListIterator<Object> elements = copy.listIterator();
            while (elements.hasNext()) {
                elements.set(of(elements.next()));
            }
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            Collection<Object> copy = (Collection<Object>) cloneOf(collection);
            if (copy == null) {
                copy = collection instanceof Set ? new LinkedHashSet<>() : new ArrayList<>(collection.size());
            } else {
                copy.clear();
            }
            for (Object element : collection) {
                copy.add(of(element));
            }
            return copy;
        }
        if (value instanceof Map<?, ?> map) {
            return ofMap(map);
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            Object copy = Array.newInstance(value.getClass().getComponentType(), length);
            for (int i = 0; i < length; i++) {
                Array.set(copy, i, of(Array.get(value, i)));
            }
            return copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    static <K> Map<K, Object> ofMap(Map<K, ?> map) {
        Map<K, Object> copy = (Map<K, Object>) cloneOf(map);
        if (copy == null) {
            copy = new LinkedHashMap<>();
            for (Map.Entry<K, ?> entry : map.entrySet()) {
                copy.put(entry.getKey(), of(entry.getValue()));
            }
            return copy;
        }
        copy.replaceAll((key, element) -> of(element));
        return copy;
    }

    /**
     * Shallow clone through the public {@code clone()} of JDK collections,
     * or {@code null} when the value offers none.
     */
    private static Object cloneOf(Object value) {
        if (!(value instanceof Cloneable)) {
            return null;
        }
        try {
            return value.getClass().getMethod("clone").invoke(value);
        } catch (ReflectiveOperationException e) {
            // not publicly cloneable; the caller rebuilds a standard collection
            return null;
        }
    }
}
