package dev.catananti.transfield.schema;

import java.util.Optional;

/**
 * Extra check attached to a field; returns an error message when the value is rejected.
 */
@FunctionalInterface
public interface FieldValidator {

    Optional<String> validate(Object value);
}
