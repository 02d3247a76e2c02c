package dev.catananti.transfield.schema;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Declaration of a model field: value type, constraints and display label.
 * <p>
 * Fields produced by expanding a translatable field carry the name of the
 * logical field they came from in {@link #getOriginalFieldName()}.
 * </p>
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FieldDefinition {

    /** Marks a field declared without a default value. */
    public static final Object NOT_PROVIDED = new Object() {
        @Override
        public String toString() {
            return "NOT_PROVIDED";
        }
    };

    @Builder.Default
    private final Class<?> type = String.class;

    private final Integer maxLength;

    @Builder.Default
    private final List<Choice> choices = new ArrayList<>();

    @Builder.Default
    private final List<FieldValidator> validators = new ArrayList<>();

    @Builder.Default
    private final Object defaultValue = NOT_PROVIDED;

    private final String label;

    private final boolean nullable;

    /** {@code true} when the field may be left empty, i.e. it is not required. */
    private final boolean blank;

    @Builder.Default
    private final Map<String, Object> constraints = new LinkedHashMap<>();

    private final String originalFieldName;

    /** Language code of a per-language field, {@code null} on ordinary fields. */
    private final String language;

    public boolean hasDefault() {
        return defaultValue != NOT_PROVIDED;
    }

    public boolean isRequired() {
        return !blank;
    }

    /**
     * Deep copy: choices, validators, default value and constraints of the copy
     * can be mutated without affecting this definition.
     */
    public FieldDefinition copy() {
        return toBuilder()
                .choices(choices.stream()
                        .map(choice -> new Choice(DeepCopy.of(choice.value()), choice.label()))
                        .collect(Collectors.toCollection(ArrayList::new)))
                .validators(new ArrayList<>(validators))
                .defaultValue(DeepCopy.of(defaultValue))
                .constraints(DeepCopy.ofMap(constraints))
                .build();
    }

    /**
     * Read-only variant held by a built schema: choices, validators and
     * constraints cannot be modified. {@link #copy()} of it is mutable again.
     */
    FieldDefinition frozen() {
        FieldDefinition copy = copy();
        return copy.toBuilder()
                .choices(Collections.unmodifiableList(copy.choices))
                .validators(Collections.unmodifiableList(copy.validators))
                .constraints(Collections.unmodifiableMap(copy.constraints))
                .build();
    }

    /**
     * A copy of the declared default, so callers cannot alter it in place.
     */
    public Object getDefaultValue() {
        return DeepCopy.of(defaultValue);
    }

    /**
     * A fresh copy of the default value for a new instance, or {@code null}.
     */
    public Object initialValue() {
        return hasDefault() ? DeepCopy.of(defaultValue) : null;
    }

    /**
     * Check a value against this declaration.
     *
     * @return error messages, empty when the value is acceptable
     */
    public List<String> validate(Object value) {
        List<String> errors = new ArrayList<>();
        if (value == null) {
            if (!nullable) {
                errors.add("This field cannot be null.");
            }
            return errors;
        }
        if (EmptyValues.isEmpty(value)) {
            if (!blank) {
                errors.add("This field cannot be blank.");
            }
            return errors;
        }
        if (!type.isInstance(value)) {
            errors.add("Expected a value of type " + type.getSimpleName() + ".");
            return errors;
        }
        if (maxLength != null && value instanceof CharSequence text && text.length() > maxLength) {
            errors.add("Ensure this value has at most " + maxLength + " characters (it has " + text.length() + ").");
        }
        if (!choices.isEmpty() && choices.stream().noneMatch(choice -> value.equals(choice.value()))) {
            errors.add("Value " + value + " is not a valid choice.");
        }
        for (FieldValidator validator : validators) {
            Optional<String> error = validator.validate(value);
            error.ifPresent(errors::add);
        }
        return errors;
    }
}
