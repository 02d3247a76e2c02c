package dev.catananti.transfield.schema;

import dev.catananti.transfield.exception.FieldNotFoundException;
import dev.catananti.transfield.exception.TranslationConfigException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;

/**
 * Validates the translatable-field marker of a declaration and collects the
 * translatable names a model inherits from its abstract ancestors.
 */
@Slf4j
public class TranslatableFieldRegistry {

    /**
     * Validate the marker against the declaration's own fields.
     *
     * @return the translatable names in declaration order
     * @throws TranslationConfigException when the marker is not an ordered collection of unique names
     * @throws FieldNotFoundException     when a name is not a field declared by the model itself
     */
    public List<String> registerTranslatable(ModelDeclaration declaration, Collection<String> fieldNames) {
        String modelName = declaration.getName();
        if (fieldNames == null) {
            throw new TranslationConfigException(modelName, "Translatable fields of " + modelName + " must not be null");
        }
        if (!(fieldNames instanceof List || fieldNames instanceof LinkedHashSet || fieldNames instanceof SortedSet)) {
            throw new TranslationConfigException(modelName,
                    "Translatable fields of " + modelName + " must be an ordered collection, got "
                            + fieldNames.getClass().getSimpleName());
        }
        Set<String> seen = new HashSet<>();
        for (String fieldName : fieldNames) {
            if (fieldName == null || fieldName.isBlank()) {
                throw new TranslationConfigException(modelName,
                        "Translatable fields of " + modelName + " contain a blank name");
            }
            if (!seen.add(fieldName)) {
                throw new TranslationConfigException(modelName,
                        "Translatable fields of " + modelName + " name '" + fieldName + "' more than once");
            }
        }
        for (String fieldName : fieldNames) {
            if (!(declaration.getAttributes().get(fieldName) instanceof FieldDefinition)) {
                throw new FieldNotFoundException(modelName, fieldName);
            }
        }
        log.debug("Registered translatable fields {} for {}", fieldNames, modelName);
        return List.copyOf(fieldNames);
    }

    /**
     * Union of the translatable names held by the declaration's abstract parents.
     */
    public Set<String> mergeInherited(ModelDeclaration declaration) {
        Set<String> inherited = new LinkedHashSet<>();
        for (ModelSchema parent : declaration.getParents()) {
            if (parent.isAbstractModel()) {
                inherited.addAll(parent.getTranslatableFields());
            }
        }
        return Collections.unmodifiableSet(inherited);
    }

    /**
     * Own translatable names plus inherited ones.
     */
    public Set<String> allTranslatableFields(ModelDeclaration declaration) {
        Set<String> all = new LinkedHashSet<>();
        if (declaration.getTranslate() != null) {
            all.addAll(registerTranslatable(declaration, declaration.getTranslate()));
        }
        all.addAll(mergeInherited(declaration));
        return Collections.unmodifiableSet(all);
    }
}
