package dev.catananti.transfield.schema;

import dev.catananti.transfield.config.LanguageSettings;
import dev.catananti.transfield.exception.TranslationConfigException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a {@link ModelDeclaration} into a {@link ModelSchema}: translatable
 * fields are replaced by one field per configured language plus an accessor
 * under the original name, and everything declared by abstract parents is
 * inherited.
 * <p>
 * Construction either succeeds completely or throws; no partially built
 * schema is ever returned.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class ModelSchemaFactory {

    private final LanguageSettings settings;
    private final TranslatableFieldRegistry registry;
    private final FieldMultiplier multiplier;
    private final AccessorGenerator accessorGenerator;

    public ModelSchema create(ModelDeclaration declaration) {
        String modelName = declaration.getName();
        if (modelName == null || modelName.isBlank()) {
            throw new TranslationConfigException(modelName, "Model name must not be blank");
        }

        Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        Map<String, TranslatedFieldAccessor> accessors = new LinkedHashMap<>();
        String inheritedDefaultLanguageField = null;
        for (ModelSchema parent : declaration.getParents()) {
            if (!parent.isAbstractModel()) {
                throw new TranslationConfigException(modelName,
                        "Model " + modelName + " can only extend abstract models, " + parent.getName() + " is not abstract");
            }
            // the same ancestor may be reached through several parents
            parent.getFields().forEach((fieldName, field) -> fields.putIfAbsent(fieldName, field.copy()));
            parent.getAccessors().forEach(accessors::putIfAbsent);
            if (inheritedDefaultLanguageField == null) {
                inheritedDefaultLanguageField = parent.getDefaultLanguageField().orElse(null);
            }
        }

        Set<String> translatableFields = new LinkedHashSet<>(registry.mergeInherited(declaration));
        List<String> ownTranslatable = declaration.getTranslate() == null
                ? List.of()
                : registry.registerTranslatable(declaration, declaration.getTranslate());
        boolean translateLabels = declaration.getTranslateLabels() != null
                ? declaration.getTranslateLabels()
                : settings.isTranslateLabels();

        for (Map.Entry<String, Object> attribute : declaration.getAttributes().entrySet()) {
            if (!(attribute.getValue() instanceof FieldDefinition definition)) {
                continue;
            }
            String fieldName = attribute.getKey();
            if (ownTranslatable.contains(fieldName)) {
                claim(modelName, fieldName, fields, accessors);
                accessors.put(fieldName, accessorGenerator.generate(fieldName));
                multiplier.multiply(definition, fieldName, settings, translateLabels).forEach((concreteName, field) -> {
                    claim(modelName, concreteName, fields, accessors);
                    fields.put(concreteName, field);
                });
            } else {
                claim(modelName, fieldName, fields, accessors);
                fields.put(fieldName, definition.copy());
            }
        }
        translatableFields.addAll(ownTranslatable);

        String defaultLanguageField = resolveDefaultLanguageField(
                declaration, inheritedDefaultLanguageField, fields);

        log.debug("Built schema {} with fields {} and translatable fields {}",
                modelName, fields.keySet(), translatableFields);
        return new ModelSchema(modelName, declaration.isAbstractModel(), fields, translatableFields,
                accessors, defaultLanguageField, settings.isStrictAssignment());
    }

    private void claim(String modelName, String fieldName,
                       Map<String, FieldDefinition> fields, Map<String, TranslatedFieldAccessor> accessors) {
        if (fields.containsKey(fieldName) || accessors.containsKey(fieldName)) {
            throw new TranslationConfigException(modelName,
                    "Field " + fieldName + " of model " + modelName + " clashes with a field of the same name");
        }
    }

    private String resolveDefaultLanguageField(ModelDeclaration declaration, String inherited,
                                               Map<String, FieldDefinition> fields) {
        String declared = declaration.getDefaultLanguageField();
        if (declared == null) {
            return inherited;
        }
        if (!fields.containsKey(declared)) {
            log.debug("Ignoring default language field {} of {}: no such stored field",
                    declared, declaration.getName());
            return null;
        }
        return declared;
    }
}
