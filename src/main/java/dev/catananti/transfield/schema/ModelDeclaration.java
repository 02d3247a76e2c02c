package dev.catananti.transfield.schema;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Declaration phase of a model type: what the author wrote, before translatable
 * fields are expanded into one field per language.
 * <p>
 * Attributes keep declaration order. Only {@link FieldDefinition} values are
 * fields; anything else (constants, helpers) is carried along but never stored.
 * </p>
 *
 * <pre>{@code
 * ModelDeclaration.builder()
 *         .name("Article")
 *         .field("title", FieldDefinition.builder().maxLength(200).label("Title").build())
 *         .field("slug", FieldDefinition.builder().maxLength(80).build())
 *         .translatable("title")
 *         .build();
 * }</pre>
 */
@Getter
@Builder
public class ModelDeclaration {

    private final String name;

    private final boolean abstractModel;

    @Singular
    private final Map<String, Object> attributes;

    /** Names of the translatable fields; {@code null} when the model declares none of its own. */
    private final Collection<String> translate;

    /** Overrides the configured label translation when set. */
    private final Boolean translateLabels;

    /** Field holding a per-record default language. */
    private final String defaultLanguageField;

    @Singular
    private final List<ModelSchema> parents;

    public static class ModelDeclarationBuilder {

        public ModelDeclarationBuilder field(String fieldName, FieldDefinition definition) {
            return attribute(fieldName, definition);
        }

        public ModelDeclarationBuilder translatable(String... fieldNames) {
            return translate(List.of(fieldNames));
        }
    }
}
