package dev.catananti.transfield.model;

import dev.catananti.transfield.config.LanguageSettings;
import dev.catananti.transfield.exception.UnassignableValueException;
import dev.catananti.transfield.schema.AccessorGenerator;
import dev.catananti.transfield.schema.FieldDefinition;
import dev.catananti.transfield.schema.FieldMultiplier;
import dev.catananti.transfield.schema.ModelDeclaration;
import dev.catananti.transfield.schema.ModelSchema;
import dev.catananti.transfield.schema.ModelSchemaFactory;
import dev.catananti.transfield.schema.TranslatableFieldRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ModelInstance Tests")
class ModelInstanceTest {

    private final AtomicReference<String> currentLanguage = new AtomicReference<>("en");

    private ModelSchema schema(boolean strict) {
        LanguageSettings settings = new LanguageSettings(
                LanguageSettings.of("en", "en", "fr").getLanguages(), "en", true, strict);
        ModelSchemaFactory factory = new ModelSchemaFactory(settings, new TranslatableFieldRegistry(),
                new FieldMultiplier(), new AccessorGenerator(settings, currentLanguage::get));
        return factory.create(ModelDeclaration.builder()
                .name("Article")
                .field("title", FieldDefinition.builder().maxLength(20).label("Title").build())
                .field("tags", FieldDefinition.builder().type(List.class).blank(true).defaultValue(new ArrayList<String>()).build())
                .field("default_lang", FieldDefinition.builder().maxLength(5).nullable(true).blank(true).build())
                .translatable("title")
                .defaultLanguageField("default_lang")
                .build());
    }

    private final ModelSchema article = schema(false);

    @Nested
    @DisplayName("get/set through the canonical name")
    class CanonicalAccess {

        @Test
        @DisplayName("should round-trip a value in the active language")
        void roundTrip() {
            ModelInstance record = new ModelInstance(article);

            record.set("title", "Hello");

            assertThat(record.get("title")).isEqualTo("Hello");
            assertThat(record.get("title", "en")).isEqualTo("Hello");
        }

        @Test
        @DisplayName("should follow the active language as it changes")
        void switchesWithActiveLanguage() {
            ModelInstance record = new ModelInstance(article);
            record.set("title", "Hello");
            currentLanguage.set("fr");
            record.set("title", "Bonjour");

            assertThat(record.get("title")).isEqualTo("Bonjour");
            currentLanguage.set("en-gb");
            assertThat(record.get("title")).isEqualTo("Hello");
            currentLanguage.set("es");
            assertThat(record.get("title")).isEqualTo("Hello");
        }

        @Test
        void unsetValueReadsAsNull() {
            currentLanguage.set("es");

            assertThat(new ModelInstance(article).get("title")).isNull();
        }

        @Test
        @DisplayName("should discard a value with no target when not strict")
        void silentDiscard() {
            currentLanguage.set("es");
            ModelInstance record = new ModelInstance(article);
            record.set("default_lang", "de");

            record.set("title", "Hallo");

            assertThat(record.get("title", "en")).isNull();
            assertThat(record.get("title", "fr")).isNull();
        }

        @Test
        @DisplayName("should fail a value with no target when strict")
        void strictAssignment() {
            currentLanguage.set("es");
            ModelInstance record = new ModelInstance(schema(true));
            record.set("default_lang", "de");

            assertThatThrownBy(() -> record.set("title", "Hallo"))
                    .isInstanceOf(UnassignableValueException.class)
                    .hasMessageContaining("Article.title")
                    .hasFieldOrPropertyWithValue("languageChain", List.of("es", "de"));
        }
    }

    @Nested
    @DisplayName("stored fields")
    class StoredFields {

        @Test
        @DisplayName("should give every record its own copy of a mutable default")
        @SuppressWarnings("unchecked")
        void defaultsAreNotShared() {
            ModelInstance first = new ModelInstance(article);
            ModelInstance second = new ModelInstance(article);

            ((List<String>) first.get("tags")).add("java");

            assertThat((List<String>) second.get("tags")).isEmpty();
        }

        @Test
        void unknownFieldIsRejected() {
            ModelInstance record = new ModelInstance(article);

            assertThatThrownBy(() -> record.get("subtitle")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> record.set("subtitle", "x")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> record.get("title", "es")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> record.get("tags", "en")).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void languageVariantIsCaseInsensitive() {
            ModelInstance record = new ModelInstance(article);

            record.set("title", "FR", "Bonjour");

            assertThat(record.getValues()).containsEntry("title_fr", "Bonjour");
        }

        @Test
        void abstractSchemaCannotBeInstantiated() {
            LanguageSettings settings = LanguageSettings.of("en", "en");
            ModelSchema base = new ModelSchemaFactory(settings, new TranslatableFieldRegistry(), new FieldMultiplier(),
                    new AccessorGenerator(settings, () -> "en"))
                    .create(ModelDeclaration.builder().name("Base").abstractModel(true).build());

            assertThatThrownBy(() -> new ModelInstance(base))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Abstract model Base");
        }
    }

    @Nested
    @DisplayName("translations")
    class Translations {

        @Test
        void collectsNonEmptyValues() {
            ModelInstance record = new ModelInstance(article);
            record.set("title", "en", "Hello");
            record.set("title", "fr", "");

            assertThat(record.translations("title")).containsExactly(Map.entry("en", "Hello"));
        }

        @Test
        @DisplayName("should write translations as a JSON object in configured order")
        void translationsJson() {
            ModelInstance record = new ModelInstance(article);
            record.set("title", "fr", "Bonjour");
            record.set("title", "en", "Hello");

            assertThat(record.translationsJson("title")).isEqualTo("{\"en\":\"Hello\",\"fr\":\"Bonjour\"}");
        }

        @Test
        @DisplayName("should apply stored languages and skip the others")
        void appliesKnownLanguages() {
            ModelInstance record = new ModelInstance(article);

            record.applyTranslationsJson("title", "{\"EN\":\"Hello\",\"fr\":\"Bonjour\",\"de\":\"Hallo\"}");

            assertThat(record.get("title", "en")).isEqualTo("Hello");
            assertThat(record.get("title", "fr")).isEqualTo("Bonjour");
            assertThat(record.getValues()).doesNotContainKey("title_de");
        }

        @Test
        void copiesTranslationsBetweenRecords() {
            ModelInstance source = new ModelInstance(article);
            source.set("title", "en", "Hello");
            source.set("title", "fr", "Bonjour");
            ModelInstance target = new ModelInstance(article);

            target.applyTranslations("title", source.translations("title"));

            assertThat(target.translations("title")).isEqualTo(source.translations("title"));
        }

        @Test
        void rejectsMalformedJson() {
            ModelInstance record = new ModelInstance(article);

            assertThatThrownBy(() -> record.applyTranslationsJson("title", "Just text"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Article.title");
        }

        @Test
        void rejectsNonTranslatableField() {
            ModelInstance record = new ModelInstance(article);

            assertThatThrownBy(() -> record.translations("tags"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("not a translatable field");
        }
    }

    @Test
    @DisplayName("Should require only the fallback language on validation")
    void validateRequiresOnlyFallback() {
        ModelInstance record = new ModelInstance(article);

        Map<String, List<String>> errors = record.validate();

        assertThat(errors).containsOnlyKeys("title_en");

        record.set("title", "en", "Hello");
        assertThat(record.validate()).isEmpty();

        record.set("title", "fr", "Un titre beaucoup trop long");
        assertThat(record.validate()).containsOnlyKeys("title_fr");
    }
}
