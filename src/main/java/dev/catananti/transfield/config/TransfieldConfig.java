package dev.catananti.transfield.config;

import dev.catananti.transfield.language.ActiveLanguage;
import dev.catananti.transfield.language.LocaleContextActiveLanguage;
import dev.catananti.transfield.schema.AccessorGenerator;
import dev.catananti.transfield.schema.FieldMultiplier;
import dev.catananti.transfield.schema.ModelSchemaFactory;
import dev.catananti.transfield.schema.TranslatableFieldRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Wires the translatable-field machinery from application properties.
 *
 * <p>Properties:</p>
 * <ul>
 *   <li>{@code transfield.languages}: comma-separated {@code code:label} entries, e.g. {@code en:English,fr:Français}</li>
 *   <li>{@code transfield.fallback-language}: language whose fields keep their declared constraints</li>
 *   <li>{@code transfield.translate-labels}: append the language code to field labels</li>
 *   <li>{@code transfield.strict-assignment}: fail instead of discarding unassignable writes</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class TransfieldConfig {

    @Value("${transfield.languages:en:English}")
    private String languages;

    @Value("${transfield.fallback-language:en}")
    private String fallbackLanguage;

    @Value("${transfield.translate-labels:true}")
    private boolean translateLabels;

    @Value("${transfield.strict-assignment:false}")
    private boolean strictAssignment;

    @Bean
    @ConditionalOnMissingBean
    public LanguageSettings languageSettings() {
        LanguageSettings settings = new LanguageSettings(
                parseLanguages(languages), fallbackLanguage, translateLabels, strictAssignment);
        log.info("Translatable fields configured for languages {} (fallback: {})",
                settings.getLanguageCodes(), settings.getFallbackLanguage());
        return settings;
    }

    @Bean
    @ConditionalOnMissingBean
    public ActiveLanguage activeLanguage(LanguageSettings languageSettings) {
        return new LocaleContextActiveLanguage(languageSettings);
    }

    @Bean
    public TranslatableFieldRegistry translatableFieldRegistry() {
        return new TranslatableFieldRegistry();
    }

    @Bean
    public FieldMultiplier fieldMultiplier() {
        return new FieldMultiplier();
    }

    @Bean
    public AccessorGenerator accessorGenerator(LanguageSettings languageSettings, ActiveLanguage activeLanguage) {
        return new AccessorGenerator(languageSettings, activeLanguage);
    }

    @Bean
    public ModelSchemaFactory modelSchemaFactory(LanguageSettings languageSettings,
                                                 TranslatableFieldRegistry translatableFieldRegistry,
                                                 FieldMultiplier fieldMultiplier,
                                                 AccessorGenerator accessorGenerator) {
        return new ModelSchemaFactory(languageSettings, translatableFieldRegistry, fieldMultiplier, accessorGenerator);
    }

    static List<Language> parseLanguages(String value) {
        List<Language> parsed = new ArrayList<>();
        for (String entry : value.split(",")) {
            if (!entry.isBlank()) {
                parsed.add(Language.parse(entry.trim()));
            }
        }
        return parsed;
    }
}
