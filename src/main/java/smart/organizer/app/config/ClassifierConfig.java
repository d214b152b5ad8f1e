package smart.organizer.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.theokanning.openai.service.OpenAiService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.RestTemplate;
import smart.organizer.app.service.FallbackClassificationService;
import smart.organizer.app.service.GeminiClassificationService;
import smart.organizer.app.service.MessageClassificationService;
import smart.organizer.app.service.OpenAiClassificationService;
import smart.organizer.app.service.RuleBasedClassificationService;

import java.util.Locale;
import java.util.concurrent.Executor;

/**
 * Chooses the classification strategy at startup.
 * Set organizer.model.enabled=true and organizer.model.provider=openai|gemini to put a model
 * in front of the keyword rules; otherwise the rules run alone.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(OrganizerProperties.class)
public class ClassifierConfig {

    @Bean
    public RuleBasedClassificationService ruleBasedClassificationService(OrganizerProperties properties) {
        return new RuleBasedClassificationService(properties.getClassifier());
    }

    @Bean
    @Primary
    public MessageClassificationService messageClassificationService(
            OrganizerProperties properties,
            RuleBasedClassificationService rules,
            @Qualifier("modelInferenceExecutor") Executor modelInferenceExecutor,
            RestTemplateBuilder restTemplateBuilder,
            ObjectMapper objectMapper) {
        OrganizerProperties.Model model = properties.getModel();
        if (!model.isEnabled()) {
            log.info("Model classification disabled, using {}", rules.name());
            return rules;
        }

        MessageClassificationService modelService = createModelService(model, restTemplateBuilder, objectMapper);
        if (modelService == null) {
            return rules;
        }

        log.info("Using {} with {} fallback (timeout {}ms, max {} model messages per batch)",
                modelService.name(), rules.name(), model.getTimeout().toMillis(), model.getMaxMessagesPerBatch());
        return new FallbackClassificationService(modelService, rules, modelInferenceExecutor,
                model.getTimeout(), model.getMaxMessagesPerBatch(), model.isDisableAfterFailure());
    }

    private MessageClassificationService createModelService(OrganizerProperties.Model model,
                                                            RestTemplateBuilder restTemplateBuilder,
                                                            ObjectMapper objectMapper) {
        String provider = model.getProvider() == null ? "" : model.getProvider().trim().toLowerCase(Locale.ROOT);
        switch (provider) {
            case "openai":
                if (isBlankKey(model.getOpenaiApiKey())) {
                    log.warn("OpenAI API key not configured, falling back to rule-based classification");
                    return null;
                }
                OpenAiService openAiService = new OpenAiService(model.getOpenaiApiKey(), model.getTimeout());
                return new OpenAiClassificationService(openAiService, model.resolvedName());
            case "gemini":
                if (isBlankKey(model.getGeminiApiKey())) {
                    log.warn("Gemini API key not configured, falling back to rule-based classification");
                    return null;
                }
                RestTemplate restTemplate = restTemplateBuilder
                        .setConnectTimeout(model.getTimeout())
                        .setReadTimeout(model.getTimeout())
                        .build();
                return new GeminiClassificationService(restTemplate, objectMapper,
                        model.getGeminiApiKey(), model.resolvedName());
            default:
                log.warn("Unknown model provider '{}', falling back to rule-based classification", model.getProvider());
                return null;
        }
    }

    private static boolean isBlankKey(String key) {
        return key == null || key.isBlank() || key.startsWith("${");
    }
}
