package smart.organizer.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import smart.organizer.app.OrganizerFixtures;
import smart.organizer.app.service.FallbackClassificationService;
import smart.organizer.app.service.MessageClassificationService;
import smart.organizer.app.service.RuleBasedClassificationService;

import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

class ClassifierConfigTest {

    private final ClassifierConfig config = new ClassifierConfig();
    private final Executor directExecutor = Runnable::run;

    private OrganizerProperties properties;
    private RuleBasedClassificationService rules;

    @BeforeEach
    void setUp() {
        properties = OrganizerFixtures.properties();
        rules = config.ruleBasedClassificationService(properties);
    }

    private MessageClassificationService build() {
        return config.messageClassificationService(properties, rules, directExecutor,
                new RestTemplateBuilder(), new ObjectMapper());
    }

    @Test
    void messageClassificationService_ModelDisabled_ShouldUseRules() {
        // Given
        properties.getModel().setEnabled(false);

        // When / Then
        assertSame(rules, build());
    }

    @Test
    void messageClassificationService_OpenAiWithoutKey_ShouldUseRules() {
        // Given
        properties.getModel().setEnabled(true);
        properties.getModel().setProvider("openai");
        properties.getModel().setOpenaiApiKey("");

        // When / Then
        assertSame(rules, build());
    }

    @Test
    void messageClassificationService_OpenAiWithKey_ShouldWrapModelInFallback() {
        // Given
        properties.getModel().setEnabled(true);
        properties.getModel().setProvider("openai");
        properties.getModel().setOpenaiApiKey("sk-test");

        // When
        MessageClassificationService service = build();

        // Then
        assertInstanceOf(FallbackClassificationService.class, service);
        assertEquals("openai:gpt-3.5-turbo (fallback: rule-based)", service.name());
    }

    @Test
    void messageClassificationService_GeminiWithKey_ShouldWrapModelInFallback() {
        // Given
        properties.getModel().setEnabled(true);
        properties.getModel().setProvider("Gemini");
        properties.getModel().setName("gemini-pro");
        properties.getModel().setGeminiApiKey("g-test");

        // When
        MessageClassificationService service = build();

        // Then
        assertEquals("gemini:gemini-pro (fallback: rule-based)", service.name());
    }

    @Test
    void messageClassificationService_GeminiWithoutModelName_ShouldUseGeminiDefault() {
        // Given
        properties.getModel().setEnabled(true);
        properties.getModel().setProvider("gemini");
        properties.getModel().setName("");
        properties.getModel().setGeminiApiKey("g-test");

        // When
        MessageClassificationService service = build();

        // Then
        assertEquals("gemini:gemini-pro (fallback: rule-based)", service.name());
    }

    @Test
    void resolvedName_ExplicitName_ShouldWinOverProviderDefault() {
        // Given
        properties.getModel().setProvider("gemini");
        properties.getModel().setName(" gemini-1.5-flash ");

        // When / Then
        assertEquals("gemini-1.5-flash", properties.getModel().resolvedName());
        properties.getModel().setProvider("openai");
        properties.getModel().setName(null);
        assertEquals("gpt-3.5-turbo", properties.getModel().resolvedName());
    }

    @Test
    void messageClassificationService_UnknownProvider_ShouldUseRules() {
        // Given
        properties.getModel().setEnabled(true);
        properties.getModel().setProvider("local-llm");

        // When / Then
        assertSame(rules, build());
    }
}
