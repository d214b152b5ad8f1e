package smart.organizer.app.service;

import com.theokanning.openai.OpenAiHttpException;
import com.theokanning.openai.completion.chat.ChatCompletionChoice;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatCompletionResult;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import lombok.extern.slf4j.Slf4j;
import smart.organizer.app.entity.Category;
import smart.organizer.app.entity.Message;

import java.util.List;

/**
 * Zero-shot classification through the OpenAI chat completion API.
 * Any provider error surfaces as {@link ClassifierUnavailableException}.
 */
@Slf4j
public class OpenAiClassificationService implements MessageClassificationService {
    private final OpenAiService openAiService;
    private final String modelName;

    public OpenAiClassificationService(OpenAiService openAiService, String modelName) {
        this.openAiService = openAiService;
        this.modelName = modelName;
    }

    @Override
    public Category classify(Message message) {
        ChatCompletionResult result;
        try {
            ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(modelName)
                .messages(List.of(new ChatMessage("user", ZeroShotPrompt.build(message))))
                .maxTokens(10)
                .temperature(0.0)
                .build();

            result = openAiService.createChatCompletion(request);
        } catch (OpenAiHttpException e) {
            throw new ClassifierUnavailableException(
                "OpenAI rejected classification of message " + message.getId() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ClassifierUnavailableException(
                "OpenAI call failed for message " + message.getId() + ": " + e.getMessage(), e);
        }

        Category category = ZeroShotPrompt.toCategory(firstAnswer(result));
        log.debug("OpenAI classified message {} as '{}'", message.getId(), category);
        return category;
    }

    @Override
    public String name() {
        return "openai:" + modelName;
    }

    private static String firstAnswer(ChatCompletionResult result) {
        if (result == null || result.getChoices() == null || result.getChoices().isEmpty()) {
            throw new ClassifierUnavailableException("OpenAI returned no choices");
        }
        ChatCompletionChoice choice = result.getChoices().get(0);
        if (choice.getMessage() == null) {
            throw new ClassifierUnavailableException("OpenAI returned an empty choice");
        }
        return choice.getMessage().getContent();
    }
}
