package smart.organizer.app.service;

import com.theokanning.openai.completion.chat.ChatCompletionChoice;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatCompletionResult;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import smart.organizer.app.entity.Category;
import smart.organizer.app.entity.Message;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static smart.organizer.app.OrganizerFixtures.message;

@ExtendWith(MockitoExtension.class)
class OpenAiClassificationServiceTest {

    @Mock
    private OpenAiService openAiService;

    private OpenAiClassificationService service;
    private Message msg;

    @BeforeEach
    void setUp() {
        service = new OpenAiClassificationService(openAiService, "gpt-3.5-turbo");
        msg = message("42", "Can we meet Friday?", "alice@corp.com", "Let me know what works.");
    }

    private static ChatCompletionResult answer(String content) {
        ChatCompletionChoice choice = new ChatCompletionChoice();
        choice.setMessage(new ChatMessage("assistant", content));
        ChatCompletionResult result = new ChatCompletionResult();
        result.setChoices(List.of(choice));
        return result;
    }

    @Test
    void classify_WithLabelAnswer_ShouldMapToCategory() {
        // Given
        when(openAiService.createChatCompletion(any(ChatCompletionRequest.class))).thenReturn(answer("needs_reply"));

        // When
        Category category = service.classify(msg);

        // Then
        assertEquals(Category.NEEDS_REPLY, category);
    }

    @Test
    void classify_WithDecoratedAnswer_ShouldStillMap() {
        // Given
        when(openAiService.createChatCompletion(any(ChatCompletionRequest.class))).thenReturn(answer(" \"Needs Reply.\"\n"));

        // When
        Category category = service.classify(msg);

        // Then
        assertEquals(Category.NEEDS_REPLY, category);
    }

    @Test
    void classify_ShouldSendMessageDetailsInPrompt() {
        // Given
        ArgumentCaptor<ChatCompletionRequest> captor = ArgumentCaptor.forClass(ChatCompletionRequest.class);
        when(openAiService.createChatCompletion(captor.capture())).thenReturn(answer("ignore"));

        // When
        service.classify(msg);

        // Then
        ChatCompletionRequest request = captor.getValue();
        assertEquals("gpt-3.5-turbo", request.getModel());
        String prompt = request.getMessages().get(0).getContent();
        assertTrue(prompt.contains("Can we meet Friday?"));
        assertTrue(prompt.contains("alice@corp.com"));
        assertTrue(prompt.contains("needs_reply"));
    }

    @Test
    void classify_WithUnknownLabel_ShouldThrowClassifierUnavailable() {
        // Given
        when(openAiService.createChatCompletion(any(ChatCompletionRequest.class))).thenReturn(answer("spam"));

        // When / Then
        assertThrows(MessageClassificationService.ClassifierUnavailableException.class, () -> service.classify(msg));
    }

    @Test
    void classify_WithNoChoices_ShouldThrowClassifierUnavailable() {
        // Given
        ChatCompletionResult empty = new ChatCompletionResult();
        empty.setChoices(List.of());
        when(openAiService.createChatCompletion(any(ChatCompletionRequest.class))).thenReturn(empty);

        // When / Then
        assertThrows(MessageClassificationService.ClassifierUnavailableException.class, () -> service.classify(msg));
    }

    @Test
    void classify_WhenClientFails_ShouldWrapInClassifierUnavailable() {
        // Given
        RuntimeException failure = new RuntimeException("connection reset");
        when(openAiService.createChatCompletion(any(ChatCompletionRequest.class))).thenThrow(failure);

        // When
        MessageClassificationService.ClassifierUnavailableException ex = assertThrows(
                MessageClassificationService.ClassifierUnavailableException.class, () -> service.classify(msg));

        // Then
        assertSame(failure, ex.getCause());
    }

    @Test
    void name_ShouldIncludeModel() {
        assertEquals("openai:gpt-3.5-turbo", service.name());
    }
}
