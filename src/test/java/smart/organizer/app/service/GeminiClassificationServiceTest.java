package smart.organizer.app.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import smart.organizer.app.entity.Category;
import smart.organizer.app.entity.Message;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static smart.organizer.app.OrganizerFixtures.message;

@ExtendWith(MockitoExtension.class)
class GeminiClassificationServiceTest {

    @Mock
    private RestTemplate restTemplate;

    private GeminiClassificationService service;
    private Message msg;

    @BeforeEach
    void setUp() {
        service = new GeminiClassificationService(restTemplate, new ObjectMapper(), "test-key", "gemini-pro");
        msg = message("7", "Weekly digest", "digest@news.com", "Top stories this week");
    }

    private static String geminiBody(String text) {
        return "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"" + text + "\"}]}}]}";
    }

    @Test
    void classify_WithLabelAnswer_ShouldMapToCategory() {
        // Given
        when(restTemplate.postForEntity(anyString(), any(HttpEntity.class), eq(String.class)))
                .thenReturn(new ResponseEntity<>(geminiBody("ignore"), HttpStatus.OK));

        // When
        Category category = service.classify(msg);

        // Then
        assertEquals(Category.IGNORE, category);
        verify(restTemplate).postForEntity(contains("gemini-pro:generateContent?key=test-key"),
                any(HttpEntity.class), eq(String.class));
    }

    @Test
    void classify_WithUnexpectedBody_ShouldThrowClassifierUnavailable() {
        // Given
        when(restTemplate.postForEntity(anyString(), any(HttpEntity.class), eq(String.class)))
                .thenReturn(new ResponseEntity<>("{\"candidates\":[]}", HttpStatus.OK));

        // When / Then
        assertThrows(MessageClassificationService.ClassifierUnavailableException.class, () -> service.classify(msg));
    }

    @Test
    void classify_WithErrorStatus_ShouldThrowClassifierUnavailable() {
        // Given
        when(restTemplate.postForEntity(anyString(), any(HttpEntity.class), eq(String.class)))
                .thenReturn(new ResponseEntity<>("quota", HttpStatus.TOO_MANY_REQUESTS));

        // When / Then
        assertThrows(MessageClassificationService.ClassifierUnavailableException.class, () -> service.classify(msg));
    }

    @Test
    void classify_WhenRequestFails_ShouldThrowClassifierUnavailable() {
        // Given
        when(restTemplate.postForEntity(anyString(), any(HttpEntity.class), eq(String.class)))
                .thenThrow(new ResourceAccessException("timeout"));

        // When / Then
        assertThrows(MessageClassificationService.ClassifierUnavailableException.class, () -> service.classify(msg));
    }

    @Test
    void constructor_WithoutApiKey_ShouldThrowClassifierUnavailable() {
        assertThrows(MessageClassificationService.ClassifierUnavailableException.class,
                () -> new GeminiClassificationService(restTemplate, new ObjectMapper(), "", "gemini-pro"));
        assertThrows(MessageClassificationService.ClassifierUnavailableException.class,
                () -> new GeminiClassificationService(restTemplate, new ObjectMapper(), "${GEMINI_API_KEY}", "gemini-pro"));
    }
}
