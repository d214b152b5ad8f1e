package smart.organizer.app.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import smart.organizer.app.entity.Category;
import smart.organizer.app.entity.Message;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Zero-shot classification through the Google Gemini generateContent REST API.
 */
@Slf4j
public class GeminiClassificationService implements MessageClassificationService {
    private static final String GEMINI_API_URL = "https://generativelanguage.googleapis.com/v1beta/models/%s:generateContent";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String modelName;

    public GeminiClassificationService(RestTemplate restTemplate, ObjectMapper objectMapper,
                                       String apiKey, String modelName) {
        if (apiKey == null || apiKey.isBlank() || apiKey.startsWith("${")) {
            throw new ClassifierUnavailableException("Gemini API key not configured");
        }
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.modelName = modelName;
    }

    @Override
    public Category classify(Message message) {
        String answer = callGeminiAPI(ZeroShotPrompt.build(message), message.getId());
        Category category = ZeroShotPrompt.toCategory(answer);
        log.debug("Gemini classified message {} as '{}'", message.getId(), category);
        return category;
    }

    @Override
    public String name() {
        return "gemini:" + modelName;
    }

    private String callGeminiAPI(String prompt, String messageId) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> requestBody = new HashMap<>();
        Map<String, Object> contents = new HashMap<>();
        Map<String, Object> part = new HashMap<>();
        part.put("text", prompt);
        contents.put("parts", List.of(part));
        requestBody.put("contents", List.of(contents));

        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("maxOutputTokens", 10);
        generationConfig.put("temperature", 0.0f);
        requestBody.put("generationConfig", generationConfig);

        HttpEntity<Map<String, Object>> request = new HttpEntity<>(requestBody, headers);
        String url = String.format(GEMINI_API_URL, modelName) + "?key=" + apiKey;

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, request, String.class);
        } catch (RestClientException e) {
            throw new ClassifierUnavailableException(
                "Gemini call failed for message " + messageId + ": " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new ClassifierUnavailableException(
                "Gemini API error: " + response.getStatusCode() + " - " + response.getBody());
        }

        try {
            JsonNode jsonResponse = objectMapper.readTree(response.getBody());
            JsonNode parts = jsonResponse.path("candidates").path(0).path("content").path("parts");
            if (parts.isArray() && parts.size() > 0 && parts.get(0).hasNonNull("text")) {
                return parts.get(0).get("text").asText();
            }
        } catch (JsonProcessingException e) {
            throw new ClassifierUnavailableException("Unreadable Gemini response: " + e.getMessage(), e);
        }
        throw new ClassifierUnavailableException("Unexpected Gemini API response format: " + response.getBody());
    }
}
