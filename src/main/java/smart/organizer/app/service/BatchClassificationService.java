package smart.organizer.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;
import smart.organizer.app.config.OrganizerProperties;
import smart.organizer.app.entity.BatchResult;
import smart.organizer.app.entity.Category;
import smart.organizer.app.entity.ClassifiedMessage;
import smart.organizer.app.entity.Message;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class BatchClassificationService {
    private final MessageClassificationService classificationService;
    private final RuleBasedClassificationService ruleBasedClassificationService;
    private final MessageValidator messageValidator;
    private final int maxMessagesPerRequest;
    private final Category defaultCategory;

    public BatchClassificationService(
            MessageClassificationService classificationService,
            RuleBasedClassificationService ruleBasedClassificationService,
            MessageValidator messageValidator,
            OrganizerProperties properties) {
        this.classificationService = classificationService;
        this.ruleBasedClassificationService = ruleBasedClassificationService;
        this.messageValidator = messageValidator;
        this.maxMessagesPerRequest = properties.getLimits().getMaxMessagesPerRequest();
        this.defaultCategory = properties.getClassifier().getDefaultCategory();
    }

    /**
     * Validates and classifies a batch.
     * @param rawMessages Messages as submitted by the client
     * @return Buckets for every category, in submission order
     * @throws IllegalArgumentException if more messages were submitted than a request may carry
     * @throws EmptyBatchException if no message survives validation
     */
    public BatchResult classifyBatch(List<Message> rawMessages) {
        int submitted = rawMessages != null ? rawMessages.size() : 0;
        if (submitted > maxMessagesPerRequest) {
            throw new IllegalArgumentException(
                "Too many messages: " + submitted + " (maximum " + maxMessagesPerRequest + " per request)");
        }

        List<Message> messages = messageValidator.validate(rawMessages);
        if (messages.isEmpty()) {
            throw new EmptyBatchException(submitted);
        }

        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        List<Category> categories = classifyEach(messages);
        stopWatch.stop();

        Map<Category, List<ClassifiedMessage>> buckets = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            buckets.put(category, new ArrayList<>());
        }
        for (int i = 0; i < messages.size(); i++) {
            buckets.get(categories.get(i)).add(ClassifiedMessage.of(messages.get(i), categories.get(i)));
        }

        BatchResult result = new BatchResult(buckets, messages.size(),
                Duration.ofNanos(stopWatch.getTotalTimeNanos()), Instant.now());
        log.info("Classified {} messages in {}ms using {}: {} needs_reply, {} important, {} ignore",
                result.getTotal(), result.getProcessingTime().toMillis(), classificationService.name(),
                result.count(Category.NEEDS_REPLY), result.count(Category.IMPORTANT), result.count(Category.IGNORE));
        return result;
    }

    private List<Category> classifyEach(List<Message> messages) {
        try {
            List<Category> categories = classificationService.classifyAll(messages);
            if (categories.size() == messages.size() && !categories.contains(null)) {
                return categories;
            }
            log.warn("Classifier returned {} categories for {} messages, classifying one by one",
                    categories.size(), messages.size());
        } catch (RuntimeException e) {
            log.error("Batch classification failed, classifying one by one: {}", e.getMessage(), e);
        }

        List<Category> categories = new ArrayList<>(messages.size());
        for (Message message : messages) {
            categories.add(classifySafely(message));
        }
        return categories;
    }

    private Category classifySafely(Message message) {
        try {
            return ruleBasedClassificationService.classify(message);
        } catch (RuntimeException e) {
            log.error("Error classifying message {}, filing under '{}': {}",
                    message.getId(), defaultCategory, e.getMessage(), e);
            return defaultCategory;
        }
    }
}
