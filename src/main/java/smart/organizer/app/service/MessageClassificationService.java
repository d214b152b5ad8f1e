package smart.organizer.app.service;

import smart.organizer.app.entity.Category;
import smart.organizer.app.entity.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Interface for deciding the category of a single message.
 * Rule-based and model-backed strategies are interchangeable behind it.
 */
public interface MessageClassificationService {
    /**
     * Raised when a model-backed strategy cannot produce a category
     * (not configured, provider error, unrecognized label).
     */
    class ClassifierUnavailableException extends RuntimeException {
        public ClassifierUnavailableException(String message) {
            super(message);
        }

        public ClassifierUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Classify a message into exactly one category.
     * @param message A validated message
     * @return The category, never null
     * @throws ClassifierUnavailableException if a model-backed strategy fails
     */
    Category classify(Message message);

    /**
     * Classify every message, preserving input order in the returned list.
     */
    default List<Category> classifyAll(List<Message> messages) {
        List<Category> categories = new ArrayList<>(messages.size());
        for (Message message : messages) {
            categories.add(classify(message));
        }
        return categories;
    }

    /**
     * Short identifier reported on the health endpoint.
     */
    String name();
}
