package smart.organizer.app.service;

/**
 * Thrown when a batch has no valid records left after validation.
 */
public class EmptyBatchException extends RuntimeException {
    public EmptyBatchException(int submitted) {
        super("No valid messages to classify (" + submitted + " submitted)");
    }
}
