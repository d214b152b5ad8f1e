package smart.organizer.app.service;

import lombok.extern.slf4j.Slf4j;
import smart.organizer.app.entity.Category;
import smart.organizer.app.entity.Message;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a model-backed classifier with a bounded timeout and substitutes the
 * rule-based classifier whenever the model fails, times out or returns garbage.
 * Callers always get a category.
 */
@Slf4j
public class FallbackClassificationService implements MessageClassificationService {
    private final MessageClassificationService model;
    private final MessageClassificationService rules;
    private final Executor executor;
    private final Duration timeout;
    private final int maxModelMessagesPerBatch;
    private final boolean disableAfterFailure;

    private final AtomicBoolean modelDisabled = new AtomicBoolean(false);

    public FallbackClassificationService(
            MessageClassificationService model,
            MessageClassificationService rules,
            Executor executor,
            Duration timeout,
            int maxModelMessagesPerBatch,
            boolean disableAfterFailure) {
        this.model = model;
        this.rules = rules;
        this.executor = executor;
        this.timeout = timeout;
        this.maxModelMessagesPerBatch = maxModelMessagesPerBatch;
        this.disableAfterFailure = disableAfterFailure;
    }

    @Override
    public Category classify(Message message) {
        if (modelDisabled.get()) {
            return rules.classify(message);
        }

        CompletableFuture<Category> future = null;
        try {
            future = CompletableFuture.supplyAsync(() -> model.classify(message), executor);
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Model executor saturated, classifying message {} with rule-based", message.getId());
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Model classification timed out after {}ms for message {}, falling back to rule-based",
                    timeout.toMillis(), message.getId());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Model classification failed for message {}: {}, falling back to rule-based",
                    message.getId(), cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Model classification interrupted for message {}, falling back to rule-based", message.getId());
        }

        onModelFailure();
        return rules.classify(message);
    }

    /**
     * Only the first {@code maxModelMessagesPerBatch} messages are sent to the model;
     * the rest go straight to the rule engine to keep batch latency bounded.
     */
    @Override
    public List<Category> classifyAll(List<Message> messages) {
        List<Category> categories = new ArrayList<>(messages.size());
        if (messages.size() > maxModelMessagesPerBatch) {
            log.info("Limiting model to {} messages, using rule-based for {} others",
                    maxModelMessagesPerBatch, messages.size() - maxModelMessagesPerBatch);
        }
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            categories.add(i < maxModelMessagesPerBatch ? classify(message) : rules.classify(message));
        }
        return categories;
    }

    @Override
    public String name() {
        return modelDisabled.get() ? rules.name() : model.name() + " (fallback: " + rules.name() + ")";
    }

    public boolean isModelDisabled() {
        return modelDisabled.get();
    }

    private void onModelFailure() {
        if (disableAfterFailure && modelDisabled.compareAndSet(false, true)) {
            log.warn("Disabling {} for the rest of the process lifetime; using {} only", model.name(), rules.name());
        }
    }
}
