package smart.organizer.app.entity;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one classification run. Every category has a bucket (possibly empty)
 * and each bucket keeps the order in which messages were submitted.
 */
@Value
public class BatchResult {
    Map<Category, List<ClassifiedMessage>> categorized;
    int total;
    Duration processingTime;
    Instant processedAt;

    public BatchResult(Map<Category, List<ClassifiedMessage>> categorized, int total,
                       Duration processingTime, Instant processedAt) {
        Map<Category, List<ClassifiedMessage>> buckets = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            List<ClassifiedMessage> bucket = categorized != null ? categorized.get(category) : null;
            buckets.put(category, bucket == null
                    ? List.of()
                    : Collections.unmodifiableList(new ArrayList<>(bucket)));
        }
        this.categorized = Collections.unmodifiableMap(buckets);
        this.total = total;
        this.processingTime = processingTime != null ? processingTime : Duration.ZERO;
        this.processedAt = processedAt;
    }

    public List<ClassifiedMessage> bucket(Category category) {
        return categorized.get(category);
    }

    public int count(Category category) {
        return categorized.get(category).size();
    }
}
