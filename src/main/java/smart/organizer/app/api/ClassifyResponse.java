package smart.organizer.app.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import smart.organizer.app.entity.BatchResult;
import smart.organizer.app.entity.Insight;

import java.time.Instant;
import java.util.List;

/**
 * Response body for POST /classify. {@code insights} is omitted when insight generation failed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClassifyResponse {
    private boolean success;

    private CategorizedMessages categorized;

    private int total;

    @JsonProperty("processed_at")
    private Instant processedAt;

    @JsonProperty("processing_time_ms")
    private double processingTimeMs;

    private List<Insight> insights;

    public static ClassifyResponse of(BatchResult result, List<Insight> insights) {
        return new ClassifyResponse(
                true,
                CategorizedMessages.from(result.getCategorized()),
                result.getTotal(),
                result.getProcessedAt(),
                result.getProcessingTime().toNanos() / 1_000_000.0,
                insights);
    }
}
