package smart.organizer.app.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {
    private String status;

    private Instant timestamp;

    private String service;

    private String version;

    /** Name of the active classification strategy. */
    private String classifier;

    @JsonProperty("model_enabled")
    private boolean modelEnabled;

    @JsonProperty("model_name")
    private String modelName;

    @JsonProperty("use_accelerator")
    private boolean useAccelerator;
}
