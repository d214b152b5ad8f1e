package smart.organizer.app.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Standard error body for API endpoints.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private boolean error;

    private String message;

    private String code;

    private Instant timestamp;

    public static ErrorResponse of(String message, String code) {
        return new ErrorResponse(true, message, code, Instant.now());
    }
}
