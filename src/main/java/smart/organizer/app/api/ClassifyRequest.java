package smart.organizer.app.api;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import smart.organizer.app.entity.Message;

import java.util.List;

/**
 * Request body for POST /classify.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClassifyRequest {
    @NotNull(message = "messages is required")
    private List<Message> messages;
}
