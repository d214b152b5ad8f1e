package smart.organizer.app.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One inbound email summary as extracted by the client.
 * Timestamp is kept as the ISO-8601 string the client sent.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Message {
    private String id;

    private String subject;

    private String sender;

    private String preview;

    private String timestamp;
}
