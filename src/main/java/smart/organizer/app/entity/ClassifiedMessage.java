package smart.organizer.app.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * A message with the category assigned at classification time.
 */
@Value
public class ClassifiedMessage {
    String id;
    String subject;
    String sender;
    String preview;
    String timestamp;
    Category category;

    @JsonCreator
    public ClassifiedMessage(
            @JsonProperty("id") String id,
            @JsonProperty("subject") String subject,
            @JsonProperty("sender") String sender,
            @JsonProperty("preview") String preview,
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("category") Category category) {
        this.id = id;
        this.subject = subject;
        this.sender = sender;
        this.preview = preview;
        this.timestamp = timestamp;
        this.category = category;
    }

    public static ClassifiedMessage of(Message message, Category category) {
        return new ClassifiedMessage(
                message.getId(),
                message.getSubject(),
                message.getSender(),
                message.getPreview(),
                message.getTimestamp(),
                category);
    }
}
