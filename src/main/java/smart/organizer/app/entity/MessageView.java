package smart.organizer.app.entity;

import lombok.Value;

import java.util.List;

/**
 * Read-only projection of a batch under a {@link ViewState}.
 */
@Value
public class MessageView {
    List<ClassifiedMessage> messages;
    int matchedCount;
    int totalCount;
}
