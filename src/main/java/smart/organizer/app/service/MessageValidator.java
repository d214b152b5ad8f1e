package smart.organizer.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import smart.organizer.app.config.OrganizerProperties;
import smart.organizer.app.entity.Message;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Normalizes raw records and drops the ones that cannot be classified.
 * A record needs a non-blank id and a non-blank subject; later records reusing an id are dropped.
 */
@Slf4j
@Component
public class MessageValidator {
    private final int maxPreviewLength;

    public MessageValidator(OrganizerProperties properties) {
        this.maxPreviewLength = properties.getLimits().getMaxPreviewLength();
    }

    public List<Message> validate(List<Message> rawMessages) {
        if (rawMessages == null || rawMessages.isEmpty()) {
            return List.of();
        }

        List<Message> valid = new ArrayList<>(rawMessages.size());
        Set<String> seenIds = new HashSet<>();
        int dropped = 0;

        for (Message raw : rawMessages) {
            if (!isAcceptable(raw)) {
                dropped++;
                continue;
            }
            Message message = normalize(raw);
            if (!seenIds.add(message.getId())) {
                log.debug("Dropping message with duplicate id {}", message.getId());
                dropped++;
                continue;
            }
            valid.add(message);
        }

        if (dropped > 0) {
            log.debug("Dropped {} of {} messages during validation", dropped, rawMessages.size());
        }
        return valid;
    }

    private static boolean isAcceptable(Message raw) {
        return raw != null
                && raw.getId() != null && !raw.getId().isBlank()
                && raw.getSubject() != null && !raw.getSubject().isBlank();
    }

    private Message normalize(Message raw) {
        String preview = raw.getPreview() != null ? raw.getPreview() : "";
        if (preview.length() > maxPreviewLength) {
            preview = preview.substring(0, maxPreviewLength);
        }
        return raw.toBuilder()
                .subject(raw.getSubject().trim())
                .sender(raw.getSender() != null ? raw.getSender().trim() : "")
                .preview(preview)
                .build();
    }
}
