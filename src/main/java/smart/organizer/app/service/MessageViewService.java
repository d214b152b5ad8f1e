package smart.organizer.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import smart.organizer.app.config.OrganizerProperties;
import smart.organizer.app.entity.Category;
import smart.organizer.app.entity.ClassifiedMessage;
import smart.organizer.app.entity.MessageView;
import smart.organizer.app.entity.ViewState;

import java.text.Collator;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Search, filter and sort over classified messages. Never mutates its input.
 */
@Slf4j
@Service
public class MessageViewService {
    private final Locale locale;

    public MessageViewService(OrganizerProperties properties) {
        this.locale = Locale.forLanguageTag(properties.getView().getLocale());
    }

    public MessageView apply(Map<Category, List<ClassifiedMessage>> categorized, ViewState viewState) {
        List<ClassifiedMessage> filtered = filterByCategory(categorized, viewState);

        List<ClassifiedMessage> matched = new ArrayList<>(filtered.size());
        String query = viewState.queryOpt().map(q -> q.toLowerCase(locale)).orElse(null);
        for (ClassifiedMessage message : filtered) {
            if (query == null || matches(message, query)) {
                matched.add(message);
            }
        }

        Comparator<ClassifiedMessage> comparator = comparator(viewState.getSortKey());
        if (viewState.getDirection() == ViewState.SortDirection.DESC) {
            comparator = comparator.reversed();
        }
        matched.sort(comparator);

        return new MessageView(List.copyOf(matched), matched.size(), filtered.size());
    }

    private static List<ClassifiedMessage> filterByCategory(Map<Category, List<ClassifiedMessage>> categorized,
                                                            ViewState viewState) {
        List<ClassifiedMessage> filtered = new ArrayList<>();
        if (categorized == null) {
            return filtered;
        }
        if (viewState.getCategory() != null) {
            filtered.addAll(categorized.getOrDefault(viewState.getCategory(), List.of()));
            return filtered;
        }
        for (Category category : Category.values()) {
            filtered.addAll(categorized.getOrDefault(category, List.of()));
        }
        return filtered;
    }

    private boolean matches(ClassifiedMessage message, String query) {
        return contains(message.getSubject(), query)
                || contains(message.getSender(), query)
                || contains(message.getPreview(), query)
                || (message.getCategory() != null && contains(message.getCategory().getWireName(), query));
    }

    private boolean contains(String field, String query) {
        return field != null && field.toLowerCase(locale).contains(query);
    }

    private Comparator<ClassifiedMessage> comparator(ViewState.SortKey sortKey) {
        switch (sortKey) {
            case DATE:
                return Comparator.comparing(m -> parseTimestamp(m.getTimestamp()));
            case SENDER: {
                Collator collator = Collator.getInstance(locale);
                return Comparator.comparing(m -> Objects.toString(m.getSender(), ""), collator);
            }
            case SUBJECT: {
                Collator collator = Collator.getInstance(locale);
                return Comparator.comparing(m -> Objects.toString(m.getSubject(), ""), collator);
            }
            case PRIORITY:
            default:
                return Comparator.comparingInt(m -> m.getCategory() != null ? m.getCategory().getWeight() : 0);
        }
    }

    /**
     * Accepts ISO-8601 instants, offset date-times, local date-times and plain dates;
     * values without an offset are read as UTC. Anything else sorts as the epoch.
     */
    static Instant parseTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return Instant.EPOCH;
        }
        String value = timestamp.trim();
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.trace("Not an offset date-time: {}", value);
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.trace("Not an instant: {}", value);
        }
        try {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.trace("Not a local date-time: {}", value);
        }
        try {
            return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp '{}', sorting as epoch", value);
            return Instant.EPOCH;
        }
    }
}
