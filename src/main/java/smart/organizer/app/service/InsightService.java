package smart.organizer.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import smart.organizer.app.config.OrganizerProperties;
import smart.organizer.app.entity.BatchResult;
import smart.organizer.app.entity.Category;
import smart.organizer.app.entity.ClassifiedMessage;
import smart.organizer.app.entity.Insight;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Derives human-readable observations from a classified batch.
 * Rules run in a fixed order; the result is stably sorted by severity so equal
 * severities keep rule order.
 */
@Slf4j
@Service
public class InsightService {
    private static final int BACKLOG_HIGH_THRESHOLD = 10;
    private static final int BACKLOG_MEDIUM_THRESHOLD = 5;
    private static final double LOW_PRIORITY_SHARE = 0.60;
    private static final int LOW_PRIORITY_MIN_COUNT = 20;
    private static final int SENDER_CONCENTRATION_MIN_COUNT = 5;
    private static final int ALL_CLEAR_MIN_TOTAL = 10;

    private final List<String> deadlineKeywords;
    private final List<String> urgentKeywords;
    private final Duration fastProcessingThreshold;
    private final List<Function<BatchResult, Optional<Insight>>> rules;

    public InsightService(OrganizerProperties properties) {
        OrganizerProperties.Insights insights = properties.getInsights();
        this.deadlineKeywords = lowerCase(insights.getDeadlineKeywords());
        this.urgentKeywords = lowerCase(insights.getUrgentKeywords());
        this.fastProcessingThreshold = insights.getFastProcessingThreshold();
        this.rules = List.of(
                this::replyBacklog,
                this::lowPriorityDominance,
                this::deadlineKeywords,
                this::senderConcentration,
                this::allClear,
                this::fastProcessing
        );
    }

    public List<Insight> generate(BatchResult result) {
        List<Insight> insights = new ArrayList<>();
        for (Function<BatchResult, Optional<Insight>> rule : rules) {
            rule.apply(result).ifPresent(insights::add);
        }
        // List.sort is stable
        insights.sort(Comparator.comparingInt((Insight insight) -> insight.getSeverity().rank()).reversed());
        log.debug("Generated {} insights for batch of {}", insights.size(), result.getTotal());
        return insights;
    }

    private Optional<Insight> replyBacklog(BatchResult result) {
        int needsReply = result.count(Category.NEEDS_REPLY);
        if (needsReply > BACKLOG_HIGH_THRESHOLD) {
            long urgent = result.bucket(Category.NEEDS_REPLY).stream()
                    .filter(m -> containsAny(m, urgentKeywords))
                    .count();
            return Optional.of(Insight.builder()
                    .kind(Insight.Kind.REPLY_BACKLOG_HIGH)
                    .severity(Insight.Severity.HIGH)
                    .type(Insight.Type.WARNING)
                    .title("High Priority Alert")
                    .message(String.format("You have %d messages requiring attention. %d contain urgent keywords. "
                            + "Prioritize these first.", needsReply, urgent))
                    .action("Review urgent messages with deadlines first")
                    .build());
        }
        if (needsReply > BACKLOG_MEDIUM_THRESHOLD) {
            return Optional.of(Insight.builder()
                    .kind(Insight.Kind.REPLY_BACKLOG_MEDIUM)
                    .severity(Insight.Severity.MEDIUM)
                    .type(Insight.Type.INFO)
                    .title("Action Items Pending")
                    .message(String.format("You have %d messages that need a reply. "
                            + "Consider setting aside time to respond.", needsReply))
                    .action("Schedule 30 minutes to reply to these messages")
                    .build());
        }
        return Optional.empty();
    }

    private Optional<Insight> lowPriorityDominance(BatchResult result) {
        int ignore = result.count(Category.IGNORE);
        int total = result.getTotal();
        if (total == 0 || ignore <= LOW_PRIORITY_MIN_COUNT || (double) ignore / total <= LOW_PRIORITY_SHARE) {
            return Optional.empty();
        }

        long percentage = Math.round(ignore * 100.0 / total);
        StringBuilder message = new StringBuilder(percentage + "% of your emails are low-priority.");
        Optional<Map.Entry<String, Integer>> topDomain = topDomain(result.bucket(Category.IGNORE));
        topDomain.ifPresent(top -> message.append(String.format(" Most come from %s (%d messages).",
                top.getKey(), top.getValue())));

        return Optional.of(Insight.builder()
                .kind(Insight.Kind.LOW_PRIORITY_DOMINANCE)
                .severity(Insight.Severity.LOW)
                .type(Insight.Type.INFO)
                .title("Email Management Opportunity")
                .message(message.toString())
                .action("Consider unsubscribing from " + topDomain.map(Map.Entry::getKey).orElse("newsletters"))
                .build());
    }

    private Optional<Insight> deadlineKeywords(BatchResult result) {
        long matches = actionable(result).stream()
                .filter(m -> containsAny(m, deadlineKeywords))
                .count();
        if (matches == 0) {
            return Optional.empty();
        }
        return Optional.of(Insight.builder()
                .kind(Insight.Kind.DEADLINE_KEYWORDS)
                .severity(Insight.Severity.HIGH)
                .type(Insight.Type.WARNING)
                .title("Deadlines Detected")
                .message(String.format("Found %d message(s) with assignment/deadline keywords. "
                        + "Review these immediately to avoid missing deadlines.", matches))
                .action("Check all deadline-related messages and add to calendar")
                .build());
    }

    private Optional<Insight> senderConcentration(BatchResult result) {
        return topDomain(actionable(result))
                .filter(top -> top.getValue() > SENDER_CONCENTRATION_MIN_COUNT)
                .map(top -> Insight.builder()
                        .kind(Insight.Kind.SENDER_CONCENTRATION)
                        .severity(Insight.Severity.LOW)
                        .type(Insight.Type.INFO)
                        .title("Primary Communication Source")
                        .message(String.format("Most of your important messages (%d) come from %s. "
                                + "Monitor this source regularly.", top.getValue(), top.getKey()))
                        .action("Set up notifications for " + top.getKey() + " if needed")
                        .build());
    }

    private Optional<Insight> allClear(BatchResult result) {
        if (result.count(Category.NEEDS_REPLY) != 0 || result.getTotal() <= ALL_CLEAR_MIN_TOTAL) {
            return Optional.empty();
        }
        return Optional.of(Insight.builder()
                .kind(Insight.Kind.ALL_CLEAR)
                .severity(Insight.Severity.LOW)
                .type(Insight.Type.SUCCESS)
                .title("All Caught Up!")
                .message("Excellent! You have no messages requiring immediate reply. Great email management!")
                .action("Maintain this momentum by checking emails regularly")
                .build());
    }

    private Optional<Insight> fastProcessing(BatchResult result) {
        Duration elapsed = result.getProcessingTime();
        if (elapsed.compareTo(fastProcessingThreshold) >= 0) {
            return Optional.empty();
        }
        double millis = elapsed.toNanos() / 1_000_000.0;
        return Optional.of(Insight.builder()
                .kind(Insight.Kind.FAST_PROCESSING)
                .severity(Insight.Severity.LOW)
                .type(Insight.Type.SUCCESS)
                .title("Fast Processing")
                .message(String.format(Locale.ROOT, "Messages classified in %.1fms.", millis))
                .action("No action needed")
                .build());
    }

    private static List<ClassifiedMessage> actionable(BatchResult result) {
        List<ClassifiedMessage> messages = new ArrayList<>(result.bucket(Category.NEEDS_REPLY));
        messages.addAll(result.bucket(Category.IMPORTANT));
        return messages;
    }

    /**
     * Most frequent sender domain; the domain seen first wins a tie.
     */
    private static Optional<Map.Entry<String, Integer>> topDomain(List<ClassifiedMessage> messages) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ClassifiedMessage message : messages) {
            String domain = senderDomain(message.getSender());
            if (domain != null) {
                counts.merge(domain, 1, Integer::sum);
            }
        }
        Map.Entry<String, Integer> top = null;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (top == null || entry.getValue() > top.getValue()) {
                top = entry;
            }
        }
        return Optional.ofNullable(top);
    }

    static String senderDomain(String sender) {
        if (sender == null) {
            return null;
        }
        int at = sender.lastIndexOf('@');
        if (at < 0) {
            return null;
        }
        String domain = sender.substring(at + 1).replaceAll("[>\\s]+$", "").toLowerCase(Locale.ROOT);
        return domain.isEmpty() ? null : domain;
    }

    private static boolean containsAny(ClassifiedMessage message, List<String> keywords) {
        String text = (Objects.toString(message.getSubject(), "") + " "
                + Objects.toString(message.getPreview(), "")).toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> lowerCase(List<String> keywords) {
        if (keywords == null) return List.of();
        return keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
    }
}
