package smart.organizer.app.service;

import lombok.extern.slf4j.Slf4j;
import smart.organizer.app.config.OrganizerProperties;
import smart.organizer.app.entity.Category;
import smart.organizer.app.entity.Message;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Deterministic keyword classifier. Always available and used as the fallback
 * for every model-backed strategy.
 * <p>
 * Rules are evaluated top to bottom and the first match wins:
 * ignore keywords, then reply keywords, then important keywords.
 * Bulk mail often carries urgency wording ("act now"), so ignore has to come first.
 */
@Slf4j
public class RuleBasedClassificationService implements MessageClassificationService {

    private final List<KeywordRule> rules;
    private final Category defaultCategory;

    public RuleBasedClassificationService(OrganizerProperties.Classifier properties) {
        OrganizerProperties.Keywords keywords = properties.getKeywords();
        this.rules = List.of(
                new KeywordRule(Category.IGNORE, normalize(keywords.getIgnore())),
                new KeywordRule(Category.NEEDS_REPLY, normalize(keywords.getReply())),
                new KeywordRule(Category.IMPORTANT, normalize(keywords.getImportant()))
        );
        this.defaultCategory = Objects.requireNonNull(properties.getDefaultCategory(), "defaultCategory");
        log.info("Rule-based classifier ready: {} ignore, {} reply, {} important keywords, default '{}'",
                rules.get(0).keywords().size(), rules.get(1).keywords().size(),
                rules.get(2).keywords().size(), defaultCategory);
    }

    @Override
    public Category classify(Message message) {
        String text = searchableText(message);
        for (KeywordRule rule : rules) {
            Optional<String> hit = rule.firstMatch(text);
            if (hit.isPresent()) {
                log.debug("Message {} classified as '{}' (keyword: {})", message.getId(), rule.category(), hit.get());
                return rule.category();
            }
        }
        log.debug("Message {} classified as '{}' (default)", message.getId(), defaultCategory);
        return defaultCategory;
    }

    @Override
    public String name() {
        return "rule-based";
    }

    static String searchableText(Message message) {
        String subject = message.getSubject() != null ? message.getSubject() : "";
        String preview = message.getPreview() != null ? message.getPreview() : "";
        return (subject + " " + preview).toLowerCase(Locale.ROOT);
    }

    private static List<String> normalize(List<String> keywords) {
        if (keywords == null) return List.of();
        return keywords.stream()
                .filter(Objects::nonNull)
                .map(k -> k.toLowerCase(Locale.ROOT))
                .filter(k -> !k.isBlank())
                .distinct()
                .toList();
    }

    /**
     * One row of the decision table: any keyword present → category.
     */
    static final class KeywordRule {
        private final Category category;
        private final List<String> keywords;

        KeywordRule(Category category, List<String> keywords) {
            this.category = category;
            this.keywords = keywords;
        }

        Category category() {
            return category;
        }

        List<String> keywords() {
            return keywords;
        }

        Optional<String> firstMatch(String text) {
            for (String keyword : keywords) {
                if (text.contains(keyword)) {
                    return Optional.of(keyword);
                }
            }
            return Optional.empty();
        }
    }
}
