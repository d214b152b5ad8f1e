package smart.organizer.app.entity;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;
import java.util.Optional;

/**
 * Search/filter/sort specification applied to a classified batch for display.
 * An empty {@code category} means "all".
 */
@Value
@Builder
public class ViewState {
    public static final String ALL_CATEGORIES = "all";

    @Builder.Default
    String query = "";

    Category category;

    @Builder.Default
    SortKey sortKey = SortKey.PRIORITY;

    @Builder.Default
    SortDirection direction = SortDirection.DESC;

    public Optional<Category> categoryOpt() {
        return Optional.ofNullable(category);
    }

    public Optional<String> queryOpt() {
        return Optional.ofNullable(query).map(String::trim).filter(s -> !s.isEmpty());
    }

    /**
     * Parses the client's filter value: {@code all} (or blank) selects every bucket.
     */
    public static Category parseCategoryFilter(String value) {
        if (value == null || value.isBlank() || ALL_CATEGORIES.equalsIgnoreCase(value.trim())) {
            return null;
        }
        return Category.fromWireName(value);
    }

    public enum SortKey {
        DATE, SENDER, SUBJECT, PRIORITY;

        public static SortKey fromValue(String value) {
            if (value == null || value.isBlank()) {
                return PRIORITY;
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown sort key: " + value, e);
            }
        }
    }

    public enum SortDirection {
        ASC, DESC;

        public static SortDirection fromValue(String value) {
            if (value == null || value.isBlank()) {
                return DESC;
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown sort direction: " + value, e);
            }
        }
    }
}
