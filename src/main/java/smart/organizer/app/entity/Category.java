package smart.organizer.app.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The three mutually exclusive outcomes of classification.
 * Weight drives the priority sort (higher = more urgent).
 */
public enum Category {
    NEEDS_REPLY("needs_reply", 3),
    IMPORTANT("important", 2),
    IGNORE("ignore", 1);

    private final String wireName;
    private final int weight;

    Category(String wireName, int weight) {
        this.wireName = wireName;
        this.weight = weight;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public int getWeight() {
        return weight;
    }

    @JsonCreator
    public static Category fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Category must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Category category : values()) {
            if (category.wireName.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown category: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
