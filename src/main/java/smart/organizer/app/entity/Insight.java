package smart.organizer.app.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;

@Value
@Builder
public class Insight {
    Kind kind;
    Severity severity;
    Type type;
    String title;
    String message;
    String action;

    public enum Kind {
        REPLY_BACKLOG_HIGH,
        REPLY_BACKLOG_MEDIUM,
        LOW_PRIORITY_DOMINANCE,
        DEADLINE_KEYWORDS,
        SENDER_CONCENTRATION,
        ALL_CLEAR,
        FAST_PROCESSING;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Ordered from most to least severe; {@link #rank()} is used for sorting.
     */
    public enum Severity {
        HIGH(3),
        MEDIUM(2),
        LOW(1);

        private final int rank;

        Severity(int rank) {
            this.rank = rank;
        }

        public int rank() {
            return rank;
        }

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /** Display tone for the client. */
    public enum Type {
        WARNING,
        INFO,
        SUCCESS;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
