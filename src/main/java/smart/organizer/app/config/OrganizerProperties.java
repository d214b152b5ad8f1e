package smart.organizer.app.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import smart.organizer.app.entity.Category;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed configuration bound from {@code organizer.*} in application.yml.
 * Keyword sets live here so they can be tuned without touching the rule engine.
 */
@ConfigurationProperties(prefix = "organizer")
@Getter
@Setter
public class OrganizerProperties {

    private Classifier classifier = new Classifier();
    private Model model = new Model();
    private Limits limits = new Limits();
    private Insights insights = new Insights();
    private View view = new View();
    private Cors cors = new Cors();

    @Getter
    @Setter
    public static class Classifier {
        /** Category for messages no keyword rule matches. */
        private Category defaultCategory = Category.IMPORTANT;

        private Keywords keywords = new Keywords();
    }

    @Getter
    @Setter
    public static class Keywords {
        /** Bulk/automated mail markers. Checked first. */
        private List<String> ignore = new ArrayList<>();

        /** Requests, questions and urgency directed at the recipient. */
        private List<String> reply = new ArrayList<>();

        /** Significance without a reply being expected. */
        private List<String> important = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Model {
        private boolean enabled = false;

        /** openai or gemini */
        private String provider = "openai";

        /** Blank means the provider's default, see {@link #resolvedName()}. */
        private String name = "";

        /** Reported on /health; acceleration is up to the hosted provider. */
        private boolean useAccelerator = false;

        private String openaiApiKey = "";

        private String geminiApiKey = "";

        private Duration timeout = Duration.ofSeconds(10);

        /** Messages beyond this count in a batch go straight to the rule engine. */
        private int maxMessagesPerBatch = 10;

        /** When true, the first model failure switches the process to rules only. */
        private boolean disableAfterFailure = false;

        public String resolvedName() {
            if (name != null && !name.isBlank()) {
                return name.trim();
            }
            return "gemini".equalsIgnoreCase(provider == null ? "" : provider.trim()) ? "gemini-pro" : "gpt-3.5-turbo";
        }
    }

    @Getter
    @Setter
    public static class Limits {
        private int maxMessagesPerRequest = 100;

        private int maxPreviewLength = 1000;
    }

    @Getter
    @Setter
    public static class Insights {
        private List<String> deadlineKeywords = new ArrayList<>();

        private List<String> urgentKeywords = new ArrayList<>();

        private Duration fastProcessingThreshold = Duration.ofMillis(20);
    }

    @Getter
    @Setter
    public static class View {
        /** Language tag for sender/subject collation. */
        private String locale = "en";
    }

    @Getter
    @Setter
    public static class Cors {
        /** Origin patterns allowed to call the API; {@code *} admits any browser-extension origin. */
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
