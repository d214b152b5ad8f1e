package smart.organizer.app.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import smart.organizer.app.entity.Category;
import smart.organizer.app.entity.ClassifiedMessage;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Wire form of the three category buckets.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CategorizedMessages {
    @JsonProperty("needs_reply")
    private List<ClassifiedMessage> needsReply = new ArrayList<>();

    @JsonProperty("important")
    private List<ClassifiedMessage> important = new ArrayList<>();

    @JsonProperty("ignore")
    private List<ClassifiedMessage> ignore = new ArrayList<>();

    public static CategorizedMessages from(Map<Category, List<ClassifiedMessage>> buckets) {
        return new CategorizedMessages(
                buckets.getOrDefault(Category.NEEDS_REPLY, List.of()),
                buckets.getOrDefault(Category.IMPORTANT, List.of()),
                buckets.getOrDefault(Category.IGNORE, List.of()));
    }

    public Map<Category, List<ClassifiedMessage>> toBuckets() {
        Map<Category, List<ClassifiedMessage>> buckets = new EnumMap<>(Category.class);
        buckets.put(Category.NEEDS_REPLY, needsReply != null ? needsReply : List.of());
        buckets.put(Category.IMPORTANT, important != null ? important : List.of());
        buckets.put(Category.IGNORE, ignore != null ? ignore : List.of());
        return buckets;
    }
}
