package smart.organizer.app.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import smart.organizer.app.entity.ClassifiedMessage;
import smart.organizer.app.entity.MessageView;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ViewResponse {
    private List<ClassifiedMessage> messages;

    @JsonProperty("matched_count")
    private int matchedCount;

    @JsonProperty("total_count")
    private int totalCount;

    public static ViewResponse of(MessageView view) {
        return new ViewResponse(view.getMessages(), view.getMatchedCount(), view.getTotalCount());
    }
}
