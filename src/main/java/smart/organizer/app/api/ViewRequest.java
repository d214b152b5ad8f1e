package smart.organizer.app.api;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for POST /view: a classified batch plus search/filter/sort settings.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ViewRequest {
    @NotNull(message = "categorized is required")
    private CategorizedMessages categorized;

    private String query;

    /** needs_reply, important, ignore or all */
    private String category;

    /** date, sender, subject or priority */
    private String sort;

    /** asc or desc */
    private String direction;
}
