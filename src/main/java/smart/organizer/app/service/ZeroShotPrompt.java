package smart.organizer.app.service;

import smart.organizer.app.entity.Category;
import smart.organizer.app.entity.Message;

import java.util.Locale;

/**
 * Prompt and label mapping shared by the model-backed classifiers.
 * The model is asked to pick one of the three category names; its answer is mapped back onto {@link Category}.
 */
final class ZeroShotPrompt {

    private static final int MAX_PREVIEW_CHARS = 200;

    private ZeroShotPrompt() {
    }

    static String build(Message message) {
        String preview = message.getPreview() != null ? message.getPreview() : "";
        if (preview.length() > MAX_PREVIEW_CHARS) {
            preview = preview.substring(0, MAX_PREVIEW_CHARS) + "...";
        }
        return String.format(
                "Classify the following email into exactly one of these categories:\n\n" +
                "- needs_reply: the sender asks a question, makes a request or expects an answer from the recipient\n" +
                "- important: significant information that does not require a reply\n" +
                "- ignore: newsletters, promotions, automated or bulk mail\n\n" +
                "From: %s\nSubject: %s\nContent: %s\n\n" +
                "Respond with ONLY the category name, nothing else.",
                message.getSender(), message.getSubject(), preview);
    }

    /**
     * Maps a raw model answer onto a category.
     * @throws MessageClassificationService.ClassifierUnavailableException if the answer is not one of the labels
     */
    static Category toCategory(String answer) {
        if (answer == null) {
            throw new MessageClassificationService.ClassifierUnavailableException("Model returned no label");
        }
        String label = answer.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("^[\\s\"'`.*:-]+|[\\s\"'`.*:-]+$", "")
                .replace(' ', '_');
        return switch (label) {
            case "needs_reply" -> Category.NEEDS_REPLY;
            case "important" -> Category.IMPORTANT;
            case "ignore" -> Category.IGNORE;
            default -> throw new MessageClassificationService.ClassifierUnavailableException(
                    "Model returned an unrecognized label: " + answer);
        };
    }
}
