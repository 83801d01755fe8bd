package guraa.doccompare.model;

import lombok.Value;

/**
 * Counts of a delete-by-serial-number request.
 */
@Value
public class DeletionResult {

    int deleted;
    int notFound;

    public String toMessage() {
        StringBuilder message = new StringBuilder();
        if (deleted > 0) {
            message.append(deleted).append(deleted == 1 ? " file" : " files").append(" successfully deleted");
        }
        if (notFound > 0) {
            if (message.length() > 0) {
                message.append(", ");
            }
            message.append(notFound).append(notFound == 1 ? " file" : " files").append(" not found");
        }
        return message.toString();
    }
}
