package guraa.doccompare.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Listing entry for a stored source document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredFileInfo {

    /**
     * 1-based position in the sorted listing; used as serial number for deletion.
     */
    private int id;

    @JsonProperty("file_name")
    private String fileName;

    @JsonProperty("file_extension")
    private String fileExtension;

    @JsonProperty("file_size")
    private String fileSize;
}
