package guraa.doccompare.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a delete request. Serial numbers are kept as raw JSON so that fractions, strings and
 * nulls are rejected instead of being coerced to integers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeleteFilesRequest {

    @JsonProperty("serial_numbers")
    private List<JsonNode> serialNumbers;

    /**
     * The serial numbers as integers, or null if any entry is not an integral JSON number.
     */
    public List<Integer> toIntegers() {
        List<Integer> result = new ArrayList<>(serialNumbers.size());
        for (JsonNode node : serialNumbers) {
            if (node == null || !node.isIntegralNumber() || !node.canConvertToInt()) {
                return null;
            }
            result.add(node.intValue());
        }
        return result;
    }
}
