package guraa.doccompare.model;

import lombok.Value;

import java.util.List;

/**
 * A document under comparison: a stable name and the ordered words extracted from its source file.
 * Instances are immutable once produced by the extraction layer.
 */
@Value
public class Document {

    /**
     * Source file name without its extension.
     */
    String name;

    /**
     * Ordered words of the document.
     */
    List<String> tokens;

    public Document(String name, List<String> tokens) {
        this.name = name;
        this.tokens = List.copyOf(tokens);
    }

    public int size() {
        return tokens.size();
    }
}
