package work.shellformats.toml.convert;

import java.util.LinkedHashMap;
import java.util.Map;
import work.shellformats.toml.doc.DocValue;
import work.shellformats.toml.doc.DocValue.InlineTable;
import work.shellformats.toml.value.Value.RecordValue;

/**
 * Converts a record into an inline table, column by column in record order.
 */
final class RecordEncoder {
    private final ValueClassifier classifier;

    RecordEncoder(ValueClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * @param depth depth of the record's fields
     */
    InlineTable encode(RecordValue record, int depth) {
        Map<String, DocValue> entries = new LinkedHashMap<>();
        for (int i = 0; i < record.size(); i++) {
            entries.put(record.cols().get(i), classifier.classify(record.vals().get(i), depth));
        }
        return new InlineTable(entries);
    }
}
