package work.shellformats.toml.convert;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.shellformats.toml.api.CancellationToken;
import work.shellformats.toml.doc.DocValue;
import work.shellformats.toml.doc.DocValue.DocArray;
import work.shellformats.toml.error.ConversionCancelledException;
import work.shellformats.toml.value.Value;
import work.shellformats.toml.value.Value.ListValue;

/**
 * Converts a list into a TOML array, element by element in list order.
 */
public final class ListEncoder {
    private static final Logger LOGGER = LoggerFactory.getLogger(ListEncoder.class);

    private final ValueClassifier classifier;
    private final CancellationToken cancellationToken;

    ListEncoder(ValueClassifier classifier, CancellationToken cancellationToken) {
        this.classifier = classifier;
        this.cancellationToken = cancellationToken;
    }

    /**
     * Single-table unwrap: an array holding exactly one table is replaced by that table.
     * Any other array, including one of two or more tables, is returned unchanged.
     */
    public static DocValue unwrapSingleTable(DocArray array) {
        if (array.size() == 1 && array.get(0).isTableShaped()) {
            return array.get(0);
        }
        return array;
    }

    DocValue encode(ListValue list, int depth) {
        return unwrapSingleTable(toArray(list, depth, false));
    }

    /**
     * Same as {@link #encode} for the outermost list, checking for cancellation before each row.
     */
    DocValue encodeRoot(ListValue list) {
        DocArray array = toArray(list, classifier.enter(list, 0), true);
        DocValue result = unwrapSingleTable(array);
        if (result != array) {
            LOGGER.debug("Unwrapped single-row table into a document root");
        }
        return result;
    }

    private DocArray toArray(ListValue list, int depth, boolean pollCancellation) {
        List<DocValue> items = new ArrayList<>(list.vals().size());
        for (Value element : list.vals()) {
            if (pollCancellation && cancellationToken.isCancelled()) {
                throw new ConversionCancelledException(list.span());
            }
            items.add(classifier.classify(element, depth));
        }
        return new DocArray(items);
    }
}
