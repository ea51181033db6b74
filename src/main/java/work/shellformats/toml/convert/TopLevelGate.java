package work.shellformats.toml.convert;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.shellformats.toml.doc.DocValue;
import work.shellformats.toml.error.ShapeException;
import work.shellformats.toml.value.Value;
import work.shellformats.toml.value.Value.ErrorValue;
import work.shellformats.toml.value.Value.ListValue;
import work.shellformats.toml.value.Value.RecordValue;
import work.shellformats.toml.value.Value.StringValue;

/**
 * Checks that the pipeline input can be the root of a TOML document and routes it to the right encoder.
 *
 * <p>Accepted roots are a record, a non-empty list of records, or a string holding TOML text.
 * The check runs before any conversion work.
 */
public final class TopLevelGate {
    private static final Logger LOGGER = LoggerFactory.getLogger(TopLevelGate.class);

    private final ValueClassifier classifier;
    private final StringReparser reparser;

    public TopLevelGate(ValueClassifier classifier, StringReparser reparser) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.reparser = Objects.requireNonNull(reparser, "reparser");
    }

    public DocValue convert(Value root) {
        LOGGER.debug("Converting {} root at {}", root.typeName(), root.span());
        if (root instanceof ErrorValue error) {
            throw error.error();
        }
        if (root instanceof RecordValue record) {
            return classifier.records().encode(record, classifier.enter(record, 0));
        }
        if (root instanceof ListValue list) {
            requireRows(list);
            return classifier.lists().encodeRoot(list);
        }
        if (root instanceof StringValue text) {
            return reparser.reparse(text);
        }
        throw new ShapeException(root.typeName() + " is not a valid top-level TOML value", root.span());
    }

    private static void requireRows(ListValue list) {
        if (list.vals().isEmpty()) {
            throw new ShapeException(
                "Expected a table with TOML-compatible structure from pipeline, found an empty list",
                list.span()
            );
        }
        for (int i = 0; i < list.vals().size(); i++) {
            Value row = list.vals().get(i);
            if (row instanceof RecordValue) {
                continue;
            }
            if (row instanceof ErrorValue error) {
                throw error.error();
            }
            throw new ShapeException(
                "Expected a table with TOML-compatible structure from pipeline, found "
                    + row.typeName() + " at row " + i,
                list.span()
            );
        }
    }
}
