package work.shellformats.toml.convert;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.shellformats.toml.api.ConversionOptions;
import work.shellformats.toml.doc.DocValue;
import work.shellformats.toml.doc.DocValue.DocArray;
import work.shellformats.toml.doc.DocValue.DocBoolean;
import work.shellformats.toml.doc.DocValue.DocFloat;
import work.shellformats.toml.doc.DocValue.DocInteger;
import work.shellformats.toml.doc.DocValue.DocString;
import work.shellformats.toml.error.NestingTooDeepException;
import work.shellformats.toml.error.UnsupportedValueException;
import work.shellformats.toml.value.PathMember;
import work.shellformats.toml.value.Value;
import work.shellformats.toml.value.Value.BinaryValue;
import work.shellformats.toml.value.Value.BoolValue;
import work.shellformats.toml.value.Value.CellPathValue;
import work.shellformats.toml.value.Value.DateValue;
import work.shellformats.toml.value.Value.DurationValue;
import work.shellformats.toml.value.Value.ErrorValue;
import work.shellformats.toml.value.Value.FileSizeValue;
import work.shellformats.toml.value.Value.FloatValue;
import work.shellformats.toml.value.Value.IntValue;
import work.shellformats.toml.value.Value.ListValue;
import work.shellformats.toml.value.Value.RecordValue;
import work.shellformats.toml.value.Value.StringValue;

/**
 * Maps one pipeline value to its TOML counterpart, recursing through records and lists.
 *
 * <p>Values TOML cannot represent become placeholder strings unless the options ask for strict
 * conversion. Error values are never rendered: the error they carry is rethrown as is.
 */
public final class ValueClassifier {
    public static final String RANGE_PLACEHOLDER = "<Range>";
    public static final String BLOCK_PLACEHOLDER = "<Block>";
    public static final String NOTHING_PLACEHOLDER = "<Nothing>";
    public static final String CUSTOM_PLACEHOLDER = "<Custom Value>";

    private static final Logger LOGGER = LoggerFactory.getLogger(ValueClassifier.class);

    private final ConversionOptions options;
    private final RecordEncoder records;
    private final ListEncoder lists;

    public ValueClassifier(ConversionOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.records = new RecordEncoder(this);
        this.lists = new ListEncoder(this, options.cancellationToken());
    }

    public DocValue classify(Value value) {
        return classify(value, 0);
    }

    RecordEncoder records() {
        return records;
    }

    ListEncoder lists() {
        return lists;
    }

    /**
     * @param depth number of containers enclosing {@code value}
     */
    DocValue classify(Value value, int depth) {
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Classifying {} at depth {}", value.type(), depth);
        }
        return switch (value.type()) {
            case BOOL -> new DocBoolean(((BoolValue) value).val());
            case INT -> new DocInteger(((IntValue) value).val());
            case FLOAT -> new DocFloat(((FloatValue) value).val());
            case STRING -> new DocString(((StringValue) value).val());
            case FILESIZE -> new DocInteger(((FileSizeValue) value).val());
            case DURATION -> new DocString(((DurationValue) value).val().toString());
            case DATE -> new DocString(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(((DateValue) value).val()));
            case BINARY -> binaryToArray((BinaryValue) value);
            case CELL_PATH -> cellPathToArray((CellPathValue) value);
            case RANGE -> placeholder(value, RANGE_PLACEHOLDER);
            case BLOCK -> placeholder(value, BLOCK_PLACEHOLDER);
            case NOTHING -> placeholder(value, NOTHING_PLACEHOLDER);
            case CUSTOM -> placeholder(value, CUSTOM_PLACEHOLDER);
            case ERROR -> throw ((ErrorValue) value).error();
            case RECORD -> records.encode((RecordValue) value, enter(value, depth));
            case LIST -> lists.encode((ListValue) value, enter(value, depth));
        };
    }

    /**
     * Returns the depth of the children of {@code container}, refusing to go past the configured limit.
     */
    int enter(Value container, int depth) {
        int childDepth = depth + 1;
        if (childDepth > options.maxDepth()) {
            throw new NestingTooDeepException(options.maxDepth(), container.span());
        }
        return childDepth;
    }

    private DocValue placeholder(Value value, String text) {
        if (options.strict()) {
            throw new UnsupportedValueException(value.typeName(), value.span());
        }
        return new DocString(text);
    }

    private static DocArray binaryToArray(BinaryValue binary) {
        List<DocValue> bytes = new ArrayList<>(binary.length());
        for (int i = 0; i < binary.length(); i++) {
            bytes.add(new DocInteger(binary.unsignedAt(i)));
        }
        return new DocArray(bytes);
    }

    private static DocArray cellPathToArray(CellPathValue path) {
        List<DocValue> members = new ArrayList<>(path.members().size());
        for (PathMember member : path.members()) {
            if (member instanceof PathMember.Key key) {
                members.add(new DocString(key.name()));
            } else if (member instanceof PathMember.Index index) {
                members.add(new DocInteger(index.index()));
            }
        }
        return new DocArray(members);
    }
}
