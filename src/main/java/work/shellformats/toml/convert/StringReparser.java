package work.shellformats.toml.convert;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.shellformats.toml.doc.DocValue;
import work.shellformats.toml.doc.DocValue.DocArray;
import work.shellformats.toml.doc.DocValue.DocBoolean;
import work.shellformats.toml.doc.DocValue.DocFloat;
import work.shellformats.toml.doc.DocValue.DocInteger;
import work.shellformats.toml.doc.DocValue.DocString;
import work.shellformats.toml.doc.DocValue.InlineTable;
import work.shellformats.toml.doc.DocValue.Table;
import work.shellformats.toml.api.ConversionOptions;
import work.shellformats.toml.error.EmbeddedParseException;
import work.shellformats.toml.error.NestingTooDeepException;
import work.shellformats.toml.value.Span;
import work.shellformats.toml.value.Value.StringValue;

/**
 * Treats a root string as an already serialized TOML document and parses it back into a table.
 *
 * <p>TOML date and time values have no counterpart in the document model and are kept as their
 * ISO-8601 text. Parsed documents are held to the same nesting limit as pipeline values.
 */
public final class StringReparser {
    private static final Logger LOGGER = LoggerFactory.getLogger(StringReparser.class);
    private static final int QUOTE_LIMIT = 40;

    private final int maxDepth;

    public StringReparser() {
        this(ConversionOptions.DEFAULT_MAX_DEPTH);
    }

    public StringReparser(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public Table reparse(StringValue text) {
        TomlParseResult result;
        try {
            result = Toml.parse(text.val());
        } catch (StackOverflowError ex) {
            LOGGER.debug("Root string nests too deeply for the TOML parser");
            throw new EmbeddedParseException(
                quote(text.val()) + " unable to de-serialize string to TOML",
                "nesting exceeds the parser's stack",
                text.span()
            );
        }
        if (result.hasErrors()) {
            String detail = result.errors().get(0).toString();
            LOGGER.debug("Root string is not TOML: {}", detail);
            throw new EmbeddedParseException(
                quote(text.val()) + " unable to de-serialize string to TOML",
                detail,
                text.span()
            );
        }
        return new Table(readEntries(result, enter(0, text.span()), text.span()));
    }

    /**
     * Converts a parsed tomlj table into a document table, for callers that parse TOML themselves.
     */
    public Table fromToml(TomlTable table) {
        return new Table(readEntries(table, enter(0, Span.unknown()), Span.unknown()));
    }

    private Map<String, DocValue> readEntries(TomlTable table, int depth, Span span) {
        Map<String, DocValue> entries = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            entries.put(key, readValue(table.get(List.of(key)), depth, span));
        }
        return entries;
    }

    private int enter(int depth, Span span) {
        if (depth + 1 > maxDepth) {
            throw new NestingTooDeepException(maxDepth, span);
        }
        return depth + 1;
    }

    private DocValue readValue(Object value, int depth, Span span) {
        if (value instanceof TomlTable table) {
            return new InlineTable(readEntries(table, enter(depth, span), span));
        }
        if (value instanceof TomlArray array) {
            int inner = enter(depth, span);
            List<DocValue> items = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                items.add(readValue(array.get(i), inner, span));
            }
            return new DocArray(items);
        }
        if (value instanceof String str) {
            return new DocString(str);
        }
        if (value instanceof Long number) {
            return new DocInteger(number);
        }
        if (value instanceof Double number) {
            return new DocFloat(number);
        }
        if (value instanceof Boolean bool) {
            return new DocBoolean(bool);
        }
        if (value instanceof OffsetDateTime dateTime) {
            return new DocString(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(dateTime));
        }
        if (value instanceof LocalDateTime dateTime) {
            return new DocString(DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(dateTime));
        }
        if (value instanceof LocalDate date) {
            return new DocString(DateTimeFormatter.ISO_LOCAL_DATE.format(date));
        }
        if (value instanceof LocalTime time) {
            return new DocString(DateTimeFormatter.ISO_LOCAL_TIME.format(time));
        }
        throw new IllegalStateException("Unexpected TOML value: " + (value == null ? "null" : value.getClass()));
    }

    private static String quote(String text) {
        String shown = text.codePointCount(0, text.length()) > QUOTE_LIMIT
            ? text.substring(0, text.offsetByCodePoints(0, QUOTE_LIMIT)) + "..."
            : text;
        return '"' + shown.replace("\"", "\\\"") + '"';
    }
}
