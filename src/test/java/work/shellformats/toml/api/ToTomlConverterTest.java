package work.shellformats.toml.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.shellformats.toml.doc.DocValue;
import work.shellformats.toml.doc.DocValue.DocArray;
import work.shellformats.toml.doc.DocValue.DocInteger;
import work.shellformats.toml.doc.DocValue.DocString;
import work.shellformats.toml.doc.DocValue.InlineTable;
import work.shellformats.toml.doc.DocValue.Table;
import work.shellformats.toml.error.CantConvertException;
import work.shellformats.toml.error.EmbeddedParseException;
import work.shellformats.toml.error.ShapeException;
import work.shellformats.toml.error.ShellException;
import work.shellformats.toml.value.Span;
import work.shellformats.toml.value.Value;
import work.shellformats.toml.value.Value.DurationValue;
import work.shellformats.toml.value.Value.FileSizeValue;
import work.shellformats.toml.value.Value.RecordValue;
import work.shellformats.toml.value.Value.StringValue;

class ToTomlConverterTest {
    private final ToTomlConverter converter = new ToTomlConverter();

    private static RecordValue row(String key, long value) {
        return RecordValue.builder().put(key, Value.integer(value)).build();
    }

    private static RecordValue sample() {
        return RecordValue.builder()
            .put("rust", Value.string("editor"))
            .put("is", Value.nothing())
            .put("features", Value.list(Value.string("hello"), Value.string("array")))
            .put("size", new FileSizeValue(2048, Span.unknown()))
            .put("timeout", new DurationValue(Duration.ofSeconds(30), Span.unknown()))
            .put("bytes", Value.binary((byte) 1, (byte) 2, (byte) 3))
            .put("owner", RecordValue.builder()
                .put("name", Value.string("Tom"))
                .put("active", Value.bool(true))
                .put("score", Value.floating(9.5))
                .build())
            .build();
    }

    @Test
    void recordConvertsToInlineTableWithSameKeys() {
        var table = assertInstanceOf(InlineTable.class, converter.toDocument(sample()));
        assertEquals(sample().cols(), table.keys());
        assertEquals(new DocArray(List.of(new DocString("hello"), new DocString("array"))), table.get("features"));
        assertEquals(new DocString("<Nothing>"), table.get("is"));
        assertEquals(new DocInteger(2048), table.get("size"));
        assertEquals(new DocString("PT30S"), table.get("timeout"));
    }

    @Test
    void singleRowTableRendersLikeItsRecord() {
        assertEquals(converter.toToml(row("a", 1)), converter.toToml(Value.list(row("a", 1))));
    }

    @Test
    void multiRowTableIsNeverUnwrapped() {
        var array = assertInstanceOf(DocArray.class, converter.toDocument(Value.list(row("a", 1), row("b", 2))));
        assertEquals(2, array.size());
    }

    @Test
    void multiRowTableNeedsARootKeyToRender() {
        var rows = Value.list(row("a", 1), row("b", 2));
        var ex = assertThrows(CantConvertException.class, () -> converter.toToml(rows));
        assertEquals("table", ex.fromType());

        var keyed = new ToTomlConverter(ConversionOptions.builder().rootArrayKey("rows").build());
        var reparsed = assertInstanceOf(Table.class, keyed.toDocument(Value.string(keyed.toToml(rows))));
        assertEquals(converter.toDocument(rows), reparsed.get("rows"));
    }

    @Test
    void scalarAndScalarListRootsAreShapeErrors() {
        assertThrows(ShapeException.class, () -> converter.toToml(Value.integer(42)));
        assertThrows(ShapeException.class, () -> converter.toToml(Value.list(Value.integer(1), Value.integer(2), Value.integer(3))));
    }

    @Test
    void tomlTextMatchesDirectlyBuiltRecord() {
        String fromText = converter.toToml(Value.string("title = \"x\""));
        String fromRecord = converter.toToml(RecordValue.builder().put("title", Value.string("x")).build());
        assertEquals(fromRecord, fromText);

        var table = assertInstanceOf(Table.class, converter.toDocument(Value.string("title = \"x\"")));
        assertEquals(new DocString("x"), table.get("title"));
    }

    @Test
    void malformedTomlTextIsAnEmbeddedParseError() {
        var span = new Span(0, 9);
        var ex = assertThrows(EmbeddedParseException.class, () -> converter.toToml(new StringValue("not valid", span)));
        assertEquals(span, ex.span());
    }

    @Test
    void renderedOutputParsesBackToTheSameTree() {
        DocValue first = converter.toDocument(sample());
        String text = converter.toToml(sample());

        var second = assertInstanceOf(Table.class, converter.toDocument(Value.string(text)));
        assertEquals(((InlineTable) first).entries(), second.entries());
    }

    @Test
    void renderingIsDeterministic() {
        assertEquals(converter.toToml(sample()), converter.toToml(sample()));
    }

    @Test
    void errorAnywhereFailsTheWholeCall() {
        var failure = new ShellException("upstream", "column not found", new Span(7, 12));
        var root = RecordValue.builder()
            .put("ok", Value.integer(1))
            .put("nested", RecordValue.builder().put("bad", Value.error(failure)).build())
            .build();

        assertSame(failure, assertThrows(ShellException.class, () -> converter.toToml(root)));
        assertSame(failure, assertThrows(ShellException.class, () -> converter.toToml(Value.error(failure))));
    }

    @Test
    void strictOptionRejectsPlaceholders() {
        var strict = new ToTomlConverter(ConversionOptions.builder().strict(true).build());
        var ex = assertThrows(CantConvertException.class, () -> strict.toToml(sample()));
        assertEquals("nothing", ex.fromType());
        assertTrue(converter.toToml(sample()).contains("<Nothing>"));
    }

    @Test
    void optionsRejectNonsense() {
        assertThrows(IllegalArgumentException.class, () -> ConversionOptions.builder().maxDepth(0).build());
        assertThrows(IllegalArgumentException.class, () -> ConversionOptions.builder().rootArrayKey(" ").build());
    }

    @Test
    void emptyRecordAndSingleEmptyRowGiveEmptyDocument() {
        assertEquals("", converter.toToml(RecordValue.builder().build()));
        assertEquals("", converter.toToml(Value.list(RecordValue.builder().build())));
    }

    @Test
    void nonFiniteFloatsSurviveTheRoundTrip() {
        var input = RecordValue.builder()
            .put("nan", Value.floating(Double.NaN))
            .put("inf", Value.floating(Double.POSITIVE_INFINITY))
            .put("neg", Value.floating(Double.NEGATIVE_INFINITY))
            .build();
        String text = converter.toToml(input);

        var reparsed = assertInstanceOf(Table.class, converter.toDocument(Value.string(text)));
        assertEquals(converter.toDocument(input), new InlineTable(reparsed.entries()));
    }
}
