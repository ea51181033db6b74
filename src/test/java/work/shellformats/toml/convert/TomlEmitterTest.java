package work.shellformats.toml.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.shellformats.toml.doc.DocValue;
import work.shellformats.toml.doc.DocValue.DocArray;
import work.shellformats.toml.doc.DocValue.DocBoolean;
import work.shellformats.toml.doc.DocValue.DocFloat;
import work.shellformats.toml.doc.DocValue.DocInteger;
import work.shellformats.toml.doc.DocValue.DocString;
import work.shellformats.toml.doc.DocValue.InlineTable;
import work.shellformats.toml.doc.DocValue.Table;
import work.shellformats.toml.error.CantConvertException;
import work.shellformats.toml.value.Span;

class TomlEmitterTest {
    private final TomlEmitter emitter = new TomlEmitter(Optional.empty());

    private static Table parse(String text) {
        TomlParseResult result = Toml.parse(text);
        assertFalse(result.hasErrors(), () -> result.errors() + " in:\n" + text);
        return new StringReparser().fromToml(result);
    }

    @Test
    void writesScalarsThatParseBack() {
        Map<String, DocValue> entries = new LinkedHashMap<>();
        entries.put("name", new DocString("quote \" and 'apostrophe'\nnewline"));
        entries.put("count", new DocInteger(Long.MAX_VALUE));
        entries.put("ratio", new DocFloat(0.25));
        entries.put("enabled", new DocBoolean(true));
        var root = new InlineTable(entries);

        String text = emitter.emit(root, "record", Span.unknown());
        assertEquals(root.entries(), parse(text).entries());
    }

    @Test
    void writesNestedTablesAndArrays() {
        var rows = new DocArray(List.of(
            new InlineTable(Map.of("id", new DocInteger(1))),
            new InlineTable(Map.of("id", new DocInteger(2)))
        ));
        var owner = new InlineTable(Map.of("name", new DocString("Tom"), "tags", new DocArray(List.of(new DocString("a")))));
        Map<String, DocValue> entries = new LinkedHashMap<>();
        entries.put("owner", owner);
        entries.put("rows", rows);
        entries.put("bytes", new DocArray(List.of(new DocInteger(0), new DocInteger(255))));
        var root = new InlineTable(entries);

        String text = emitter.emit(root, "record", Span.unknown());
        assertEquals(root.entries(), parse(text).entries());
    }

    @Test
    void refusesBareArrayRoot() {
        var array = new DocArray(List.of(
            new InlineTable(Map.of("a", new DocInteger(1))),
            new InlineTable(Map.of("b", new DocInteger(2)))
        ));
        var ex = assertThrows(CantConvertException.class, () -> emitter.emit(array, "table", new Span(0, 4)));
        assertEquals("Can't convert table to TOML", ex.getMessage());
        assertEquals(new Span(0, 4), ex.span());
    }

    @Test
    void writesBareArrayRootUnderConfiguredKey() {
        var array = new DocArray(List.of(
            new InlineTable(Map.of("a", new DocInteger(1))),
            new InlineTable(Map.of("b", new DocInteger(2)))
        ));
        String text = new TomlEmitter(Optional.of("rows")).emit(array, "table", Span.unknown());
        assertEquals(array, parse(text).get("rows"));
    }

    @Test
    void writesNonFiniteFloatsInTomlSpelling() {
        Map<String, DocValue> entries = new LinkedHashMap<>();
        entries.put("nan", new DocFloat(Double.NaN));
        entries.put("up", new DocFloat(Double.POSITIVE_INFINITY));
        entries.put("down", new DocFloat(Double.NEGATIVE_INFINITY));
        entries.put("list", new DocArray(List.of(new DocFloat(Double.NaN), new DocFloat(1.5))));
        var root = new InlineTable(entries);

        String text = emitter.emit(root, "record", Span.unknown());
        assertTrue(text.contains("nan = nan"), text);
        assertTrue(text.contains("up = inf"), text);
        assertTrue(text.contains("down = -inf"), text);
        assertEquals(root.entries(), parse(text).entries());
    }

    @Test
    void emptyRootTableIsAnEmptyDocument() {
        String text = emitter.emit(new InlineTable(Map.of()), "record", Span.unknown());
        assertEquals("", text);
        assertTrue(parse(text).entries().isEmpty());
    }
}
