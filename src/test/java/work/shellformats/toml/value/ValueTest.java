package work.shellformats.toml.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.shellformats.toml.error.ShellException;
import work.shellformats.toml.value.Value.BinaryValue;
import work.shellformats.toml.value.Value.RecordValue;

class ValueTest {
    @Test
    void recordRejectsDuplicateColumns() {
        assertThrows(IllegalArgumentException.class, () -> RecordValue.builder()
            .put("a", Value.integer(1))
            .put("a", Value.integer(2))
            .build());
    }

    @Test
    void recordRejectsMismatchedLengths() {
        assertThrows(
            IllegalArgumentException.class,
            () -> new RecordValue(List.of("a", "b"), List.of(Value.integer(1)), Span.unknown())
        );
    }

    @Test
    void recordLookupByColumn() {
        var record = RecordValue.builder().put("a", Value.integer(1)).build();
        assertEquals(Value.integer(1), record.get("a"));
        assertNull(record.get("b"));
    }

    @Test
    void tableIsAListOfRecords() {
        var row = RecordValue.builder().put("a", Value.integer(1)).build();
        assertEquals("table", Value.list(row, row).typeName());
        assertEquals("list", Value.list(row, Value.integer(1)).typeName());
        assertEquals("list", Value.list().typeName());
    }

    @Test
    void binaryIsDefensivelyCopied() {
        byte[] raw = {1, 2};
        var binary = new BinaryValue(raw, Span.unknown());
        raw[0] = 9;
        assertEquals(1, binary.unsignedAt(0));
        assertEquals(new BinaryValue(new byte[] {1, 2}, Span.unknown()), binary);
    }

    @Test
    void errorValueUsesItsErrorSpan() {
        var error = Value.error(new ShellException("x", "x", new Span(2, 3)));
        assertEquals(new Span(2, 3), error.span());
        assertEquals(ValueType.ERROR, error.type());
    }

    @Test
    void spanRejectsBackwardsRange() {
        assertThrows(IllegalArgumentException.class, () -> new Span(5, 2));
        assertEquals("unknown", Span.unknown().toString());
    }
}
