package work.shellformats.toml.value;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import work.shellformats.toml.error.ShellException;

/**
 * Structured value flowing between pipeline commands.
 *
 * <p>The set of kinds is closed; {@link #type()} identifies the kind of any instance so callers can
 * dispatch with an exhaustive {@code switch}. Values are immutable.
 */
public sealed interface Value {
    ValueType type();

    Span span();

    /**
     * Name used in messages. Lists of records read as {@code table}, as they do in the shell.
     */
    default String typeName() {
        return type().displayName();
    }

    static Value bool(boolean val) {
        return new BoolValue(val, Span.unknown());
    }

    static Value integer(long val) {
        return new IntValue(val, Span.unknown());
    }

    static Value floating(double val) {
        return new FloatValue(val, Span.unknown());
    }

    static Value string(String val) {
        return new StringValue(val, Span.unknown());
    }

    static Value binary(byte... val) {
        return new BinaryValue(val, Span.unknown());
    }

    static Value nothing() {
        return new NothingValue(Span.unknown());
    }

    static Value list(Value... vals) {
        return new ListValue(List.of(vals), Span.unknown());
    }

    static Value error(ShellException error) {
        return new ErrorValue(error);
    }

    record BoolValue(boolean val, Span span) implements Value {
        public BoolValue {
            Objects.requireNonNull(span, "span");
        }

        @Override
        public ValueType type() {
            return ValueType.BOOL;
        }
    }

    record IntValue(long val, Span span) implements Value {
        public IntValue {
            Objects.requireNonNull(span, "span");
        }

        @Override
        public ValueType type() {
            return ValueType.INT;
        }
    }

    record FloatValue(double val, Span span) implements Value {
        public FloatValue {
            Objects.requireNonNull(span, "span");
        }

        @Override
        public ValueType type() {
            return ValueType.FLOAT;
        }
    }

    record StringValue(String val, Span span) implements Value {
        public StringValue {
            Objects.requireNonNull(val, "val");
            Objects.requireNonNull(span, "span");
        }

        @Override
        public ValueType type() {
            return ValueType.STRING;
        }
    }

    record BinaryValue(byte[] val, Span span) implements Value {
        public BinaryValue {
            val = Objects.requireNonNull(val, "val").clone();
            Objects.requireNonNull(span, "span");
        }

        @Override
        public byte[] val() {
            return val.clone();
        }

        public int length() {
            return val.length;
        }

        /**
         * Unsigned byte at {@code index}, in {@code [0, 255]}.
         */
        public int unsignedAt(int index) {
            return Byte.toUnsignedInt(val[index]);
        }

        @Override
        public ValueType type() {
            return ValueType.BINARY;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof BinaryValue that && Arrays.equals(val, that.val) && span.equals(that.span);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(val) + span.hashCode();
        }

        @Override
        public String toString() {
            return "BinaryValue[val=" + Arrays.toString(val) + ", span=" + span + "]";
        }
    }

    record DurationValue(java.time.Duration val, Span span) implements Value {
        public DurationValue {
            Objects.requireNonNull(val, "val");
            Objects.requireNonNull(span, "span");
        }

        @Override
        public ValueType type() {
            return ValueType.DURATION;
        }
    }

    record DateValue(OffsetDateTime val, Span span) implements Value {
        public DateValue {
            Objects.requireNonNull(val, "val");
            Objects.requireNonNull(span, "span");
        }

        @Override
        public ValueType type() {
            return ValueType.DATE;
        }
    }

    /**
     * Size in bytes.
     */
    record FileSizeValue(long val, Span span) implements Value {
        public FileSizeValue {
            Objects.requireNonNull(span, "span");
        }

        @Override
        public ValueType type() {
            return ValueType.FILESIZE;
        }
    }

    record RangeValue(long from, long to, boolean inclusive, Span span) implements Value {
        public RangeValue {
            Objects.requireNonNull(span, "span");
        }

        @Override
        public ValueType type() {
            return ValueType.RANGE;
        }
    }

    record ListValue(List<Value> vals, Span span) implements Value {
        public ListValue {
            vals = List.copyOf(vals);
            Objects.requireNonNull(span, "span");
        }

        public boolean isTable() {
            return !vals.isEmpty() && vals.stream().allMatch(v -> v instanceof RecordValue);
        }

        @Override
        public ValueType type() {
            return ValueType.LIST;
        }

        @Override
        public String typeName() {
            return isTable() ? "table" : "list";
        }
    }

    /**
     * Ordered record; {@code cols.get(i)} names {@code vals.get(i)}.
     */
    record RecordValue(List<String> cols, List<Value> vals, Span span) implements Value {
        public RecordValue {
            cols = List.copyOf(cols);
            vals = List.copyOf(vals);
            Objects.requireNonNull(span, "span");
            if (cols.size() != vals.size()) {
                throw new IllegalArgumentException(
                    "Record has " + cols.size() + " columns but " + vals.size() + " values"
                );
            }
            var seen = new HashSet<String>();
            for (String col : cols) {
                if (!seen.add(col)) {
                    throw new IllegalArgumentException("Duplicate record column: " + col);
                }
            }
        }

        public static Builder builder() {
            return new Builder();
        }

        public int size() {
            return cols.size();
        }

        public Value get(String col) {
            int index = cols.indexOf(col);
            return index < 0 ? null : vals.get(index);
        }

        @Override
        public ValueType type() {
            return ValueType.RECORD;
        }

        public static final class Builder {
            private final List<String> cols = new java.util.ArrayList<>();
            private final List<Value> vals = new java.util.ArrayList<>();
            private Span span = Span.unknown();

            public Builder put(String col, Value val) {
                cols.add(col);
                vals.add(val);
                return this;
            }

            public Builder span(Span span) {
                this.span = span;
                return this;
            }

            public RecordValue build() {
                return new RecordValue(cols, vals, span);
            }
        }
    }

    /**
     * Reference to a compiled closure; carries no data.
     */
    record BlockValue(int blockId, Span span) implements Value {
        public BlockValue {
            Objects.requireNonNull(span, "span");
        }

        @Override
        public ValueType type() {
            return ValueType.BLOCK;
        }
    }

    record NothingValue(Span span) implements Value {
        public NothingValue {
            Objects.requireNonNull(span, "span");
        }

        @Override
        public ValueType type() {
            return ValueType.NOTHING;
        }
    }

    /**
     * A failure produced upstream and carried as data.
     */
    record ErrorValue(ShellException error) implements Value {
        public ErrorValue {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public Span span() {
            return error.span();
        }

        @Override
        public ValueType type() {
            return ValueType.ERROR;
        }
    }

    record CellPathValue(List<PathMember> members, Span span) implements Value {
        public CellPathValue {
            members = List.copyOf(members);
            Objects.requireNonNull(span, "span");
        }

        @Override
        public ValueType type() {
            return ValueType.CELL_PATH;
        }
    }

    record CustomOpaqueValue(CustomValue val, Span span) implements Value {
        public CustomOpaqueValue {
            Objects.requireNonNull(val, "val");
            Objects.requireNonNull(span, "span");
        }

        @Override
        public ValueType type() {
            return ValueType.CUSTOM;
        }

        @Override
        public String typeName() {
            return val.typeName();
        }
    }
}
