package work.shellformats.toml.doc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value model of a TOML document: scalars, arrays, inline tables, and the root table.
 */
public sealed interface DocValue {
    /**
     * Whether this value is a table of either flavour.
     */
    default boolean isTableShaped() {
        return false;
    }

    record DocBoolean(boolean value) implements DocValue {}

    record DocInteger(long value) implements DocValue {}

    record DocFloat(double value) implements DocValue {}

    record DocString(String value) implements DocValue {
        public DocString {
            Objects.requireNonNull(value, "value");
        }
    }

    record DocArray(List<DocValue> items) implements DocValue {
        public DocArray {
            items = List.copyOf(items);
        }

        public int size() {
            return items.size();
        }

        public DocValue get(int index) {
            return items.get(index);
        }
    }

    /**
     * Table written as a value ({@code {a = 1}}); used for every non-root associative value.
     */
    record InlineTable(Map<String, DocValue> entries) implements DocValue, TableLike {
        public InlineTable {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public boolean isTableShaped() {
            return true;
        }
    }

    /**
     * Root table of a parsed document.
     */
    record Table(Map<String, DocValue> entries) implements DocValue, TableLike {
        public Table {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public boolean isTableShaped() {
            return true;
        }
    }

    /**
     * Shared view over both table flavours. Entry order is insertion order.
     */
    interface TableLike {
        Map<String, DocValue> entries();

        default List<String> keys() {
            return List.copyOf(entries().keySet());
        }

        default DocValue get(String key) {
            return entries().get(key);
        }
    }
}
