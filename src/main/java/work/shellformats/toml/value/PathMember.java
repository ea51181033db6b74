package work.shellformats.toml.value;

import java.util.Objects;

/**
 * One step of a cell path: either a column name or a row index.
 */
public sealed interface PathMember {
    Span span();

    static PathMember key(String name) {
        return new Key(name, Span.unknown());
    }

    static PathMember index(long index) {
        return new Index(index, Span.unknown());
    }

    record Key(String name, Span span) implements PathMember {
        public Key {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(span, "span");
        }
    }

    record Index(long index, Span span) implements PathMember {
        public Index {
            Objects.requireNonNull(span, "span");
        }
    }
}
