package work.shellformats.toml.value;

/**
 * Byte offsets of a value in the pipeline source it came from.
 */
public record Span(int start, int end) {
    private static final Span UNKNOWN = new Span(0, 0);

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span: " + start + ".." + end);
        }
    }

    public static Span unknown() {
        return UNKNOWN;
    }

    public boolean isUnknown() {
        return start == 0 && end == 0;
    }

    @Override
    public String toString() {
        return isUnknown() ? "unknown" : start + ".." + end;
    }
}
