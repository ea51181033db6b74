package work.shellformats.toml.error;

import work.shellformats.toml.value.Span;

public class CantConvertException extends ShellException {
    private final String toType;
    private final String fromType;

    public CantConvertException(String toType, String fromType, Span span) {
        this(toType, fromType, span, null);
    }

    public CantConvertException(String toType, String fromType, Span span, Throwable cause) {
        super("cant_convert", "Can't convert " + fromType + " to " + toType, span, cause);
        this.toType = toType;
        this.fromType = fromType;
    }

    public String toType() {
        return toType;
    }

    public String fromType() {
        return fromType;
    }
}
