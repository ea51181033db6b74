package work.shellformats.toml.error;

import java.util.Objects;
import work.shellformats.toml.value.Span;

/**
 * Pipeline error carrying a machine-readable code and the source span it points at.
 */
public class ShellException extends RuntimeException {
    private final String code;
    private final Span span;

    public ShellException(String code, String message, Span span) {
        this(code, message, span, null);
    }

    public ShellException(String code, String message, Span span, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.span = span == null ? Span.unknown() : span;
    }

    public String code() {
        return code;
    }

    public Span span() {
        return span;
    }
}
