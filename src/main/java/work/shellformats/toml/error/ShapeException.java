package work.shellformats.toml.error;

import work.shellformats.toml.value.Span;

/**
 * The root value cannot become a TOML document (not a record, not a table, not TOML text).
 */
public final class ShapeException extends ShellException {
    public ShapeException(String message, Span span) {
        super("unsupported_input", message, span);
    }
}
