package work.shellformats.toml.error;

import work.shellformats.toml.value.Span;

/**
 * A root string was expected to hold a TOML document but failed to parse.
 */
public final class EmbeddedParseException extends ShellException {
    private final String detail;

    public EmbeddedParseException(String message, String detail, Span span) {
        super("embedded_parse_error", message, span);
        this.detail = detail;
    }

    /**
     * First diagnostic reported by the TOML parser.
     */
    public String detail() {
        return detail;
    }
}
