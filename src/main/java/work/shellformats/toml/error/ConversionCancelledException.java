package work.shellformats.toml.error;

import work.shellformats.toml.value.Span;

public final class ConversionCancelledException extends ShellException {
    public ConversionCancelledException(Span span) {
        super("interrupted", "Conversion cancelled", span);
    }
}
