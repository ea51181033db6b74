package work.shellformats.toml.error;

import work.shellformats.toml.value.Span;

/**
 * Raised in strict mode for values that would otherwise become placeholder strings.
 */
public final class UnsupportedValueException extends CantConvertException {
    public UnsupportedValueException(String fromType, Span span) {
        super("TOML", fromType, span);
    }
}
