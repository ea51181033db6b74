package work.shellformats.toml.api;

import java.util.Objects;
import work.shellformats.toml.convert.StringReparser;
import work.shellformats.toml.convert.TomlEmitter;
import work.shellformats.toml.convert.TopLevelGate;
import work.shellformats.toml.convert.ValueClassifier;
import work.shellformats.toml.doc.DocValue;
import work.shellformats.toml.value.Value;

/**
 * Public entry point: turns one pipeline value into a TOML document.
 *
 * <p>Conversions are read-only over the input and keep no state between calls. Failures are
 * reported as {@link work.shellformats.toml.error.ShellException} subclasses, or as the very
 * exception carried by an error value found in the input.
 */
public final class ToTomlConverter {
    private final ConversionOptions options;
    private final TopLevelGate gate;
    private final TomlEmitter emitter;

    public ToTomlConverter() {
        this(ConversionOptions.defaults());
    }

    public ToTomlConverter(ConversionOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.gate = new TopLevelGate(new ValueClassifier(options), new StringReparser(options.maxDepth()));
        this.emitter = new TomlEmitter(options.rootArrayKey());
    }

    public ConversionOptions options() {
        return options;
    }

    /**
     * Builds the document tree without rendering it.
     */
    public DocValue toDocument(Value input) {
        return gate.convert(Objects.requireNonNull(input, "input"));
    }

    public String toToml(Value input) {
        DocValue document = toDocument(input);
        return emitter.emit(document, input.typeName(), input.span());
    }
}
