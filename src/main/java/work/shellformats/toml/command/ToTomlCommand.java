package work.shellformats.toml.command;

import java.util.List;
import java.util.Optional;
import work.shellformats.toml.api.ConversionOptions;
import work.shellformats.toml.api.ToTomlConverter;
import work.shellformats.toml.value.Span;
import work.shellformats.toml.value.Value;
import work.shellformats.toml.value.Value.RecordValue;
import work.shellformats.toml.value.Value.StringValue;

/**
 * {@code to toml}: renders the piped value as TOML text.
 */
public final class ToTomlCommand implements PipelineCommand {
    public static final String NAME = "to toml";

    private final ConversionOptions defaults;

    public ToTomlCommand() {
        this(ConversionOptions.defaults());
    }

    /**
     * @param defaults options for every run; the cancellation token is replaced by the run's own
     */
    public ToTomlCommand(ConversionOptions defaults) {
        this.defaults = defaults;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String usage() {
        return "Convert table into .toml text";
    }

    @Override
    public String category() {
        return "formats";
    }

    @Override
    public List<CommandExample> examples() {
        Value row = RecordValue.builder()
            .put("foo", Value.string("1"))
            .put("bar", Value.string("2"))
            .build();
        return List.of(new CommandExample(
            "Outputs an TOML string representing the contents of this table",
            "[[foo bar]; [\"1\" \"2\"]] | to toml",
            Value.list(row),
            Optional.of(Value.string("foo = \"1\"\nbar = \"2\"\n"))
        ));
    }

    @Override
    public Value run(CommandContext ctx, Span head, Value input) {
        var converter = new ToTomlConverter(defaults.withCancellationToken(ctx.cancellationToken()));
        String text = converter.toToml(input);
        return new StringValue(text, head);
    }
}
