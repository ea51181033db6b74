package work.shellformats.toml.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.shellformats.toml.api.ConversionOptions;
import work.shellformats.toml.api.LogLevel;
import work.shellformats.toml.command.CommandContext;
import work.shellformats.toml.command.CommandRegistry;
import work.shellformats.toml.command.ToTomlCommand;
import work.shellformats.toml.value.Span;
import work.shellformats.toml.value.Value;
import work.shellformats.toml.value.Value.StringValue;

@CommandLine.Command(
    name = "to-toml",
    description = "Convert a structured value (JSON or YAML) into TOML text.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ToTomlCli implements Callable<Integer> {
    private final InputStream stdin;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "PATH|-",
        description = "Input file; use '-' to read from stdin.",
        defaultValue = "-"
    )
    private String input;

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Input format (json|yaml).",
        defaultValue = "json"
    )
    private String format;

    @CommandLine.Option(
        names = "--text",
        description = "Treat the input as TOML text to normalize instead of structured data."
    )
    private boolean text;

    @CommandLine.Option(
        names = "--strict",
        description = "Fail on ranges, blocks, nothing and custom values instead of writing placeholders."
    )
    private boolean strict;

    @CommandLine.Option(
        names = "--max-depth",
        description = "Deepest record/list nesting accepted.",
        defaultValue = "" + ConversionOptions.DEFAULT_MAX_DEPTH
    )
    private int maxDepth;

    @CommandLine.Option(
        names = "--root-key",
        description = "Key to write a multi-row table under (a TOML document cannot be a bare array).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String rootKey;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = "warn"
    )
    private String logLevelRaw;

    ToTomlCli() {
        this(System.in);
    }

    ToTomlCli(InputStream stdin) {
        this.stdin = stdin;
    }

    @Override
    public Integer call() throws Exception {
        LogConfigurator.apply(LogLevel.from(logLevelRaw));

        String raw = loadInput();
        Value value = text ? InputReader.readText(raw) : readStructured(raw);

        var options = ConversionOptions.builder()
            .strict(strict)
            .maxDepth(maxDepth)
            .rootArrayKey(rootKey)
            .build();
        var registry = new CommandRegistry().register(new ToTomlCommand(options));
        var ctx = new CommandContext(registry);

        Value output = ctx.call(ToTomlCommand.NAME, Span.unknown(), value);
        if (!(output instanceof StringValue rendered)) {
            throw new IllegalStateException("to toml returned " + output.typeName());
        }
        var out = spec.commandLine().getOut();
        out.print(rendered.val());
        out.flush();
        return 0;
    }

    private Value readStructured(String raw) {
        try {
            return InputReader.read(raw, InputReader.Format.from(format));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to parse input: " + ex.getMessage(), ex);
        }
    }

    private String loadInput() throws IOException {
        if ("-".equals(input)) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        Path path = Path.of(input).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Input file not found: " + path);
        }
        return Files.readString(path);
    }
}
