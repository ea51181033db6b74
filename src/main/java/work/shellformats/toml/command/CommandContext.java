package work.shellformats.toml.command;

import java.util.Objects;
import work.shellformats.toml.api.CancellationToken;
import work.shellformats.toml.error.ConversionCancelledException;
import work.shellformats.toml.value.Span;
import work.shellformats.toml.value.Value;

/**
 * Per-run state handed to commands: the registry they were resolved from and the cancellation flag.
 */
public final class CommandContext {
    private final CommandRegistry registry;
    private final CancellationToken cancellationToken;

    public CommandContext(CommandRegistry registry) {
        this(registry, new CancellationToken());
    }

    public CommandContext(CommandRegistry registry, CancellationToken cancellationToken) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.cancellationToken = cancellationToken == null ? new CancellationToken() : cancellationToken;
    }

    public CommandRegistry registry() {
        return registry;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public void cancel() {
        cancellationToken.cancel();
    }

    public void ensureNotCancelled(Span span) {
        if (cancellationToken.isCancelled()) {
            throw new ConversionCancelledException(span);
        }
    }

    /**
     * Looks up {@code name} and runs it on {@code input}.
     */
    public Value call(String name, Span head, Value input) {
        ensureNotCancelled(head);
        PipelineCommand command = registry.get(name);
        if (command == null) {
            throw new IllegalStateException("Command not registered: " + name);
        }
        return command.run(this, head, input);
    }
}
