package work.shellformats.toml.command;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores pipeline commands by name.
 */
public final class CommandRegistry {
    private final Map<String, PipelineCommand> commands = new ConcurrentHashMap<>();

    /**
     * Registry holding every command this library ships.
     */
    public static CommandRegistry create() {
        return new CommandRegistry()
            .register(new ToTomlCommand());
    }

    public CommandRegistry register(PipelineCommand command) {
        commands.put(command.name(), command);
        return this;
    }

    public PipelineCommand get(String name) {
        return commands.get(name);
    }
}
