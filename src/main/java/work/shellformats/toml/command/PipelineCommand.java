package work.shellformats.toml.command;

import java.util.List;
import work.shellformats.toml.value.Span;
import work.shellformats.toml.value.Value;

/**
 * A command that consumes one pipeline value and produces another.
 */
public interface PipelineCommand {
    String name();

    String usage();

    String category();

    default List<CommandExample> examples() {
        return List.of();
    }

    /**
     * @param head span of the command name at the call site
     */
    Value run(CommandContext ctx, Span head, Value input);
}
