package work.shellformats.toml.command;

import java.util.Objects;
import java.util.Optional;
import work.shellformats.toml.value.Value;

/**
 * Documented usage of a command, runnable as a check.
 *
 * @param example pipeline text shown to users
 * @param input value the example pipes into the command
 * @param result expected output, when the example has a fixed one
 */
public record CommandExample(String description, String example, Value input, Optional<Value> result) {
    public CommandExample {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(example, "example");
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(result, "result");
    }
}
