package work.shellformats.toml.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return commandLine(new ToTomlCli());
    }

    static CommandLine commandLine(ToTomlCli command) {
        return new CommandLine(command)
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
