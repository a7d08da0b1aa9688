package it.unimib.datai.handlerharness.cli;

import it.unimib.datai.handlerharness.cli.commands.RootCommand;
import it.unimib.datai.handlerharness.core.outcome.OutcomeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.UncheckedIOException;

public final class HandlerHarnessCli {
    private static final Logger log = LoggerFactory.getLogger(HandlerHarnessCli.class);

    private HandlerHarnessCli() {}

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the harness exit status mapping: configuration problems found while
     * executing a command exit with {@link OutcomeKind#CONFIGURATION_ERROR_EXIT_CODE}.
     */
    public static CommandLine commandLine() {
        return configure(new CommandLine(new RootCommand()));
    }

    static CommandLine configure(CommandLine cli) {
        cli.setExpandAtFiles(false);
        cli.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof IllegalArgumentException || ex instanceof UncheckedIOException) {
                cmd.getErr().println("Error: " + ex.getMessage());
                return OutcomeKind.CONFIGURATION_ERROR_EXIT_CODE;
            }
            log.error("Unexpected failure", ex);
            cmd.getErr().println("Error: " + ex);
            return OutcomeKind.ERROR.exitCode();
        });
        return cli;
    }
}
