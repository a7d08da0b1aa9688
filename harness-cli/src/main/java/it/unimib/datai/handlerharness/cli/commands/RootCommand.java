package it.unimib.datai.handlerharness.cli.commands;

import it.unimib.datai.handlerharness.cli.commands.invoke.InvokeCommand;
import it.unimib.datai.handlerharness.cli.config.ConfigStore;
import it.unimib.datai.handlerharness.cli.config.ResolvedContext;
import it.unimib.datai.handlerharness.cli.logging.Verbosity;
import it.unimib.datai.handlerharness.core.transport.HandlerTarget;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.time.Duration;

@Command(
        name = "handler-harness",
        mixinStandardHelpOptions = true,
        version = "handler-harness 0.1.0",
        description = "Drives resource handler lifecycle actions to a terminal outcome.",
        subcommands = {
                InvokeCommand.class
        }
)
public class RootCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Option(names = {"--config"}, description = "Path to config file (default: ~/.config/handler-harness/config.yaml).")
    Path configPath;

    @Option(names = {"--endpoint"}, description = "Function endpoint base URL (overrides config/env).")
    String endpoint;

    @Option(names = {"--function-name"}, description = "Function name behind the endpoint (overrides config/env).")
    String functionName;

    @Option(names = {"-v", "--verbose"}, description = "More logging on stderr. Repeat for debug output.")
    boolean[] verbose = new boolean[0];

    private ConfigStore store;
    private ResolvedContext resolved;

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    public ConfigStore configStore() {
        if (store == null) {
            store = (configPath == null) ? new ConfigStore() : new ConfigStore(configPath);
        }
        return store;
    }

    public ResolvedContext resolvedContext() {
        if (resolved == null) {
            ResolvedContext base = configStore().loadResolvedContext();
            resolved = new ResolvedContext(
                    base.contextName(),
                    firstNonBlank(endpoint, base.endpoint()),
                    firstNonBlank(functionName, base.functionName()),
                    base.maxReinvoke(),
                    base.enforceTimeoutSeconds());
        }
        return resolved;
    }

    public HandlerTarget handlerTarget(Duration invocationTimeout) {
        ResolvedContext ctx = resolvedContext();
        return new HandlerTarget(ctx.endpoint(), ctx.functionName(), invocationTimeout);
    }

    public void applyVerbosity() {
        Verbosity.apply(verbose.length);
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a;
        }
        if (b != null && !b.isBlank()) {
            return b;
        }
        return null;
    }
}
