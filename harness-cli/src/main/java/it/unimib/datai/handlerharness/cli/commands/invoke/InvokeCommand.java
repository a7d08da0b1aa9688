package it.unimib.datai.handlerharness.cli.commands.invoke;

import it.unimib.datai.handlerharness.cli.commands.RootCommand;
import it.unimib.datai.handlerharness.cli.config.ResolvedContext;
import it.unimib.datai.handlerharness.cli.io.RequestInput;
import it.unimib.datai.handlerharness.common.model.Action;
import it.unimib.datai.handlerharness.core.HandlerHarness;
import it.unimib.datai.handlerharness.core.json.JsonCodec;
import it.unimib.datai.handlerharness.core.loop.CancellationSignal;
import it.unimib.datai.handlerharness.core.loop.LoopSettings;
import it.unimib.datai.handlerharness.core.outcome.ExitOutcome;
import it.unimib.datai.handlerharness.core.outcome.OutcomeKind;
import it.unimib.datai.handlerharness.core.transport.HandlerTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(name = "invoke", description = "Run one lifecycle action against the handler until it reaches a terminal outcome.")
public class InvokeCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(InvokeCommand.class);

    @ParentCommand
    RootCommand root;

    @Parameters(index = "0", paramLabel = "ACTION", description = "CREATE, READ, UPDATE, DELETE or LIST (any case).")
    String action;

    @Option(names = {"-d", "--data"}, required = true,
            description = "Resource request JSON object. Use @file or @- for stdin.")
    String data;

    @Option(names = {"--max-reinvoke"}, description = "Maximum re-invocations after IN_PROGRESS. Default: unbounded.")
    Integer maxReinvoke;

    @Option(names = {"--enforce-timeout"},
            description = "Seconds a CREATE/UPDATE/DELETE invocation may take before a warning. Default: 30.")
    Integer enforceTimeoutSeconds;

    @Option(names = {"--invocation-timeout"}, description = "Seconds to wait for one handler response. Default: 60.")
    Integer invocationTimeoutSeconds;

    @Option(names = {"--strict"}, description = "Exit with status 5 when a successful run raised contract warnings.")
    boolean strict;

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final JsonCodec json = new JsonCodec();

    @Override
    public Integer call() {
        root.applyVerbosity();

        Action parsed = Action.fromName(action);
        String body = RequestInput.read(data, System.in);
        ResolvedContext ctx = root.resolvedContext();
        LoopSettings settings = new LoopSettings(
                firstNonNull(maxReinvoke, ctx.maxReinvoke()),
                seconds(firstNonNull(enforceTimeoutSeconds, ctx.enforceTimeoutSeconds()), "--enforce-timeout"));
        HandlerTarget target = root.handlerTarget(seconds(invocationTimeoutSeconds, "--invocation-timeout"));

        log.info("Invoking {} at {} ({})", parsed, target.invokeUri(),
                ctx.contextName() == null ? "no context" : "context " + ctx.contextName());
        HandlerHarness harness = new HandlerHarness(target, settings);
        CancellationSignal cancellation = new CancellationSignal();
        CountDownLatch printed = new CountDownLatch(1);
        Thread hook = new Thread(() -> cancelAndWait(cancellation, printed), "handler-harness-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            ExitOutcome outcome = harness.run(parsed, body, cancellation);
            System.out.println(json.toPrettyJson(outcome));
            return exitCode(outcome);
        } finally {
            printed.countDown();
            removeHook(hook);
        }
    }

    /**
     * On Ctrl-C, aborts the run and gives it a moment to print its CANCELLED outcome.
     */
    private static void cancelAndWait(CancellationSignal cancellation, CountDownLatch printed) {
        cancellation.cancel("interrupted by shutdown signal");
        try {
            if (!printed.await(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Run did not stop within {}", SHUTDOWN_GRACE);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, hook stays registered");
        }
    }

    private int exitCode(ExitOutcome outcome) {
        if (strict && outcome.isSuccess() && outcome.hasWarnings()) {
            log.warn("{} contract warning(s) raised; failing run because of --strict", outcome.warnings().size());
            return OutcomeKind.CONTRACT_VIOLATION_EXIT_CODE;
        }
        return outcome.exitCode();
    }

    private static Duration seconds(Integer value, String option) {
        if (value == null) {
            return null;
        }
        if (value <= 0) {
            throw new IllegalArgumentException(option + " must be a positive number of seconds: " + value);
        }
        return Duration.ofSeconds(value);
    }

    private static <T> T firstNonNull(T a, T b) {
        return a != null ? a : b;
    }
}
