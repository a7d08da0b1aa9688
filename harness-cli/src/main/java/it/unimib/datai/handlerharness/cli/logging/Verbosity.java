package it.unimib.datai.handlerharness.cli.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.LoggerFactory;

/**
 * Maps the number of {@code -v} flags to the level of the harness loggers.
 */
public final class Verbosity {
    static final String HARNESS_LOGGER = "it.unimib.datai.handlerharness";

    private Verbosity() {}

    public static Level levelFor(int count) {
        if (count <= 0) {
            return Level.WARN;
        }
        return count == 1 ? Level.INFO : Level.DEBUG;
    }

    public static void apply(int count) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext loggerContext)) {
            return;
        }
        Logger logger = loggerContext.getLogger(HARNESS_LOGGER);
        logger.setLevel(levelFor(count));
    }
}
