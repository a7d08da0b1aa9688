package it.unimib.datai.handlerharness.cli.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

public final class ConfigStore {
    private static final Logger log = LoggerFactory.getLogger(ConfigStore.class);

    static final String ENV_CONTEXT = "HANDLER_HARNESS_CONTEXT";
    static final String ENV_ENDPOINT = "HANDLER_HARNESS_ENDPOINT";
    static final String ENV_FUNCTION = "HANDLER_HARNESS_FUNCTION";

    private final Path path;
    private final ObjectMapper yaml;
    private final Function<String, String> getenv;

    public ConfigStore() {
        this(defaultPath(), System::getenv);
    }

    public ConfigStore(Path path) {
        this(path, System::getenv);
    }

    public ConfigStore(Path path, Function<String, String> getenv) {
        this.path = path;
        this.getenv = getenv;
        this.yaml = new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Config load() {
        if (!Files.exists(path)) {
            log.debug("No config file at {}", path);
            return new Config();
        }
        try {
            Config cfg = yaml.readValue(path.toFile(), Config.class);
            return cfg == null ? new Config() : cfg;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config: " + path, e);
        }
    }

    /**
     * Selects the context named by the environment or the file, then lets the environment
     * override its endpoint and function name.
     *
     * @throws IllegalArgumentException if a context is named but not defined in the file
     */
    public ResolvedContext loadResolvedContext() {
        Config cfg = load();

        String contextName = firstNonBlank(getenv.apply(ENV_CONTEXT), cfg.getCurrentContext());
        Context ctx = null;
        if (contextName != null) {
            ctx = cfg.getContexts().get(contextName);
            if (ctx == null) {
                throw new IllegalArgumentException("Context '" + contextName + "' is not defined in " + path);
            }
        }

        String endpoint = firstNonBlank(getenv.apply(ENV_ENDPOINT), ctx == null ? null : ctx.getEndpoint());
        String function = firstNonBlank(getenv.apply(ENV_FUNCTION), ctx == null ? null : ctx.getFunctionName());

        return new ResolvedContext(contextName, endpoint, function,
                ctx == null ? null : ctx.getMaxReinvoke(),
                ctx == null ? null : ctx.getEnforceTimeoutSeconds());
    }

    private static Path defaultPath() {
        String home = System.getProperty("user.home");
        return Path.of(home, ".config", "handler-harness", "config.yaml");
    }

    private static String firstNonBlank(String... values) {
        if (values == null) {
            return null;
        }
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return null;
    }
}
