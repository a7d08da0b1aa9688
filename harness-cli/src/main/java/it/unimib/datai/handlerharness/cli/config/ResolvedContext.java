package it.unimib.datai.handlerharness.cli.config;

/**
 * Effective settings after layering environment over the selected context.
 * Any field may be null, meaning "use the built-in default".
 */
public record ResolvedContext(
        String contextName,
        String endpoint,
        String functionName,
        Integer maxReinvoke,
        Integer enforceTimeoutSeconds
) {
}
