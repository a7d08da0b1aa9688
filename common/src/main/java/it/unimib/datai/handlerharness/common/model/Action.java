package it.unimib.datai.handlerharness.common.model;

import java.util.Locale;

/**
 * Lifecycle action a handler implements for a resource type.
 */
public enum Action {
    CREATE,
    READ,
    UPDATE,
    DELETE,
    LIST;

    /**
     * READ and LIST are expected to answer without IN_PROGRESS.
     */
    public boolean isSynchronous() {
        return this == READ || this == LIST;
    }

    public static Action fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidActionException(name);
        }
        try {
            return Action.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidActionException(name);
        }
    }
}
