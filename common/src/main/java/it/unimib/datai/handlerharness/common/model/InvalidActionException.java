package it.unimib.datai.handlerharness.common.model;

import java.util.Arrays;

public final class InvalidActionException extends IllegalArgumentException {
    private final String action;

    public InvalidActionException(String action) {
        super("Invalid action '" + action + "'. Expected one of " + Arrays.toString(Action.values()));
        this.action = action;
    }

    public String action() {
        return action;
    }
}
