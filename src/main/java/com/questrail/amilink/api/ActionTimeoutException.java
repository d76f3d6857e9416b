package com.questrail.amilink.api;

import java.time.Duration;

/**
 * No response carrying the action's correlation token arrived before the
 * deadline. Only the caller of that action sees this failure.
 */
public final class ActionTimeoutException extends AmiException
{
    private final String actionName;
    private final String actionId;

    public ActionTimeoutException(String actionName, String actionId, Duration timeout) {
        super("Action '" + actionName + "' (ActionID " + actionId + ") timed out after " + timeout.toMillis() + " ms");
        this.actionName = actionName;
        this.actionId = actionId;
    }

    public String actionName() {
        return actionName;
    }

    public String actionId() {
        return actionId;
    }
}
