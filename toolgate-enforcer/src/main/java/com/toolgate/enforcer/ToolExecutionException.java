package com.toolgate.enforcer;

import com.toolgate.policy.model.Decision;
import lombok.Getter;

/**
 * The call failed after admission, or an enforcement layer itself broke.
 * {@link #getCause()} is the original exception; the decision's layer tells
 * where it happened.
 */
@Getter
public class ToolExecutionException extends RuntimeException {

    private final Decision decision;

    public ToolExecutionException(Decision decision, Throwable cause) {
        super(messageFor(decision, cause), cause);
        this.decision = decision;
    }

    private static String messageFor(Decision decision, Throwable cause) {
        String type = cause.getClass().getSimpleName();
        return decision.allowed()
                ? "Tool execution failed: " + type
                : "Enforcement failed at " + decision.layer().label() + ": " + type;
    }
}
