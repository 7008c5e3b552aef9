package com.routewise.core.recording;

import com.routewise.core.engine.RoutingException;

/**
 * Thrown when an execution report references a plan the selector never issued.
 */
public class UnknownPlanException extends RoutingException {
    public UnknownPlanException(String planId) {
        super("Unknown selection plan: " + planId);
    }
}
