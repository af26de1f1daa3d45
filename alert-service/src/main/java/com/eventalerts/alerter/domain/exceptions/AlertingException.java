package com.eventalerts.alerter.domain.exceptions;

/**
 * Base of the alerting error taxonomy. Subclasses say how far a failure reaches:
 * one delivery, one cycle, or the whole process at startup.
 */
public abstract class AlertingException extends RuntimeException {

    protected AlertingException(String message) {
        super(message);
    }

    protected AlertingException(String message, Throwable cause) {
        super(message, cause);
    }
}
