package com.eventalerts.alerter.domain.notification;

/**
 * Outcome of fanning one message out to an event's deliveries.
 * An event counts as notified once any delivery succeeded.
 */
public record DispatchResult(int attempted, int succeeded) {

    public boolean delivered() {
        return succeeded > 0;
    }

    public int failed() {
        return attempted - succeeded;
    }
}
