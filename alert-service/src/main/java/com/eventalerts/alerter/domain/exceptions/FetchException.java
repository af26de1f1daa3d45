package com.eventalerts.alerter.domain.exceptions;

import java.time.Duration;
import java.util.Collection;

public class FetchException extends AlertingException {

    private FetchException(String message) {
        super(message);
    }

    private FetchException(String message, Throwable cause) {
        super(message, cause);
    }

    public static FetchException queryFailed(String query, Throwable cause) {
        return new FetchException("Event query " + query + " failed: " + cause.getMessage(), cause);
    }

    public static FetchException timedOut(Duration cycleTimeout) {
        return new FetchException("Event query did not complete within the cycle timeout of " + cycleTimeout);
    }

    public static FetchException missingColumns(Collection<String> missing, Collection<String> available) {
        return new FetchException("Event query result is missing required columns " + missing
                + " (available: " + available + ")");
    }
}
