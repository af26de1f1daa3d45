package com.eventalerts.alerter.domain.exceptions;

import java.nio.file.Path;

public class PersistException extends AlertingException {

    private PersistException(String message, Throwable cause) {
        super(message, cause);
    }

    public static PersistException writeFailed(Path file, Throwable cause) {
        return new PersistException("Could not write tracking file " + file + ": " + cause.getMessage(), cause);
    }
}
