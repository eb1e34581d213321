package org.schachregeln.model;

public class NotationFormatException extends IllegalArgumentException {

    public NotationFormatException(String message) {
        super(message);
    }

    public NotationFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
