package uk.gegc.adaptivetest.shared.exception;

public class InvalidSessionConfigException extends RuntimeException {

    public InvalidSessionConfigException(String message) {
        super(message);
    }
}
