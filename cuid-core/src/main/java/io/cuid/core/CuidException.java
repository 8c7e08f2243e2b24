package io.cuid.core;

public class CuidException extends RuntimeException {

    public CuidException(Throwable cause) {
        super(cause);
    }

    public CuidException(String message, Throwable cause) {
        super(message, cause);
    }

    public CuidException(String message) {
        super(message);
    }

}
