package org.dxworks.codeshaper;

/**
 * Base type of every failure raised by the engine itself. File access problems are not
 * wrapped; they surface as {@link java.io.IOException}.
 */
public abstract class CodeshaperException extends RuntimeException {

    private final ErrorKind kind;

    protected CodeshaperException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected CodeshaperException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
