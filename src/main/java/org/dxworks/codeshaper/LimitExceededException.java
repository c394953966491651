package org.dxworks.codeshaper;

public class LimitExceededException extends CodeshaperException {

    public LimitExceededException(String message) {
        super(ErrorKind.LIMIT_EXCEEDED, message);
    }
}
