package org.dxworks.codeshaper.modify;

import org.dxworks.codeshaper.CodeshaperException;
import org.dxworks.codeshaper.ErrorKind;

public class InvalidModificationException extends CodeshaperException {

    public InvalidModificationException(String message) {
        super(ErrorKind.INVALID_MODIFICATION, message);
    }

    public InvalidModificationException(String message, Throwable cause) {
        super(ErrorKind.INVALID_MODIFICATION, message, cause);
    }
}
