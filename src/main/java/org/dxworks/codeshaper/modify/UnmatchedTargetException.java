package org.dxworks.codeshaper.modify;

import org.dxworks.codeshaper.CodeshaperException;
import org.dxworks.codeshaper.ErrorKind;

public class UnmatchedTargetException extends CodeshaperException {

    public UnmatchedTargetException(String message) {
        super(ErrorKind.UNMATCHED_TARGET, message);
    }
}
