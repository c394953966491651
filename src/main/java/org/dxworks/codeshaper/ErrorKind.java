package org.dxworks.codeshaper;

public enum ErrorKind {
    PARSE,
    INVALID_MODIFICATION,
    UNMATCHED_TARGET,
    LIMIT_EXCEEDED
}
