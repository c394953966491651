package org.dxworks.codeshaper.modify;

/**
 * What happens when a request names a symbol, function or class the file does not contain.
 */
public enum UnmatchedTargetPolicy {
    /** Abort the call; the original file stays untouched. */
    FAIL,
    /** Record the request as skipped and continue with the next one. */
    SKIP
}
