package org.dxworks.codeshaper.parser;

/**
 * Which function, class and variable declarations end up in a program summary.
 */
public enum DeclarationScope {
    /** Direct children of the program or of a top-level export statement. */
    MODULE,
    /** Every declaration, however deeply nested. */
    ALL
}
