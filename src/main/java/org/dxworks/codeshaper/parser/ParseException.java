package org.dxworks.codeshaper.parser;

import org.dxworks.codeshaper.CodeshaperException;
import org.dxworks.codeshaper.ErrorKind;

public class ParseException extends CodeshaperException {

    private final int line;
    private final int column;

    public ParseException(String message, int line, int column) {
        super(ErrorKind.PARSE, message);
        this.line = line;
        this.column = column;
    }

    public ParseException(String message, Throwable cause) {
        super(ErrorKind.PARSE, message, cause);
        this.line = 0;
        this.column = 0;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
