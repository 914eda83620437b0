package com.gedcomtree.exception;

/**
 * A record whose shape has no text form that would read back the same way.
 */
public class UnwritableRecordException extends GedcomException {

    private final String line;

    public UnwritableRecordException(String message, String line) {
        super(message + ": \"" + line + "\"");
        this.line = line;
    }

    public String getLine() {
        return line;
    }
}
