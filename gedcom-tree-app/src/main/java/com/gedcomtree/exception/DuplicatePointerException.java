package com.gedcomtree.exception;

public class DuplicatePointerException extends GedcomParseException {

    private final String pointerId;

    public DuplicatePointerException(String pointerId, int lineNumber, String line) {
        super("Duplicate pointer " + pointerId, lineNumber, line);
        this.pointerId = pointerId;
    }

    public String getPointerId() {
        return pointerId;
    }
}
