package com.gedcomtree.exception;

/**
 * Level nesting is broken, e.g. a line jumps two levels below its parent.
 */
public class StructuralException extends GedcomParseException {

    public StructuralException(String message, int lineNumber, String line) {
        super(message, lineNumber, line);
    }
}
