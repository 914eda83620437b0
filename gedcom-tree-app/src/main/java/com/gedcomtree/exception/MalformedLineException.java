package com.gedcomtree.exception;

public class MalformedLineException extends GedcomParseException {

    public MalformedLineException(String message, int lineNumber, String line) {
        super(message, lineNumber, line);
    }
}
