package com.gedcomtree.exception;

public class MalformedValueException extends GedcomException {

    public MalformedValueException(String message) {
        super(message);
    }
}
