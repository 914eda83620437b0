package com.gedcomtree.exception;

/**
 * Base type for everything the GEDCOM engine throws.
 */
public class GedcomException extends RuntimeException {

    public GedcomException(String message) {
        super(message);
    }

    public GedcomException(String message, Throwable cause) {
        super(message, cause);
    }
}
