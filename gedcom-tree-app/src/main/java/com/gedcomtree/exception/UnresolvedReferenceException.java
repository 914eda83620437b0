package com.gedcomtree.exception;

public class UnresolvedReferenceException extends GedcomException {

    private final String pointerId;

    public UnresolvedReferenceException(String pointerId, String message) {
        super(message);
        this.pointerId = pointerId;
    }

    public String getPointerId() {
        return pointerId;
    }
}
