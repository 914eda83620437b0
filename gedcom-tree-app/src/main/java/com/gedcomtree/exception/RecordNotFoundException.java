package com.gedcomtree.exception;

/**
 * A record lacks the child an accessor needs (no NAME, no BIRT, ...).
 * Only the single accessor call fails; the tree is untouched.
 */
public class RecordNotFoundException extends GedcomException {

    private final String tag;

    public RecordNotFoundException(String tag, String owner) {
        super("No " + tag + " found under " + owner);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
