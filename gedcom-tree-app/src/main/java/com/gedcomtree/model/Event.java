package com.gedcomtree.model;

/**
 * Common base for dated, placed events such as BIRT, DEAT and MARR.
 */
public abstract class Event extends GedcomRecord {

    protected Event(GedcomNode node, CrossReferenceIndex index) {
        super(node, index);
    }

    /**
     * @return the DATE value verbatim; no date parsing is attempted
     * @throws com.gedcomtree.exception.RecordNotFoundException if there is no DATE child
     */
    public String date() {
        return child("DATE").value();
    }

    /**
     * @throws com.gedcomtree.exception.RecordNotFoundException if there is no PLAC child
     */
    public String place() {
        return child("PLAC").value();
    }
}
