package com.gedcomtree.model;

/**
 * HUSB or WIFE line inside a family. Its value points at an INDI record.
 */
public abstract class Spouse extends GedcomRecord {

    protected Spouse(GedcomNode node, CrossReferenceIndex index) {
        super(node, index);
    }

    /**
     * @throws com.gedcomtree.exception.UnresolvedReferenceException if the pointer is dangling
     */
    public Individual asIndividual() {
        return index().resolve(value(), RecordKind.INDIVIDUAL, Individual.class);
    }
}
