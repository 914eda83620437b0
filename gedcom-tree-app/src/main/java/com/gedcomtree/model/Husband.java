package com.gedcomtree.model;

public class Husband extends Spouse {

    public Husband(GedcomNode node, CrossReferenceIndex index) {
        super(node, index);
    }

    @Override
    public RecordKind kind() {
        return RecordKind.HUSBAND;
    }
}
