package com.gedcomtree.model;

public class Wife extends Spouse {

    public Wife(GedcomNode node, CrossReferenceIndex index) {
        super(node, index);
    }

    @Override
    public RecordKind kind() {
        return RecordKind.WIFE;
    }
}
