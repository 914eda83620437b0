package com.gedcomtree.model;

public class Burial extends Event {

    public Burial(GedcomNode node, CrossReferenceIndex index) {
        super(node, index);
    }

    @Override
    public RecordKind kind() {
        return RecordKind.BURIAL;
    }
}
