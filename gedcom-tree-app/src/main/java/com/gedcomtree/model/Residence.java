package com.gedcomtree.model;

public class Residence extends Event {

    public Residence(GedcomNode node, CrossReferenceIndex index) {
        super(node, index);
    }

    @Override
    public RecordKind kind() {
        return RecordKind.RESIDENCE;
    }
}
