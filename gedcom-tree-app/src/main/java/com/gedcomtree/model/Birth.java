package com.gedcomtree.model;

public class Birth extends Event {

    public Birth(GedcomNode node, CrossReferenceIndex index) {
        super(node, index);
    }

    @Override
    public RecordKind kind() {
        return RecordKind.BIRTH;
    }
}
