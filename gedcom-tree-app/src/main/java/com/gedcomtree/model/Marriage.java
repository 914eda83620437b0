package com.gedcomtree.model;

public class Marriage extends Event {

    public Marriage(GedcomNode node, CrossReferenceIndex index) {
        super(node, index);
    }

    @Override
    public RecordKind kind() {
        return RecordKind.MARRIAGE;
    }
}
