package com.gedcomtree.model;

public class Death extends Event {

    public Death(GedcomNode node, CrossReferenceIndex index) {
        super(node, index);
    }

    @Override
    public RecordKind kind() {
        return RecordKind.DEATH;
    }
}
