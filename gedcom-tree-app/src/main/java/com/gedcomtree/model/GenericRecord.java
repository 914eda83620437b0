package com.gedcomtree.model;

/**
 * Fallback for every tag without a dedicated type, vendor {@code _TAGS} included.
 */
public class GenericRecord extends GedcomRecord {

    public GenericRecord(GedcomNode node, CrossReferenceIndex index) {
        super(node, index);
    }

    @Override
    public RecordKind kind() {
        return RecordKind.GENERIC;
    }
}
