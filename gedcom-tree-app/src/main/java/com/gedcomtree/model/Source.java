package com.gedcomtree.model;

import java.util.Optional;

/**
 * SOUR record. At level 0 it declares a source; below that it is a
 * citation, usually pointing at a level-0 source.
 */
public class Source extends GedcomRecord {

    public Source(GedcomNode node, CrossReferenceIndex index) {
        super(node, index);
    }

    @Override
    public RecordKind kind() {
        return RecordKind.SOURCE;
    }

    public boolean isCitation() {
        return CrossReferenceIndex.isPointer(value());
    }

    /**
     * @throws com.gedcomtree.exception.UnresolvedReferenceException if this citation's pointer is dangling
     */
    public Source referencedSource() {
        return index().resolve(value(), RecordKind.SOURCE, Source.class);
    }

    public Optional<String> title() {
        return childValue("TITL");
    }
}
