package com.gedcomtree.model;

/**
 * NOTE record, either inline text or a pointer to a top-level NOTE.
 */
public class Note extends GedcomRecord {

    public Note(GedcomNode node, CrossReferenceIndex index) {
        super(node, index);
    }

    @Override
    public RecordKind kind() {
        return RecordKind.NOTE;
    }

    /**
     * The note's text with CONT lines joined by newlines. A pointer value is
     * followed to the NOTE record it names; a dangling pointer is returned as is.
     */
    public String fullText() {
        String text = value();
        if (id() == null && CrossReferenceIndex.isPointer(text)) {
            return index().find(text)
                .filter(r -> r.kind() == RecordKind.NOTE)
                .map(r -> ((Note) r).fullText())
                .orElse(text);
        }
        return text == null ? "" : text;
    }
}
