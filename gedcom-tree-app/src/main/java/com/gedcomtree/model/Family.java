package com.gedcomtree.model;

import java.util.ArrayList;
import java.util.List;

/**
 * FAM record: a couple and their children.
 */
public class Family extends GedcomRecord {

    public Family(GedcomNode node, CrossReferenceIndex index) {
        super(node, index);
    }

    @Override
    public RecordKind kind() {
        return RecordKind.FAMILY;
    }

    /**
     * HUSB then WIFE lines, unresolved.
     */
    public List<Spouse> partners() {
        List<Spouse> partners = new ArrayList<>(husbands());
        partners.addAll(wives());
        return partners;
    }

    public List<Husband> husbands() {
        return all(RecordKind.HUSBAND, Husband.class);
    }

    public List<Wife> wives() {
        return all(RecordKind.WIFE, Wife.class);
    }

    /**
     * @throws com.gedcomtree.exception.RecordNotFoundException if there is no HUSB line
     */
    public Individual husband() {
        return first(RecordKind.HUSBAND, Husband.class).asIndividual();
    }

    /**
     * @throws com.gedcomtree.exception.RecordNotFoundException if there is no WIFE line
     */
    public Individual wife() {
        return first(RecordKind.WIFE, Wife.class).asIndividual();
    }

    /**
     * CHIL lines resolved to individuals, in document order.
     */
    public List<Individual> children() {
        return childrenTagged("CHIL").stream()
            .map(link -> index().resolve(link.value(), RecordKind.INDIVIDUAL, Individual.class))
            .toList();
    }

    public Marriage marriage() {
        return first(RecordKind.MARRIAGE, Marriage.class);
    }
}
