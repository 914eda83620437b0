package com.gedcomtree.model;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tag to record-type registry. Unregistered tags, vendor extensions
 * included, fall back to {@link GenericRecord}. The tag alone decides the
 * type; pointer-id prefixes are never consulted.
 *
 * <p>Registration is not synchronized: register custom tags before the
 * classifier is shared between threads.
 */
@Component
public class RecordClassifier {

    @FunctionalInterface
    public interface RecordFactory {
        GedcomRecord create(GedcomNode node, CrossReferenceIndex index);
    }

    private static final RecordFactory FALLBACK = GenericRecord::new;

    private final Map<String, RecordFactory> factories = new HashMap<>();

    public RecordClassifier() {
        register(RecordKind.INDIVIDUAL.tag(), Individual::new);
        register(RecordKind.FAMILY.tag(), Family::new);
        register(RecordKind.BIRTH.tag(), Birth::new);
        register(RecordKind.DEATH.tag(), Death::new);
        register(RecordKind.BURIAL.tag(), Burial::new);
        register(RecordKind.MARRIAGE.tag(), Marriage::new);
        register(RecordKind.RESIDENCE.tag(), Residence::new);
        register(RecordKind.HUSBAND.tag(), Husband::new);
        register(RecordKind.WIFE.tag(), Wife::new);
        register(RecordKind.SOURCE.tag(), Source::new);
        register(RecordKind.NOTE.tag(), Note::new);
    }

    public void register(String tag, RecordFactory factory) {
        factories.put(Objects.requireNonNull(tag, "tag"), Objects.requireNonNull(factory, "factory"));
    }

    public boolean isRegistered(String tag) {
        return factories.containsKey(tag);
    }

    /**
     * Wrap {@code node} and, recursively, its whole subtree. The nodes are
     * shared with the returned records, not copied.
     */
    public GedcomRecord classify(GedcomNode node, CrossReferenceIndex index) {
        GedcomRecord record = factories.getOrDefault(node.getTag(), FALLBACK).create(node, index);
        record.bind(this);
        for (GedcomNode child : node.getChildren()) {
            record.attach(classify(child, index));
        }
        return record;
    }
}
