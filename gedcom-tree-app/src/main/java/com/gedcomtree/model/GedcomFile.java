package com.gedcomtree.model;

import com.gedcomtree.config.GedcomConfig;
import com.gedcomtree.writer.GedcomSerializer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A parsed GEDCOM file: the top-level records in document order plus the
 * cross-reference index over their pointer-ids. Not thread-safe.
 */
public class GedcomFile {

    private final RecordClassifier classifier;
    private final CrossReferenceIndex index = new CrossReferenceIndex();
    private final List<GedcomRecord> records = new ArrayList<>();
    private int nextFreeId = 1;

    public GedcomFile() {
        this(new RecordClassifier());
    }

    public GedcomFile(RecordClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Classify a built and merged forest and index it.
     *
     * @throws com.gedcomtree.exception.DuplicatePointerException if two roots declare the same pointer-id
     */
    public static GedcomFile of(List<GedcomNode> roots, RecordClassifier classifier) {
        GedcomFile file = new GedcomFile(classifier);
        for (GedcomNode root : roots) {
            GedcomRecord record = classifier.classify(root, file.index);
            file.index.register(record);
            file.records.add(record);
        }
        return file;
    }

    // ========== QUERIES ==========

    /**
     * Each call returns a fresh stream over the current top-level records.
     */
    public Stream<GedcomRecord> records() {
        return records.stream();
    }

    public Stream<Individual> individuals() {
        return records.stream()
            .filter(r -> r.kind() == RecordKind.INDIVIDUAL)
            .map(Individual.class::cast);
    }

    public Stream<Family> families() {
        return records.stream()
            .filter(r -> r.kind() == RecordKind.FAMILY)
            .map(Family.class::cast);
    }

    public List<GedcomRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }

    public CrossReferenceIndex index() {
        return index;
    }

    /**
     * @throws com.gedcomtree.exception.UnresolvedReferenceException if no record declares {@code pointerId}
     */
    public GedcomRecord record(String pointerId) {
        return index.resolve(pointerId);
    }

    public Optional<GedcomRecord> findRecord(String pointerId) {
        return index.find(pointerId);
    }

    // ========== MUTATION ==========

    /**
     * Create a detached level-0 record of whatever type {@code tag} classifies to.
     * Attach it with {@link #addRecord} or {@link GedcomRecord#addChild}.
     */
    public GedcomRecord newRecord(String tag, String value) {
        return classifier.classify(new GedcomNode(0, tag, value), index);
    }

    public Individual newIndividual() {
        return (Individual) addRecord(newRecord(RecordKind.INDIVIDUAL.tag(), null));
    }

    public Family newFamily() {
        return (Family) addRecord(newRecord(RecordKind.FAMILY.tag(), null));
    }

    /**
     * Append a top-level record. INDI and FAM records without a pointer get
     * the next free {@code @I<n>@} / {@code @F<n>@} id; both prefixes share one counter.
     *
     * @throws IllegalArgumentException if the record belongs to another file or is not at level 0
     * @throws com.gedcomtree.exception.DuplicatePointerException if its pointer-id is already taken
     */
    public GedcomRecord addRecord(GedcomRecord record) {
        if (record.index() != index) {
            throw new IllegalArgumentException("Record was created for another file: " + record);
        }
        if (record.level() != 0) {
            throw new IllegalArgumentException("Only level 0 records can be added to a file, got level " + record.level());
        }
        if (record.id() == null) {
            if (record.kind() == RecordKind.INDIVIDUAL) {
                record.node().setPointerId(allocateId('I'));
            } else if (record.kind() == RecordKind.FAMILY) {
                record.node().setPointerId(allocateId('F'));
            }
        }
        index.register(record);
        records.add(record);
        return record;
    }

    private String allocateId(char prefix) {
        while (true) {
            String candidate = "@" + prefix + nextFreeId++ + "@";
            if (!index.contains(candidate)) {
                return candidate;
            }
        }
    }

    /**
     * Insert a HEAD record if the file does not start with one and append a
     * TRLR if it does not end with one. Existing records are left alone.
     */
    public void ensureHeaderTrailer(String sourceName, String sourceVersion) {
        if (records.isEmpty() || !"HEAD".equals(records.get(0).tag())) {
            GedcomRecord head = newRecord("HEAD", null);
            GedcomRecord source = newRecord("SOUR", null);
            source.addChild(newRecord("NAME", sourceName));
            source.addChild(newRecord("VERS", sourceVersion));
            head.addChild(source);
            head.addChild(newRecord("CHAR", "UNICODE"));
            GedcomRecord format = newRecord("GEDC", null);
            format.addChild(newRecord("VERS", "5.5"));
            format.addChild(newRecord("FORM", "LINEAGE-LINKED"));
            head.addChild(format);
            records.add(0, head);
        }
        if (!"TRLR".equals(records.get(records.size() - 1).tag())) {
            records.add(newRecord("TRLR", null));
        }
    }

    /**
     * Put every root back at level 0 and re-level the subtrees beneath.
     */
    public void ensureLevels() {
        for (GedcomRecord record : records) {
            record.node().setLevel(0);
        }
    }

    // ========== OUTPUT ==========

    /**
     * Serialize with the default line settings. Header and trailer are not
     * added; call {@link #ensureHeaderTrailer} first when they are wanted.
     */
    public String serialize() {
        return new GedcomSerializer(new GedcomConfig()).serialize(this);
    }

    @Override
    public String toString() {
        return "GedcomFile(" + records.size() + " records, " + index.size() + " pointers)";
    }
}
