package com.gedcomtree.model;

import com.gedcomtree.exception.RecordNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed view over a {@link GedcomNode}. Subclasses add accessors for their
 * own semantics; the generic contract (level, tag, pointer, value, children)
 * is shared by all of them.
 *
 * <p>Lookups by tag or kind scan direct children only, in document order,
 * and the first match wins. Accessors never modify the tree.
 *
 * <p>Child records are read from the node's current children on every
 * call, so changes made directly on {@link #node()} show up here too.
 */
public abstract class GedcomRecord {

    private final GedcomNode node;
    private final CrossReferenceIndex index;
    // one wrapper per child node, keyed by identity
    private final Map<GedcomNode, GedcomRecord> views = new IdentityHashMap<>();
    private RecordClassifier classifier;

    protected GedcomRecord(GedcomNode node, CrossReferenceIndex index) {
        this.node = Objects.requireNonNull(node, "node");
        this.index = Objects.requireNonNull(index, "index");
    }

    public abstract RecordKind kind();

    public GedcomNode node() { return node; }
    public int level() { return node.getLevel(); }
    public String tag() { return node.getTag(); }
    public String id() { return node.getPointerId(); }
    public String value() { return node.getValue(); }

    public List<GedcomRecord> childRecords() {
        List<GedcomNode> childNodes = node.getChildren();
        List<GedcomRecord> records = new ArrayList<>(childNodes.size());
        for (GedcomNode child : childNodes) {
            records.add(views.computeIfAbsent(child, this::wrap));
        }
        if (views.size() > records.size()) {
            views.keySet().retainAll(childNodes);
        }
        return Collections.unmodifiableList(records);
    }

    protected CrossReferenceIndex index() {
        return index;
    }

    // ========== GENERIC LOOKUPS ==========

    public boolean hasChild(String tag) {
        return findChild(tag).isPresent();
    }

    public Optional<GedcomRecord> findChild(String tag) {
        return childRecords().stream()
            .filter(c -> c.tag().equals(tag))
            .findFirst();
    }

    /**
     * @throws RecordNotFoundException if there is no child tagged {@code tag}
     */
    public GedcomRecord child(String tag) {
        return findChild(tag).orElseThrow(() -> new RecordNotFoundException(tag, describe()));
    }

    public List<GedcomRecord> childrenTagged(String tag) {
        return childRecords().stream()
            .filter(c -> c.tag().equals(tag))
            .toList();
    }

    protected <T extends GedcomRecord> Optional<T> findFirst(RecordKind kind, Class<T> type) {
        return childRecords().stream()
            .filter(c -> c.kind() == kind)
            .map(type::cast)
            .findFirst();
    }

    protected <T extends GedcomRecord> T first(RecordKind kind, Class<T> type) {
        return findFirst(kind, type).orElseThrow(() -> new RecordNotFoundException(kind.tag(), describe()));
    }

    protected <T extends GedcomRecord> List<T> all(RecordKind kind, Class<T> type) {
        return childRecords().stream()
            .filter(c -> c.kind() == kind)
            .map(type::cast)
            .toList();
    }

    protected Optional<String> childValue(String tag) {
        return findChild(tag).map(GedcomRecord::value);
    }

    // ========== SHARED ACCESSORS ==========

    /**
     * Full text of the first NOTE under this record, continuations already merged.
     */
    public Optional<String> note() {
        return findFirst(RecordKind.NOTE, Note.class).map(Note::fullText);
    }

    /**
     * SOUR children of this record, in document order. Each is either an
     * inline source or a citation pointing at a top-level SOUR record.
     */
    public List<Source> sourceCitations() {
        return all(RecordKind.SOURCE, Source.class);
    }

    // ========== MUTATION ==========

    /**
     * Append {@code child} under this record and re-level its subtree.
     */
    public void addChild(GedcomRecord child) {
        Objects.requireNonNull(child, "child");
        child.node.setLevel(level() + 1);
        node.addChild(child.node);
        views.put(child.node, child);
    }

    public void setValue(String value) {
        node.setValue(value);
    }

    // Classification wires up children whose nodes are already attached
    void attach(GedcomRecord child) {
        views.put(child.node, child);
    }

    void bind(RecordClassifier classifier) {
        this.classifier = classifier;
    }

    private GedcomRecord wrap(GedcomNode child) {
        if (classifier == null) {
            classifier = DefaultClassifier.INSTANCE;
        }
        return classifier.classify(child, index);
    }

    private static final class DefaultClassifier {
        static final RecordClassifier INSTANCE = new RecordClassifier();
    }

    protected String describe() {
        return id() != null ? tag() + " " + id() : tag() + (node.getLineNumber() > 0 ? " (line " + node.getLineNumber() + ")" : "");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName())
            .append('(').append(level()).append(", ").append(tag());
        if (id() != null) sb.append(", ").append(id());
        if (value() != null) sb.append(", '").append(value()).append('\'');
        if (node.hasChildren()) sb.append(", ").append(childRecords());
        return sb.append(')').toString();
    }
}
