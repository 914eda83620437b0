package com.gedcomtree.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Generic, unclassified tree node. A node exclusively owns its children;
 * typed records are views over nodes and never copy them.
 */
public class GedcomNode {

    public static final String CONT = "CONT";
    public static final String CONC = "CONC";

    private int level;
    private final String tag;
    private String pointerId;
    private String value;
    private final int lineNumber;
    private final String source;
    private final List<GedcomNode> children = new ArrayList<>();

    public GedcomNode(int level, String tag, String pointerId, String value, int lineNumber) {
        this(level, tag, pointerId, value, lineNumber, null);
    }

    private GedcomNode(int level, String tag, String pointerId, String value, int lineNumber, String source) {
        if (level < 0) {
            throw new IllegalArgumentException("Level must not be negative: " + level);
        }
        this.level = level;
        this.tag = Objects.requireNonNull(tag, "tag");
        this.pointerId = pointerId;
        this.value = normalize(value);
        this.lineNumber = lineNumber;
        this.source = source;
    }

    public GedcomNode(int level, String tag, String value) {
        this(level, tag, null, value, 0);
    }

    public static GedcomNode fromLine(GedcomLine line) {
        return new GedcomNode(line.level(), line.tag(), line.pointerId(), line.value(), line.lineNumber(), line.source());
    }

    // Getters
    public int getLevel() { return level; }
    public String getTag() { return tag; }
    public String getPointerId() { return pointerId; }
    public String getValue() { return value; }
    public int getLineNumber() { return lineNumber; }
    public String getSourceText() { return source != null ? source : toString(); }
    public List<GedcomNode> getChildren() { return Collections.unmodifiableList(children); }

    // Setters
    public void setPointerId(String pointerId) { this.pointerId = pointerId; }
    public void setValue(String value) { this.value = normalize(value); }

    public boolean isContinuation() {
        return CONT.equals(tag) || CONC.equals(tag);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Append a child. The caller is responsible for the child's level;
     * see {@link #setLevel(int)} to re-level a detached subtree.
     */
    public void addChild(GedcomNode child) {
        children.add(Objects.requireNonNull(child, "child"));
    }

    public void addChild(int position, GedcomNode child) {
        children.add(position, Objects.requireNonNull(child, "child"));
    }

    public boolean removeChild(GedcomNode child) {
        return children.remove(child);
    }

    /**
     * Set this node's level and push {@code level + 1}, {@code level + 2}, ...
     * down the subtree.
     */
    public void setLevel(int level) {
        if (level < 0) {
            throw new IllegalArgumentException("Level must not be negative: " + level);
        }
        this.level = level;
        for (GedcomNode child : children) {
            child.setLevel(level + 1);
        }
    }

    /**
     * Observational equality: same tag, pointer, value and, recursively,
     * the same children in the same order. Levels and line numbers are ignored.
     */
    public boolean sameStructureAs(GedcomNode other) {
        if (other == null
                || !tag.equals(other.tag)
                || !Objects.equals(pointerId, other.pointerId)
                || !Objects.equals(value, other.value)
                || children.size() != other.children.size()) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).sameStructureAs(other.children.get(i))) {
                return false;
            }
        }
        return true;
    }

    public GedcomLine toLine() {
        return new GedcomLine(lineNumber, level, pointerId, tag, value, source);
    }

    @Override
    public String toString() {
        return toLine().text();
    }

    // An empty payload and a missing payload serialize identically
    private static String normalize(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
