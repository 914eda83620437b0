package com.gedcomtree.model;

/**
 * One physical line decomposed into its structural parts.
 * {@code pointerId} and {@code value} are null when the line has none;
 * {@code source} is the text as read, or null for lines built in memory.
 */
public record GedcomLine(
    int lineNumber,
    int level,
    String pointerId,
    String tag,
    String value,
    String source
) {
    public GedcomLine(int lineNumber, int level, String pointerId, String tag, String value) {
        this(lineNumber, level, pointerId, tag, value, null);
    }

    public boolean isContinuation() {
        return GedcomNode.CONT.equals(tag) || GedcomNode.CONC.equals(tag);
    }

    /**
     * Render back to the canonical text form, without any wrapping.
     */
    public String text() {
        StringBuilder sb = new StringBuilder();
        sb.append(level);
        if (pointerId != null) {
            sb.append(' ').append(pointerId);
        }
        sb.append(' ').append(tag);
        if (value != null) {
            sb.append(' ').append(value);
        }
        return sb.toString();
    }

    /**
     * The line as it appeared in the input, falling back to {@link #text()}.
     */
    public String sourceText() {
        return source != null ? source : text();
    }
}
