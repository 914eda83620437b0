package com.gedcomtree.writer;

import com.gedcomtree.config.GedcomConfig;
import com.gedcomtree.exception.UnwritableRecordException;
import com.gedcomtree.model.CrossReferenceIndex;
import com.gedcomtree.model.GedcomFile;
import com.gedcomtree.model.GedcomNode;
import com.gedcomtree.model.GedcomRecord;
import com.gedcomtree.parser.LineScanner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes records back as level-numbered lines. Embedded newlines become
 * CONT lines and values longer than the configured limit are cut into
 * CONC lines, all one level below the line they continue.
 *
 * <p>Level 99 has no room for continuation lines below it: a long value
 * there is written on one line and an embedded newline is rejected.
 */
@Component
public class GedcomSerializer {

    private final int maxValueLength;

    public GedcomSerializer(GedcomConfig config) {
        if (config.getMaxValueLength() < 2) {
            throw new IllegalArgumentException("gedcom.max-value-length must be at least 2, got " + config.getMaxValueLength());
        }
        this.maxValueLength = config.getMaxValueLength();
    }

    public int getMaxValueLength() {
        return maxValueLength;
    }

    /**
     * @return all lines joined with {@code \n}, without a trailing newline
     * @throws UnwritableRecordException if a record could not be read back as written
     */
    public String serialize(GedcomFile file) {
        return String.join("\n", lines(file));
    }

    /**
     * Stream the file, each line terminated by {@code \n}.
     */
    public void writeTo(GedcomFile file, Writer out) throws IOException {
        for (String line : lines(file)) {
            out.write(line);
            out.write('\n');
        }
        out.flush();
    }

    public List<String> lines(GedcomFile file) {
        List<String> lines = new ArrayList<>();
        for (GedcomRecord record : file.getRecords()) {
            emit(record.node(), lines);
        }
        return lines;
    }

    public List<String> lines(GedcomRecord record) {
        List<String> lines = new ArrayList<>();
        emit(record.node(), lines);
        return lines;
    }

    private void emit(GedcomNode node, List<String> out) {
        int level = node.getLevel();
        String value = node.getValue();
        checkWritable(node);
        if (value == null) {
            out.add(format(level, node.getPointerId(), node.getTag(), null));
        } else {
            String[] segments = value.split("\n", -1);
            emitWrapped(level, node.getPointerId(), node.getTag(), segments[0], out);
            for (int i = 1; i < segments.length; i++) {
                emitWrapped(level + 1, null, GedcomNode.CONT, segments[i], out);
            }
        }
        for (GedcomNode child : node.getChildren()) {
            emit(child, out);
        }
    }

    private void emitWrapped(int level, String pointerId, String tag, String text, List<String> out) {
        // CONC siblings of a CONT line stay at the same level and merge in order
        int continuationLevel = GedcomNode.CONT.equals(tag) ? level : level + 1;
        if (continuationLevel > LineScanner.MAX_LEVEL) {
            out.add(format(level, pointerId, tag, text));
            return;
        }
        List<String> chunks = chunk(text);
        out.add(format(level, pointerId, tag, chunks.get(0)));
        for (int i = 1; i < chunks.size(); i++) {
            out.add(format(continuationLevel, null, GedcomNode.CONC, chunks.get(i)));
        }
    }

    private static void checkWritable(GedcomNode node) {
        if (node.getLevel() > LineScanner.MAX_LEVEL) {
            throw new UnwritableRecordException("Level above " + LineScanner.MAX_LEVEL, node.toString());
        }
        String value = node.getValue();
        if (value == null) {
            return;
        }
        if (node.getLevel() >= LineScanner.MAX_LEVEL && value.contains("\n")) {
            throw new UnwritableRecordException(
                "Multi-line value at level " + LineScanner.MAX_LEVEL + " needs CONT lines below the deepest level",
                node.toString());
        }
        if (node.getLevel() == 0 && node.getPointerId() == null && CrossReferenceIndex.isPointer(value)) {
            throw new UnwritableRecordException(
                "Level 0 value would be read back as the record's pointer-id", node.toString());
        }
    }

    List<String> chunk(String text) {
        List<String> chunks = new ArrayList<>();
        int start = 0;
        while (text.length() - start > maxValueLength) {
            int end = start + maxValueLength;
            if (Character.isHighSurrogate(text.charAt(end - 1))) {
                end--;
            }
            chunks.add(text.substring(start, end));
            start = end;
        }
        chunks.add(text.substring(start));
        return chunks;
    }

    private static String format(int level, String pointerId, String tag, String value) {
        StringBuilder sb = new StringBuilder();
        sb.append(level);
        if (pointerId != null) {
            sb.append(' ').append(pointerId);
        }
        sb.append(' ').append(tag);
        if (value != null && !value.isEmpty()) {
            sb.append(' ').append(value);
        }
        return sb.toString();
    }
}
