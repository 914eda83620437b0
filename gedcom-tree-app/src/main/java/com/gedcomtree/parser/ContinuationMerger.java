package com.gedcomtree.parser;

import com.gedcomtree.exception.StructuralException;
import com.gedcomtree.model.GedcomNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Folds CONT and CONC pseudo-children into their parent's value:
 * CONT appends a newline and its text, CONC appends its text directly.
 * Running it on an already merged tree changes nothing.
 */
@Component
public class ContinuationMerger {

    public void merge(List<GedcomNode> roots) {
        for (GedcomNode root : roots) {
            if (root.isContinuation()) {
                throw new StructuralException("Continuation line outside any record",
                    root.getLineNumber(), root.getSourceText());
            }
            merge(root);
        }
    }

    /**
     * Merge bottom-up, so a continuation's own continuations are folded
     * into it before it is folded into {@code node}.
     */
    public void merge(GedcomNode node) {
        for (GedcomNode child : List.copyOf(node.getChildren())) {
            merge(child);
        }
        for (GedcomNode child : List.copyOf(node.getChildren())) {
            if (!child.isContinuation()) {
                continue;
            }
            if (child.hasChildren()) {
                throw new StructuralException("Continuation line cannot carry sub-records",
                    child.getLineNumber(), child.getSourceText());
            }
            node.setValue(join(node.getValue(), child));
            node.removeChild(child);
        }
    }

    private static String join(String value, GedcomNode continuation) {
        String head = value == null ? "" : value;
        String tail = continuation.getValue() == null ? "" : continuation.getValue();
        if (GedcomNode.CONT.equals(continuation.getTag())) {
            return head + "\n" + tail;
        }
        return head + tail;
    }
}
