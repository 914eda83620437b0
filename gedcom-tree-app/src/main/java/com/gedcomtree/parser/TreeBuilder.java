package com.gedcomtree.parser;

import com.gedcomtree.exception.StructuralException;
import com.gedcomtree.model.GedcomLine;
import com.gedcomtree.model.GedcomNode;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Rebuilds level nesting from a flat line sequence. The ancestor stack
 * holds one node per open level, so its size is the deepest level a new
 * line may take.
 */
@Component
public class TreeBuilder {

    /**
     * @return the top-level nodes, in document order
     * @throws StructuralException if a line is more than one level deeper than its predecessor chain allows
     */
    public List<GedcomNode> build(List<GedcomLine> lines) {
        List<GedcomNode> roots = new ArrayList<>();
        Deque<GedcomNode> ancestors = new ArrayDeque<>();

        for (GedcomLine line : lines) {
            int depth = ancestors.size();
            if (line.level() > depth) {
                String message = depth == 0
                    ? "Level " + line.level() + " line has no enclosing record"
                    : "Level " + line.level() + " skips past parent level " + (depth - 1);
                throw new StructuralException(message, line.lineNumber(), line.sourceText());
            }
            while (ancestors.size() > line.level()) {
                ancestors.pop();
            }

            GedcomNode node = GedcomNode.fromLine(line);
            if (ancestors.isEmpty()) {
                roots.add(node);
            } else {
                ancestors.peek().addChild(node);
            }
            ancestors.push(node);
        }
        return roots;
    }
}
