package com.gedcomtree.parser;

import com.gedcomtree.model.GedcomFile;
import com.gedcomtree.model.GedcomLine;
import com.gedcomtree.model.GedcomNode;
import com.gedcomtree.model.RecordClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Entry point for reading GEDCOM: scan, build, merge continuations,
 * classify and index. Any parse error aborts the whole call.
 */
@Component
public class GedcomParser {

    private static final Logger log = LoggerFactory.getLogger(GedcomParser.class);

    private final LineScanner lineScanner;
    private final TreeBuilder treeBuilder;
    private final ContinuationMerger continuationMerger;
    private final RecordClassifier recordClassifier;

    public GedcomParser(LineScanner lineScanner,
                        TreeBuilder treeBuilder,
                        ContinuationMerger continuationMerger,
                        RecordClassifier recordClassifier) {
        this.lineScanner = lineScanner;
        this.treeBuilder = treeBuilder;
        this.continuationMerger = continuationMerger;
        this.recordClassifier = recordClassifier;
    }

    public static GedcomParser withDefaults() {
        return new GedcomParser(new LineScanner(), new TreeBuilder(), new ContinuationMerger(), new RecordClassifier());
    }

    /**
     * @throws com.gedcomtree.exception.GedcomParseException if the text is malformed, mis-nested or declares a pointer twice
     */
    public GedcomFile parse(String text) {
        return build(lineScanner.scanText(text));
    }

    public GedcomFile parse(Iterable<String> lines) {
        return build(lineScanner.scanAll(lines));
    }

    private GedcomFile build(List<GedcomLine> lines) {
        List<GedcomNode> roots = treeBuilder.build(lines);
        continuationMerger.merge(roots);
        GedcomFile file = GedcomFile.of(roots, recordClassifier);
        log.debug("Parsed {} lines into {} records ({} pointers)", lines.size(), file.size(), file.index().size());
        return file;
    }
}
