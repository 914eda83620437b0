package com.gedcomtree.parser;

import com.gedcomtree.exception.MalformedLineException;
import com.gedcomtree.model.CrossReferenceIndex;
import com.gedcomtree.model.GedcomLine;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into physical lines and decomposes each one into
 * {@code LEVEL [POINTER] TAG [VALUE]}.
 */
@Component
public class LineScanner {

    public static final int MAX_LEVEL = 99;

    private static final Pattern LEVEL_PREFIX = Pattern.compile("^\\d+");
    private static final Pattern LINE_FORMAT = Pattern.compile(
        "^(?<level>\\d+)[ \\t]+(?:(?<pointer>@[^@\\s]+@)[ \\t]+)?(?<tag>[_A-Z0-9]+)(?:[ ](?<value>.*)|\\s*)$");
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    public List<GedcomLine> scanText(String text) {
        return scanAll(text.lines().toList());
    }

    /**
     * Scan pre-split lines. Blank lines are skipped but still counted, so
     * line numbers in errors match the source.
     *
     * @throws MalformedLineException on the first line that cannot be decomposed
     */
    public List<GedcomLine> scanAll(Iterable<String> lines) {
        List<GedcomLine> result = new ArrayList<>();
        int lineNumber = 0;
        for (String raw : lines) {
            lineNumber++;
            String line = raw;
            if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
                line = line.substring(1);
            }
            if (line.isBlank()) {
                continue;
            }
            result.add(scan(line, lineNumber));
        }
        return result;
    }

    /**
     * @throws MalformedLineException if the level is missing or above 99, or the tag is missing
     */
    public GedcomLine scan(String rawLine, int lineNumber) {
        String line = stripLineEnd(rawLine.stripLeading());

        if (!LEVEL_PREFIX.matcher(line).find()) {
            throw new MalformedLineException("Missing or invalid level number", lineNumber, rawLine);
        }
        Matcher m = LINE_FORMAT.matcher(line);
        if (!m.matches()) {
            throw new MalformedLineException("Cannot decompose line into level, tag and value", lineNumber, rawLine);
        }

        String levelDigits = m.group("level");
        if (levelDigits.length() > 2 || Integer.parseInt(levelDigits) > MAX_LEVEL) {
            throw new MalformedLineException("Level out of range 0-" + MAX_LEVEL, lineNumber, rawLine);
        }
        int level = Integer.parseInt(levelDigits);
        String pointer = m.group("pointer");
        String tag = m.group("tag");
        String value = m.group("value");

        // "0 INDI @P1@" declares the pointer after the tag, so a level-0 value
        // that looks like a pointer can never be read back as a value
        if (level == 0 && pointer == null && CrossReferenceIndex.isPointer(value)) {
            pointer = value;
            value = null;
        }
        return new GedcomLine(lineNumber, level, pointer, tag, value == null || value.isEmpty() ? null : value, rawLine);
    }

    private static String stripLineEnd(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\r' || line.charAt(end - 1) == '\n')) {
            end--;
        }
        return line.substring(0, end);
    }
}
