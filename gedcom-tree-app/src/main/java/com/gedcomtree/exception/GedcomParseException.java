package com.gedcomtree.exception;

/**
 * Fatal error raised while turning text into a {@code GedcomFile}.
 * No partial result is ever returned alongside one of these.
 */
public class GedcomParseException extends GedcomException {

    private final int lineNumber;
    private final String line;

    public GedcomParseException(String message, int lineNumber, String line) {
        super(format(message, lineNumber, line));
        this.lineNumber = lineNumber;
        this.line = line;
    }

    /**
     * @return 1-based line number of the offending line, or 0 when not tied to a line
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }

    private static String format(String message, int lineNumber, String line) {
        if (lineNumber <= 0) {
            return message;
        }
        return message + " (line " + lineNumber + ": \"" + line + "\")";
    }
}
