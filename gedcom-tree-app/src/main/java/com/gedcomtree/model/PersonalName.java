package com.gedcomtree.model;

import com.gedcomtree.exception.MalformedValueException;

/**
 * A name split into given name and surname; either part may be null.
 */
public record PersonalName(String given, String surname) {

    /**
     * Split a NAME value on the {@code /surname/} convention.
     * {@code "John /Smith/"} gives (John, Smith); a value without any slash
     * is taken as the given name alone. Text after the closing slash is dropped.
     *
     * @throws MalformedValueException for an unterminated or repeated surname delimiter
     */
    public static PersonalName parse(String value) {
        if (value == null || value.isBlank()) {
            return new PersonalName(null, null);
        }
        String[] parts = value.split("/", -1);
        return switch (parts.length) {
            case 1 -> new PersonalName(blankToNull(parts[0]), null);
            case 3 -> new PersonalName(blankToNull(parts[0]), blankToNull(parts[1]));
            default -> throw new MalformedValueException("Malformed name field: " + value);
        };
    }

    public String displayName() {
        String first = given != null ? given : "";
        String last = surname != null ? surname : "";
        String full = (first + " " + last).trim();
        return full.isEmpty() ? "Unknown" : full;
    }

    private static String blankToNull(String s) {
        String trimmed = s.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
