package com.gedcomtree.model;

/**
 * Closed set of record variants the accessor layer knows about.
 * Anything else classifies to {@link #GENERIC}.
 */
public enum RecordKind {
    INDIVIDUAL("INDI"),
    FAMILY("FAM"),
    BIRTH("BIRT"),
    DEATH("DEAT"),
    BURIAL("BURI"),
    MARRIAGE("MARR"),
    RESIDENCE("RESI"),
    HUSBAND("HUSB"),
    WIFE("WIFE"),
    SOURCE("SOUR"),
    NOTE("NOTE"),
    GENERIC(null);

    private final String tag;

    RecordKind(String tag) {
        this.tag = tag;
    }

    /**
     * @return the tag this kind is registered under, or null for {@link #GENERIC}
     */
    public String tag() {
        return tag;
    }
}
