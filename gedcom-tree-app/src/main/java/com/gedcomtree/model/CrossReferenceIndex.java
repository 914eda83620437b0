package com.gedcomtree.model;

import com.gedcomtree.exception.DuplicatePointerException;
import com.gedcomtree.exception.UnresolvedReferenceException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Pointer-id to declaring top-level record. Lookup only: the records stay
 * owned by the file's forest.
 */
public class CrossReferenceIndex {

    private static final Pattern POINTER = Pattern.compile("@[^@\\s]+@");

    private final Map<String, GedcomRecord> records = new LinkedHashMap<>();

    public static boolean isPointer(String value) {
        return value != null && POINTER.matcher(value).matches();
    }

    /**
     * Index a top-level record under its pointer-id. Records without one are ignored.
     *
     * @throws DuplicatePointerException if another record already declares the same id
     */
    public void register(GedcomRecord record) {
        String pointerId = record.id();
        if (pointerId == null) {
            return;
        }
        if (records.containsKey(pointerId)) {
            GedcomNode node = record.node();
            throw new DuplicatePointerException(pointerId, node.getLineNumber(), node.getSourceText());
        }
        records.put(pointerId, record);
    }

    public boolean contains(String pointerId) {
        return records.containsKey(pointerId);
    }

    public int size() {
        return records.size();
    }

    public Optional<GedcomRecord> find(String pointerId) {
        return Optional.ofNullable(records.get(pointerId));
    }

    /**
     * @throws UnresolvedReferenceException if nothing declares {@code pointerId}
     */
    public GedcomRecord resolve(String pointerId) {
        if (pointerId == null) {
            throw new UnresolvedReferenceException(null, "Missing pointer value");
        }
        GedcomRecord record = records.get(pointerId);
        if (record == null) {
            throw new UnresolvedReferenceException(pointerId, "No record declares " + pointerId);
        }
        return record;
    }

    /**
     * Resolve and check the target's variant.
     *
     * @throws UnresolvedReferenceException if the pointer is dangling or names a record of another kind
     */
    public <T extends GedcomRecord> T resolve(String pointerId, RecordKind kind, Class<T> type) {
        GedcomRecord record = resolve(pointerId);
        if (record.kind() != kind) {
            throw new UnresolvedReferenceException(pointerId,
                pointerId + " is a " + record.tag() + " record, expected " + kind.tag());
        }
        return type.cast(record);
    }
}
