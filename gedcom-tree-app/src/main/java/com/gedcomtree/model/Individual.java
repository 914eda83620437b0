package com.gedcomtree.model;

import com.gedcomtree.exception.RecordNotFoundException;

import java.util.List;
import java.util.Optional;

/**
 * INDI record: one person.
 */
public class Individual extends GedcomRecord {

    public Individual(GedcomNode node, CrossReferenceIndex index) {
        super(node, index);
    }

    @Override
    public RecordKind kind() {
        return RecordKind.INDIVIDUAL;
    }

    // ========== NAMES ==========

    /**
     * The preferred name: the first NAME without a TYPE qualifier, otherwise
     * the first NAME. An empty NAME value falls back to its GIVN and SURN parts.
     *
     * @throws RecordNotFoundException if there is no NAME at all
     * @throws com.gedcomtree.exception.MalformedValueException if the surname delimiters are unbalanced
     */
    public PersonalName name() {
        List<GedcomRecord> names = childrenTagged("NAME");
        if (names.isEmpty()) {
            throw new RecordNotFoundException("NAME", describe());
        }
        GedcomRecord preferred = names.stream()
            .filter(n -> !n.hasChild("TYPE"))
            .findFirst()
            .orElse(names.get(0));
        return nameOf(preferred);
    }

    /**
     * All names qualified with {@code TYPE aka}, in document order.
     */
    public List<PersonalName> aka() {
        return childrenTagged("NAME").stream()
            .filter(n -> n.findChild("TYPE")
                .map(GedcomRecord::value)
                .filter("aka"::equalsIgnoreCase)
                .isPresent())
            .map(Individual::nameOf)
            .toList();
    }

    private static PersonalName nameOf(GedcomRecord name) {
        if (name.value() == null || name.value().isBlank()) {
            return new PersonalName(
                name.childValue("GIVN").orElse(null),
                name.childValue("SURN").orElse(null)
            );
        }
        return PersonalName.parse(name.value());
    }

    public Optional<String> title() {
        return childValue("TITL");
    }

    // ========== EVENTS ==========

    public Birth birth() {
        return first(RecordKind.BIRTH, Birth.class);
    }

    public Death death() {
        return first(RecordKind.DEATH, Death.class);
    }

    public Burial burial() {
        return first(RecordKind.BURIAL, Burial.class);
    }

    public Residence residence() {
        return first(RecordKind.RESIDENCE, Residence.class);
    }

    // ========== SEX ==========

    /**
     * @throws RecordNotFoundException if there is no SEX child
     */
    public String sex() {
        return child("SEX").value();
    }

    public String gender() {
        return sex();
    }

    public boolean isMale() {
        return childValue("SEX").filter("M"::equalsIgnoreCase).isPresent();
    }

    public boolean isFemale() {
        return childValue("SEX").filter("F"::equalsIgnoreCase).isPresent();
    }

    /**
     * Record the sex as {@code M} or {@code F}, replacing any existing value.
     *
     * @throws IllegalArgumentException for anything other than m, M, f or F
     */
    public void setSex(String sex) {
        String normalized = sex == null ? "" : sex.toUpperCase();
        if (!normalized.equals("M") && !normalized.equals("F")) {
            throw new IllegalArgumentException("Sex must be M or F, got: " + sex);
        }
        Optional<GedcomRecord> existing = findChild("SEX");
        if (existing.isPresent()) {
            existing.get().setValue(normalized);
        } else {
            addChild(new GenericRecord(new GedcomNode(level() + 1, "SEX", normalized), index()));
        }
    }

    // ========== RELATIONSHIPS ==========

    public List<Family> familiesAsChild() {
        return resolveFamilies("FAMC");
    }

    public List<Family> familiesAsSpouse() {
        return resolveFamilies("FAMS");
    }

    /**
     * Partners of the first family this person is a child of, husbands
     * before wives. Empty when there is no FAMC link.
     *
     * @throws com.gedcomtree.exception.UnresolvedReferenceException if the family or a partner pointer is dangling
     */
    public List<Individual> parents() {
        return findFirstFamilyAsChild()
            .map(family -> family.partners().stream()
                .map(Spouse::asIndividual)
                .toList())
            .orElse(List.of());
    }

    /**
     * @throws RecordNotFoundException if there is no FAMC link or the family has no husband
     */
    public Individual father() {
        return firstFamilyAsChild().husband();
    }

    /**
     * @throws RecordNotFoundException if there is no FAMC link or the family has no wife
     */
    public Individual mother() {
        return firstFamilyAsChild().wife();
    }

    private Family firstFamilyAsChild() {
        return findFirstFamilyAsChild().orElseThrow(() -> new RecordNotFoundException("FAMC", describe()));
    }

    private Optional<Family> findFirstFamilyAsChild() {
        return findChild("FAMC")
            .map(link -> index().resolve(link.value(), RecordKind.FAMILY, Family.class));
    }

    private List<Family> resolveFamilies(String tag) {
        return childrenTagged(tag).stream()
            .map(link -> index().resolve(link.value(), RecordKind.FAMILY, Family.class))
            .toList();
    }
}
