package com.gedcomtree.service;

import com.gedcomtree.config.GedcomConfig;
import com.gedcomtree.exception.MalformedValueException;
import com.gedcomtree.exception.RecordNotFoundException;
import com.gedcomtree.exception.UnresolvedReferenceException;
import com.gedcomtree.model.Family;
import com.gedcomtree.model.GedcomFile;
import com.gedcomtree.model.GedcomRecord;
import com.gedcomtree.model.Individual;
import com.gedcomtree.model.PersonalName;
import com.gedcomtree.parser.GedcomParser;
import com.gedcomtree.writer.GedcomSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;

@Service
public class GedcomService {

    private static final Logger log = LoggerFactory.getLogger(GedcomService.class);

    private final GedcomParser parser;
    private final GedcomSerializer serializer;
    private final GedcomConfig config;

    public GedcomService(GedcomParser parser, GedcomSerializer serializer, GedcomConfig config) {
        this.parser = parser;
        this.serializer = serializer;
        this.config = config;
    }

    public GedcomFile parse(String text) {
        GedcomFile file = parser.parse(text);
        log.info("Parsed GEDCOM with {} records: {} individuals, {} families",
            file.size(), file.individuals().count(), file.families().count());
        return file;
    }

    public String serialize(GedcomFile file) {
        return serializer.serialize(file);
    }

    /**
     * Parse and write back, re-wrapping long values.
     *
     * @param ensureHeader add HEAD and TRLR records when the input lacks them
     */
    public String normalize(String text, boolean ensureHeader) {
        GedcomFile file = parse(text);
        if (ensureHeader) {
            file.ensureHeaderTrailer(config.getSourceName(), config.getSourceVersion());
        }
        return serializer.serialize(file);
    }

    // ========== SUMMARY ==========

    /**
     * Flatten individuals and families into plain values. A field a record
     * does not carry becomes null; one bad record never hides the others.
     */
    public GedcomSummary summarize(GedcomFile file) {
        List<PersonSummary> people = file.individuals()
            .map(this::summarizePerson)
            .toList();
        List<FamilySummary> families = file.families()
            .map(this::summarizeFamily)
            .toList();
        return new GedcomSummary(file.size(), people, families);
    }

    private PersonSummary summarizePerson(Individual person) {
        PersonalName name = lenient(person::name, person);
        List<String> parentIds = lenient(() -> ids(person.parents()), person);
        return new PersonSummary(
            person.id(),
            name != null ? name.given() : null,
            name != null ? name.surname() : null,
            lenient(person::sex, person),
            lenient(() -> person.birth().date(), person),
            lenient(() -> person.death().date(), person),
            parentIds != null ? parentIds : List.of()
        );
    }

    private FamilySummary summarizeFamily(Family family) {
        List<String> childIds = lenient(() -> ids(family.children()), family);
        return new FamilySummary(
            family.id(),
            lenient(() -> family.husband().id(), family),
            lenient(() -> family.wife().id(), family),
            lenient(() -> family.marriage().date(), family),
            childIds != null ? childIds : List.of()
        );
    }

    private static List<String> ids(List<? extends GedcomRecord> records) {
        return records.stream().map(GedcomRecord::id).toList();
    }

    private static <T> T lenient(Supplier<T> accessor, GedcomRecord record) {
        try {
            return accessor.get();
        } catch (RecordNotFoundException e) {
            return null;
        } catch (UnresolvedReferenceException | MalformedValueException e) {
            log.warn("Skipping field of {} {}: {}", record.tag(), record.id(), e.getMessage());
            return null;
        }
    }

    // ========== DTO ==========

    public record GedcomSummary(int recordCount, List<PersonSummary> individuals, List<FamilySummary> families) {}

    public record PersonSummary(String id, String givenName, String surname, String sex,
                                String birthDate, String deathDate, List<String> parentIds) {}

    public record FamilySummary(String id, String husbandId, String wifeId,
                                String marriageDate, List<String> childIds) {}
}
