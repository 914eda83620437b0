package com.gedcomtree.model;

import com.gedcomtree.exception.RecordNotFoundException;
import com.gedcomtree.exception.UnresolvedReferenceException;
import com.gedcomtree.parser.GedcomParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FamilyTest {

    private GedcomFile file;

    @BeforeEach
    void setUp() {
        file = GedcomParser.withDefaults().parse("""
            0 @P1@ INDI
            1 NAME Mary /Jones/
            0 @P5@ INDI
            1 NAME Tom /Brown/
            0 @C1@ INDI
            1 NAME Ann /Brown/
            0 @C2@ INDI
            1 NAME Ben /Brown/
            0 @F1@ FAM
            1 HUSB @P5@
            1 WIFE @P1@
            1 MARR
            2 DATE 12 JUN 1960
            2 PLAC Leeds
            1 CHIL @C1@
            1 CHIL @C2@
            0 @F2@ FAM
            1 WIFE @P1@
            1 CHIL @X9@
            """);
    }

    private Family family(String id) {
        return (Family) file.record(id);
    }

    @Test
    void resolvesHusbandAndWifeByPointer() {
        Family family = family("@F1@");

        assertThat(family.husband().id()).isEqualTo("@P5@");
        assertThat(family.wife().id()).isEqualTo("@P1@");
        assertThat(family.husband()).isSameAs(file.record("@P5@"));
    }

    @Test
    void partnersListHusbandsBeforeWives() {
        Family family = family("@F1@");

        assertThat(family.partners()).extracting(Spouse::value).containsExactly("@P5@", "@P1@");
        assertThat(family.partners()).extracting(Spouse::kind).containsExactly(RecordKind.HUSBAND, RecordKind.WIFE);
        assertThat(family.husbands()).hasSize(1);
        assertThat(family.wives()).hasSize(1);
    }

    @Test
    void partnerResolvesToIndividual() {
        Spouse wife = family("@F1@").wives().get(0);

        assertThat(wife.asIndividual().name().given()).isEqualTo("Mary");
    }

    @Test
    void childrenResolveInDocumentOrder() {
        assertThat(family("@F1@").children()).extracting(Individual::id).containsExactly("@C1@", "@C2@");
    }

    @Test
    void marriageIsAnEvent() {
        Marriage marriage = family("@F1@").marriage();

        assertThat(marriage.date()).isEqualTo("12 JUN 1960");
        assertThat(marriage.place()).isEqualTo("Leeds");
    }

    @Test
    void missingHusbandIsNotFound() {
        assertThatThrownBy(() -> family("@F2@").husband()).isInstanceOf(RecordNotFoundException.class);
        assertThatThrownBy(() -> family("@F2@").marriage()).isInstanceOf(RecordNotFoundException.class);
    }

    @Test
    void danglingChildIsUnresolved() {
        assertThatThrownBy(() -> family("@F2@").children())
            .isInstanceOf(UnresolvedReferenceException.class)
            .hasMessageContaining("@X9@");
    }

    @Test
    void genericChildRecordsStayAvailable() {
        assertThat(family("@F1@").childRecords()).extracting(GedcomRecord::tag)
            .containsExactly("HUSB", "WIFE", "MARR", "CHIL", "CHIL");
        assertThat(family("@F1@").childrenTagged("CHIL")).extracting(GedcomRecord::value)
            .containsExactly("@C1@", "@C2@");
    }
}
