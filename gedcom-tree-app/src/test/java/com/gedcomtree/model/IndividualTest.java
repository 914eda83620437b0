package com.gedcomtree.model;

import com.gedcomtree.exception.MalformedValueException;
import com.gedcomtree.exception.RecordNotFoundException;
import com.gedcomtree.exception.UnresolvedReferenceException;
import com.gedcomtree.parser.GedcomParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndividualTest {

    private static final String FAMILY = """
        0 HEAD
        0 @I1@ INDI
        1 NAME Robert /Cox/
        1 NAME Bob /Cox/
        2 TYPE aka
        1 NAME
        2 GIVN Rob
        2 SURN Cox
        2 TYPE aka
        1 SEX M
        1 FAMS @F1@
        0 @I2@ INDI
        1 NAME Joann /Para/
        1 SEX F
        1 FAMS @F1@
        0 @I3@ INDI
        1 NAME Bobby Jo /Cox/
        1 SEX M
        1 FAMC @F1@
        0 @F1@ FAM
        1 HUSB @I1@
        1 WIFE @I2@
        1 MARR
        1 CHIL @I3@
        0 TRLR
        """;

    private static Individual only(String text) {
        return GedcomParser.withDefaults().parse(text).individuals().findFirst().orElseThrow();
    }

    private static Individual person(String id) {
        return (Individual) GedcomParser.withDefaults().parse(FAMILY).record(id);
    }

    @Nested
    @DisplayName("name")
    class Name {

        @Test
        void prefersNameWithoutType() {
            assertThat(person("@I1@").name()).isEqualTo(new PersonalName("Robert", "Cox"));
        }

        @Test
        void keepsMultiWordGivenNames() {
            assertThat(person("@I3@").name()).isEqualTo(new PersonalName("Bobby Jo", "Cox"));
        }

        @Test
        void collectsAkaNamesInOrder() {
            assertThat(person("@I1@").aka()).containsExactly(
                new PersonalName("Bob", "Cox"),
                new PersonalName("Rob", "Cox"));
        }

        @Test
        void akaIsEmptyWithoutTypedNames() {
            assertThat(person("@I2@").aka()).isEmpty();
        }

        @Test
        void fallsBackToGivenAndSurnameParts() {
            Individual bob = only("0 @I1@ INDI\n1 NAME\n2 GIVN Bob\n2 SURN Cox");

            assertThat(bob.name()).isEqualTo(new PersonalName("Bob", "Cox"));
        }

        @Test
        void givenNameOnlyFromParts() {
            assertThat(only("0 @I1@ INDI\n1 NAME\n2 GIVN Bob").name()).isEqualTo(new PersonalName("Bob", null));
        }

        @Test
        void surnameOnlyFromParts() {
            assertThat(only("0 @I1@ INDI\n1 NAME\n2 SURN Bob").name()).isEqualTo(new PersonalName(null, "Bob"));
        }

        @Test
        void valueWithoutDelimiterIsGivenNameOnly() {
            assertThat(only("0 @I1@ INDI\n1 NAME Bob").name()).isEqualTo(new PersonalName("Bob", null));
        }

        @Test
        void emptyNameGivesNoParts() {
            assertThat(only("0 @I1@ INDI\n1 NAME \n0 TRLR").name()).isEqualTo(new PersonalName(null, null));
        }

        @Test
        void unterminatedSurnameIsMalformed() {
            Individual bob = only("0 @I1@ INDI\n1 NAME Bob /Russel");

            assertThatThrownBy(bob::name).isInstanceOf(MalformedValueException.class);
        }

        @Test
        void missingNameIsNotFound() {
            Individual nobody = only("0 @I1@ INDI\n1 SEX M");

            assertThatThrownBy(nobody::name)
                .isInstanceOf(RecordNotFoundException.class)
                .hasMessageContaining("NAME");
        }
    }

    @Nested
    @DisplayName("sex")
    class Sex {

        @Test
        void predicatesFollowSexValue() {
            assertThat(person("@I1@").isMale()).isTrue();
            assertThat(person("@I1@").isFemale()).isFalse();
            assertThat(person("@I2@").isFemale()).isTrue();
            assertThat(person("@I2@").isMale()).isFalse();
        }

        @Test
        void genderIsAnAliasForSex() {
            assertThat(person("@I2@").sex()).isEqualTo("F");
            assertThat(person("@I2@").gender()).isEqualTo("F");
        }

        @Test
        void lowercaseValuesStillMatch() {
            assertThat(only("0 @I1@ INDI\n1 SEX f").isFemale()).isTrue();
        }

        @Test
        void missingSexIsNeitherAndSexIsNotFound() {
            Individual unknown = only("0 @I1@ INDI\n1 NAME A /B/");

            assertThat(unknown.isMale()).isFalse();
            assertThat(unknown.isFemale()).isFalse();
            assertThatThrownBy(unknown::sex).isInstanceOf(RecordNotFoundException.class);
        }

        @Test
        void setSexAddsThenReplaces() {
            Individual person = only("0 @I1@ INDI\n1 NAME A /B/");

            person.setSex("m");
            assertThat(person.sex()).isEqualTo("M");
            assertThat(person.child("SEX").level()).isEqualTo(1);

            person.setSex("F");
            assertThat(person.childrenTagged("SEX")).hasSize(1);
            assertThat(person.isFemale()).isTrue();
        }

        @Test
        void setSexRejectsAnythingElse() {
            Individual person = only("0 @I1@ INDI");

            assertThatThrownBy(() -> person.setSex("female")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> person.setSex("foo")).isInstanceOf(IllegalArgumentException.class);
            assertThat(person.hasChild("SEX")).isFalse();
        }
    }

    @Nested
    @DisplayName("events")
    class Events {

        @Test
        void birthAndDeathExposeDateAndPlace() {
            Individual bob = only("""
                0 @I1@ INDI
                1 BIRT
                2 DATE 1980
                2 PLAC London
                1 DEAT
                2 DATE 2040
                2 PLAC Leeds
                """);

            assertThat(bob.birth().date()).isEqualTo("1980");
            assertThat(bob.birth().place()).isEqualTo("London");
            assertThat(bob.death().date()).isEqualTo("2040");
            assertThat(bob.death().place()).isEqualTo("Leeds");
        }

        @Test
        void firstEventWins() {
            Individual bob = only("0 @I1@ INDI\n1 RESI\n2 PLAC York\n1 RESI\n2 PLAC Hull");

            assertThat(bob.residence().place()).isEqualTo("York");
        }

        @Test
        void missingEventsAreNotFound() {
            Individual bob = only("0 @I1@ INDI\n1 NAME Bob /Cox/");

            assertThatThrownBy(bob::birth).isInstanceOf(RecordNotFoundException.class).hasMessageContaining("BIRT");
            assertThatThrownBy(bob::death).isInstanceOf(RecordNotFoundException.class);
            assertThatThrownBy(bob::burial).isInstanceOf(RecordNotFoundException.class);
            assertThatThrownBy(bob::residence).isInstanceOf(RecordNotFoundException.class);
        }

        @Test
        void lookupIsNotDeep() {
            Individual bob = only("0 @I1@ INDI\n1 EVEN\n2 BIRT\n3 DATE 1900");

            assertThatThrownBy(bob::birth).isInstanceOf(RecordNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("parents")
    class Parents {

        @Test
        void resolvesFatherAndMotherThroughFamily() {
            Individual child = person("@I3@");

            assertThat(child.father().id()).isEqualTo("@I1@");
            assertThat(child.mother().id()).isEqualTo("@I2@");
            assertThat(child.parents()).extracting(Individual::id).containsExactly("@I1@", "@I2@");
        }

        @Test
        void withoutFamilyLinkParentsIsEmpty() {
            Individual bob = person("@I1@");

            assertThat(bob.parents()).isEmpty();
        }

        @Test
        void withoutFamilyLinkFatherAndMotherAreNotFound() {
            Individual bob = person("@I1@");

            assertThatThrownBy(bob::father).isInstanceOf(RecordNotFoundException.class).hasMessageContaining("FAMC");
            assertThatThrownBy(bob::mother).isInstanceOf(RecordNotFoundException.class);
        }

        @Test
        void singleParentFamilyHasOneSlot() {
            Individual child = only("""
                0 @I3@ INDI
                1 FAMC @F1@
                0 @I2@ INDI
                1 SEX F
                0 @F1@ FAM
                1 WIFE @I2@
                1 CHIL @I3@
                """);
            List<Individual> parents = child.parents();

            assertThat(parents).hasSize(1);
            assertThat(child.mother().id()).isEqualTo("@I2@");
            assertThatThrownBy(child::father).isInstanceOf(RecordNotFoundException.class).hasMessageContaining("HUSB");
            assertThatThrownBy(() -> parents.get(1)).isInstanceOf(IndexOutOfBoundsException.class);
        }

        @Test
        void danglingFamilyLinkIsUnresolved() {
            Individual child = only("0 @I3@ INDI\n1 FAMC @F404@");

            assertThatThrownBy(child::parents)
                .isInstanceOf(UnresolvedReferenceException.class)
                .satisfies(e -> assertThat(((UnresolvedReferenceException) e).getPointerId()).isEqualTo("@F404@"));
        }

        @Test
        void familyLinkToWrongKindIsUnresolved() {
            Individual child = only("0 @I3@ INDI\n1 FAMC @I3@");

            assertThatThrownBy(child::father).isInstanceOf(UnresolvedReferenceException.class);
        }

        @Test
        void familiesAsSpouseAndChild() {
            assertThat(person("@I1@").familiesAsSpouse()).extracting(Family::id).containsExactly("@F1@");
            assertThat(person("@I1@").familiesAsChild()).isEmpty();
            assertThat(person("@I3@").familiesAsChild()).extracting(Family::id).containsExactly("@F1@");
        }
    }

    @Nested
    @DisplayName("notes and titles")
    class NotesAndTitles {

        @Test
        void noteIsEmptyWhenAbsent() {
            assertThat(person("@I1@").note()).isEmpty();
        }

        @Test
        void noteJoinsContinuations() {
            assertThat(only("0 @I1@ INDI\n1 NOTE foo\n2 CONT bar").note()).contains("foo\nbar");
            assertThat(only("0 @I1@ INDI\n1 NOTE foo\n2 CONC bar").note()).contains("foobar");
        }

        @Test
        void notePointerFollowsToNoteRecord() {
            Individual bob = only("0 @I1@ INDI\n1 NOTE @N1@\n0 @N1@ NOTE shared\n1 CONT text");

            assertThat(bob.note()).contains("shared\ntext");
        }

        @Test
        void titleIsOptional() {
            assertThat(only("0 @I1@ INDI\n1 TITL King").title()).contains("King");
            assertThat(only("0 @I1@ INDI").title()).isEmpty();
        }
    }

    @Test
    void accessorFailuresLeaveTreeUntouched() {
        Individual bob = only("0 @I1@ INDI\n1 NAME Bob /Russel\n1 FAMC @F9@");
        String before = bob.toString();

        assertThatThrownBy(bob::name).isInstanceOf(MalformedValueException.class);
        assertThatThrownBy(bob::father).isInstanceOf(UnresolvedReferenceException.class);
        assertThatThrownBy(bob::birth).isInstanceOf(RecordNotFoundException.class);

        assertThat(bob.toString()).isEqualTo(before);
    }
}
