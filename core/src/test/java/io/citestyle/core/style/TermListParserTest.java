package io.citestyle.core.style;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.citestyle.core.error.StyleStructureException;
import io.citestyle.core.model.StyleNode;
import io.citestyle.core.model.Term;
import io.citestyle.core.model.TermList;
import org.junit.jupiter.api.Test;

class TermListParserTest {

    private final TermListParser parser = new TermListParser("<test>");

    private TermList parse(String termsXml) {
        StyleNode terms = new StyleReader().parse(termsXml, StyleReader.INLINE).withoutComments();
        return parser.parse(terms.elements());
    }

    @Test
    void termWithoutVariantsYieldsOneTerm() {
        TermList terms = parse("<terms><term name=\"and\">and</term></terms>");

        assertThat(terms.terms()).containsExactly(new Term("and", "long", null, null, null, null, "and"));
    }

    @Test
    void singleAndMultipleYieldOneTermEach() {
        TermList terms = parse("""
                <terms>
                  <term name="editor" form="short">
                    <single>ed.</single>
                    <multiple>eds.</multiple>
                  </term>
                </terms>
                """);

        assertThat(terms.size()).isEqualTo(2);
        assertThat(terms.find("editor", "short", Term.Plurality.SINGLE)).map(Term::value).hasValue("ed.");
        assertThat(terms.find("editor", "short", Term.Plurality.MULTIPLE)).map(Term::value).hasValue("eds.");
    }

    @Test
    void genderAndMatchAttributesAreKept() {
        TermList terms = parse("""
                <terms>
                  <term name="month-01" gender="masculine">janvier</term>
                  <term name="ordinal-01" gender-form="feminine" match="whole-number">re</term>
                </terms>
                """);

        assertThat(terms.terms().get(0).gender()).isEqualTo("masculine");
        assertThat(terms.terms().get(1).genderForm()).isEqualTo("feminine");
        assertThat(terms.terms().get(1).match()).isEqualTo("whole-number");
    }

    @Test
    void emptyTermHasEmptyValue() {
        assertThat(parse("<terms><term name=\"no date\" form=\"short\"/></terms>").terms().get(0).value())
                .isEmpty();
    }

    @Test
    void nonTermChildIsAStructureError() {
        assertThatThrownBy(() -> parse("<terms><text value=\"x\"/></terms>"))
                .isInstanceOf(StyleStructureException.class)
                .hasMessageContaining("found <text>");
    }

    @Test
    void termWithoutNameIsAStructureError() {
        assertThatThrownBy(() -> parse("<terms><term>x</term></terms>"))
                .isInstanceOf(StyleStructureException.class)
                .hasMessageContaining("'name'");
    }

    @Test
    void unknownVariantIsAStructureError() {
        assertThatThrownBy(() -> parse("<terms><term name=\"page\"><plural>pp.</plural></term></terms>"))
                .isInstanceOf(StyleStructureException.class)
                .hasMessageContaining("<single> and <multiple>");
    }
}
