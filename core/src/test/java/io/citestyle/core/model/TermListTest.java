package io.citestyle.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import io.citestyle.core.model.Term.Plurality;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link TermList} merging and lookup. */
class TermListTest {

    private static Term term(String name, String form, Plurality number, String value) {
        return new Term(name, form, number, null, null, null, value);
    }

    @Test
    void overridingReplacesBothVariantsOfTheSameTerm() {
        TermList base = new TermList(List.of(
                term("editor", "short", Plurality.SINGLE, "ed."),
                term("editor", "short", Plurality.MULTIPLE, "eds."),
                term("and", null, null, "and")));
        TermList overrides = new TermList(List.of(term("editor", "short", null, "Hg.")));

        TermList merged = overrides.overriding(base);

        assertThat(merged.named("editor")).extracting(Term::value).containsExactly("Hg.");
        assertThat(merged.find("and", null, null)).map(Term::value).hasValue("and");
    }

    @Test
    void overridingKeepsTermsOfOtherForms() {
        TermList base = new TermList(List.of(term("editor", "long", null, "editor")));
        TermList overrides = new TermList(List.of(term("editor", "short", null, "ed.")));

        assertThat(overrides.overriding(base).size()).isEqualTo(2);
    }

    @Test
    void findFallsBackToLessSpecificForms() {
        TermList terms = new TermList(List.of(
                term("page", "long", Plurality.SINGLE, "page"),
                term("page", "long", Plurality.MULTIPLE, "pages"),
                term("page", "short", Plurality.SINGLE, "p.")));

        assertThat(terms.find("page", "symbol", Plurality.SINGLE)).map(Term::value).hasValue("p.");
        assertThat(terms.find("page", "symbol", Plurality.MULTIPLE)).map(Term::value).hasValue("pages");
        assertThat(terms.find("page", "verb-short", Plurality.SINGLE)).map(Term::value).hasValue("page");
        assertThat(terms.find("chapter", null, null)).isEmpty();
    }

    @Test
    void termDefaultsToLongFormAndEmptyValue() {
        Term term = new Term("and", null, null, null, null, null, null);

        assertThat(term.form()).isEqualTo("long");
        assertThat(term.value()).isEmpty();
    }
}
