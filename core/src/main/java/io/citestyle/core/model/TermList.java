package io.citestyle.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable list of localized terms with CSL form fallback on lookup.
 *
 * <p>
 * Thread-safe.
 */
public final class TermList {

    private static final TermList EMPTY = new TermList(List.of());

    /** Form to try next when a term is not defined in the requested form. */
    private static final Map<String, String> FORM_FALLBACK = Map.of(
            "verb-short", "verb",
            "verb", Term.DEFAULT_FORM,
            "symbol", "short",
            "short", Term.DEFAULT_FORM);

    private final List<Term> terms;

    public TermList(List<Term> terms) {
        this.terms = terms != null ? List.copyOf(terms) : List.of();
    }

    public static TermList empty() {
        return EMPTY;
    }

    public List<Term> terms() {
        return terms;
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    public int size() {
        return terms.size();
    }

    /**
     * Returns a list in which every definition of this list replaces the definitions of
     * {@code base} sharing its {@link Term#overrideKey()}. Base terms that are not overridden keep
     * their relative order and follow this list's terms.
     *
     * @param base the list being overridden
     * @return the merged list
     */
    public TermList overriding(TermList base) {
        if (base.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return base;
        }
        Set<String> overridden = new HashSet<>();
        for (Term term : terms) {
            overridden.add(term.overrideKey());
        }
        List<Term> merged = new ArrayList<>(terms);
        for (Term term : base.terms) {
            if (!overridden.contains(term.overrideKey())) {
                merged.add(term);
            }
        }
        return new TermList(merged);
    }

    /**
     * Finds a term, falling back through less specific forms ({@code verb-short} to {@code verb}
     * to {@code long}, {@code symbol} to {@code short} to {@code long}).
     *
     * @param name   the term name
     * @param form   requested form, {@code null} meaning {@code long}
     * @param number requested plurality; variant-less terms match any plurality
     */
    public Optional<Term> find(String name, String form, Term.Plurality number) {
        String current = form != null ? form : Term.DEFAULT_FORM;
        while (current != null) {
            for (Term term : terms) {
                if (term.name().equals(name)
                        && term.form().equals(current)
                        && (term.number() == null || number == null || term.number() == number)) {
                    return Optional.of(term);
                }
            }
            current = FORM_FALLBACK.get(current);
        }
        return Optional.empty();
    }

    /** Returns all definitions with the given name, in list order. */
    public List<Term> named(String name) {
        List<Term> result = new ArrayList<>();
        for (Term term : terms) {
            if (term.name().equals(name)) {
                result.add(term);
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TermList that)) return false;
        return terms.equals(that.terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        return "TermList[" + terms.size() + " terms]";
    }
}
