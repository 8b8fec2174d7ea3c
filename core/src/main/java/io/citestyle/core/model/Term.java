package io.citestyle.core.model;

import java.util.Objects;

/**
 * A single localized term. Terms that define {@code single} and {@code multiple} variants are
 * stored as two {@code Term} instances sharing the same name and form.
 *
 * @param name       term identifier, e.g. {@code "editor"} or {@code "ordinal-01"}
 * @param form       {@code long}, {@code short}, {@code verb}, {@code verb-short} or {@code symbol}
 * @param number     plurality of this variant, or {@code null} for terms without variants
 * @param gender     grammatical gender of the term itself, or {@code null}
 * @param genderForm gender this (ordinal) term agrees with, or {@code null}
 * @param match      ordinal matching rule, or {@code null}
 * @param value      the localized text
 */
public record Term(
        String name, String form, Plurality number, String gender, String genderForm, String match, String value) {

    /** Plurality of a term variant. */
    public enum Plurality {
        SINGLE,
        MULTIPLE
    }

    /** Default form when a {@code term} element omits {@code form}. */
    public static final String DEFAULT_FORM = "long";

    public Term {
        Objects.requireNonNull(name, "name must not be null");
        form = form != null ? form : DEFAULT_FORM;
        value = value != null ? value : "";
    }

    /** Key under which a definition overrides another: name, form and gender-form. */
    public String overrideKey() {
        return name + '|' + form + '|' + (genderForm != null ? genderForm : "");
    }
}
