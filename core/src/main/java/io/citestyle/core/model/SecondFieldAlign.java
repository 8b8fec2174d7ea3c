package io.citestyle.core.model;

/** Alignment of the first field of bibliography entries ({@code second-field-align}). */
public enum SecondFieldAlign {
    /** No alignment. */
    DISABLED,
    /** The first field is flush with the margin. */
    FLUSH,
    /** The first field is put in the margin. */
    MARGIN
}
