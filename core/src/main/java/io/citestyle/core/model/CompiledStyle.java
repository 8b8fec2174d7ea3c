package io.citestyle.core.model;

import io.citestyle.core.error.StyleStructureException;
import io.citestyle.core.spi.RenderFn;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed, localized and compiled CSL style: the unit consumed by the rendering runtime.
 *
 * <p>
 * Built field by field through a {@link Builder} during a single pass over the style tree, then
 * finalized by option defaulting. Instances are immutable and can be shared by any number of
 * concurrent renders.
 */
public final class CompiledStyle {

    private final String source;
    private final String locale;
    private final StyleNode info;
    private final OptionMap options;
    private final OptionMap citeOptions;
    private final OptionMap bibOptions;
    private final OptionMap localeOptions;
    private final CompiledLayout citeLayout;
    private final CompiledLayout bibLayout;
    private final CompiledSort citeSort;
    private final CompiledSort bibSort;
    private final boolean citeNote;
    private final boolean usesYearSuffixVar;
    private final DateFormat dateText;
    private final DateFormat dateNumeric;
    private final Map<String, RenderFn> macros;
    private final TermList terms;

    private CompiledStyle(Builder b) {
        this.source = b.source;
        this.locale = b.locale;
        this.info = b.info;
        this.options = b.options.snapshot();
        this.citeOptions = b.citeOptions.snapshot();
        this.bibOptions = b.bibOptions.snapshot();
        this.localeOptions = b.localeOptions.snapshot();
        this.citeLayout = b.citeLayout;
        this.bibLayout = b.bibLayout;
        this.citeSort = b.citeSort;
        this.bibSort = b.bibSort;
        this.citeNote = b.citeNote;
        this.usesYearSuffixVar = b.usesYearSuffixVar;
        this.dateText = b.dateText;
        this.dateNumeric = b.dateNumeric;
        this.macros = Collections.unmodifiableMap(new HashMap<>(b.macros));
        this.terms = b.terms;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Path of the style file, or {@code <inline>}. */
    public String source() {
        return source;
    }

    /** The locale the style was localized for. */
    public String locale() {
        return locale;
    }

    /** The style's {@code info} element, passed through uninterpreted. */
    public Optional<StyleNode> info() {
        return Optional.ofNullable(info);
    }

    /** Global options: the root {@code style} element's attributes plus defaults. */
    public OptionMap options() {
        return options;
    }

    public OptionMap citeOptions() {
        return citeOptions;
    }

    public OptionMap bibOptions() {
        return bibOptions;
    }

    public OptionMap localeOptions() {
        return localeOptions;
    }

    public CompiledLayout citeLayout() {
        return citeLayout;
    }

    public CompiledLayout bibLayout() {
        return bibLayout;
    }

    public Optional<CompiledSort> citeSort() {
        return Optional.ofNullable(citeSort);
    }

    public Optional<CompiledSort> bibSort() {
        return Optional.ofNullable(bibSort);
    }

    /** Returns {@code true} if the style declares the {@code note} citation format. */
    public boolean citeNote() {
        return citeNote;
    }

    /** Returns {@code true} if the style text references the {@code year-suffix} variable. */
    public boolean usesYearSuffixVar() {
        return usesYearSuffixVar;
    }

    public Optional<DateFormat> dateText() {
        return Optional.ofNullable(dateText);
    }

    public Optional<DateFormat> dateNumeric() {
        return Optional.ofNullable(dateNumeric);
    }

    public Map<String, RenderFn> macros() {
        return macros;
    }

    /** Looks up a macro by its exact name. */
    public Optional<RenderFn> macro(String name) {
        return Optional.ofNullable(macros.get(name));
    }

    public TermList terms() {
        return terms;
    }

    /**
     * Converts the bibliography options to typed formatting parameters.
     *
     * @throws io.citestyle.core.error.OptionValueException if an option value is invalid
     */
    public BibFormattingParams bibFormattingParams() {
        return BibFormattingParams.fromOptions(bibOptions);
    }

    @Override
    public String toString() {
        return "CompiledStyle[source=" + source + ", locale=" + locale + ", macros=" + macros.size()
                + ", note=" + citeNote + "]";
    }

    /**
     * Mutable accumulator used by style assembly, locale merging and option defaulting. Not
     * thread-safe; owned by a single compilation.
     */
    public static final class Builder {

        private String source;
        private String locale;
        private StyleNode info;
        private final OptionMap options = new OptionMap();
        private final OptionMap citeOptions = new OptionMap();
        private final OptionMap bibOptions = new OptionMap();
        private final OptionMap localeOptions = new OptionMap();
        private CompiledLayout citeLayout;
        private CompiledLayout bibLayout;
        private CompiledSort citeSort;
        private CompiledSort bibSort;
        private boolean citeNote;
        private boolean usesYearSuffixVar;
        private DateFormat dateText;
        private DateFormat dateNumeric;
        private final Map<String, RenderFn> macros = new HashMap<>();
        private TermList terms = TermList.empty();

        private Builder() {}

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder locale(String locale) {
            this.locale = locale;
            return this;
        }

        public Builder info(StyleNode info) {
            this.info = info;
            return this;
        }

        public Builder citeNote(boolean citeNote) {
            this.citeNote = citeNote;
            return this;
        }

        public Builder usesYearSuffixVar(boolean usesYearSuffixVar) {
            this.usesYearSuffixVar = usesYearSuffixVar;
            return this;
        }

        public Builder citeLayout(CompiledLayout citeLayout) {
            this.citeLayout = citeLayout;
            return this;
        }

        public Builder bibLayout(CompiledLayout bibLayout) {
            this.bibLayout = bibLayout;
            return this;
        }

        public Builder citeSort(CompiledSort citeSort) {
            this.citeSort = citeSort;
            return this;
        }

        public Builder bibSort(CompiledSort bibSort) {
            this.bibSort = bibSort;
            return this;
        }

        /**
         * Registers a date format unless one of the same form ({@code text} or numeric) is already
         * set.
         *
         * @return {@code true} if the format was stored
         */
        public boolean dateFormatIfAbsent(DateFormat format) {
            if (format.isText()) {
                if (dateText != null) {
                    return false;
                }
                dateText = format;
            } else {
                if (dateNumeric != null) {
                    return false;
                }
                dateNumeric = format;
            }
            return true;
        }

        /**
         * Registers a macro.
         *
         * @return the macro previously registered under {@code name}, or {@code null}
         */
        public RenderFn macro(String name, RenderFn body) {
            return macros.put(name, body);
        }

        public Builder terms(TermList terms) {
            this.terms = terms != null ? terms : TermList.empty();
            return this;
        }

        public OptionMap options() {
            return options;
        }

        public OptionMap citeOptions() {
            return citeOptions;
        }

        public OptionMap bibOptions() {
            return bibOptions;
        }

        public OptionMap localeOptions() {
            return localeOptions;
        }

        public CompiledLayout citeLayout() {
            return citeLayout;
        }

        public CompiledLayout bibLayout() {
            return bibLayout;
        }

        public DateFormat dateText() {
            return dateText;
        }

        public DateFormat dateNumeric() {
            return dateNumeric;
        }

        public TermList terms() {
            return terms;
        }

        public int macroCount() {
            return macros.size();
        }

        /**
         * Finalizes the style.
         *
         * @throws StyleStructureException if the citation or bibliography layout is missing
         */
        public CompiledStyle build() {
            if (citeLayout == null) {
                throw new StyleStructureException("Style has no citation layout", source);
            }
            if (bibLayout == null) {
                throw new StyleStructureException("Style has no bibliography layout", source);
            }
            return new CompiledStyle(this);
        }
    }
}
