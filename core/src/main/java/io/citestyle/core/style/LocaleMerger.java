package io.citestyle.core.style;

import io.citestyle.core.compiler.ElementTag;
import io.citestyle.core.error.StyleStructureException;
import io.citestyle.core.model.CompiledStyle;
import io.citestyle.core.model.DateFormat;
import io.citestyle.core.model.StyleNode;
import io.citestyle.core.model.TermList;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges a {@code locale} element into a style under construction.
 *
 * <p>
 * Whatever the style already holds keeps precedence for options and dates: locale
 * {@code style-options} are appended behind existing entries and each date form is taken from
 * the first locale that defines it. Terms are merged by {@link Origin}: a style's own terms
 * override what was there before, while terms of an external locale file only fill the gaps the
 * style left.
 */
public final class LocaleMerger {

    private static final Logger LOG = LoggerFactory.getLogger(LocaleMerger.class);

    /** Where the merged locale element comes from. */
    public enum Origin {
        /** A {@code locale} element embedded in the style. */
        STYLE,
        /** A standalone locale file loaded through a {@code LocaleProvider}. */
        EXTERNAL
    }

    private final String source;
    private final TermListParser termListParser;

    public LocaleMerger(String source) {
        this.source = source;
        this.termListParser = new TermListParser(source);
    }

    /**
     * Merges {@code locale} into {@code style}. The caller has already checked that the locale is
     * compatible and should be applied.
     *
     * @throws StyleStructureException if the locale contains unknown elements
     */
    public void merge(CompiledStyle.Builder style, StyleNode locale, Origin origin) {
        for (StyleNode child : locale.elements()) {
            ElementTag tag = ElementTag.fromName(child.tag())
                    .orElseThrow(() -> new StyleStructureException(
                            "Unknown element <" + child.tag() + "> in <locale>", source));
            switch (tag) {
                case STYLE_OPTIONS -> style.localeOptions().appendAll(child.attributes());
                case DATE -> mergeDate(style, child);
                case TERMS -> mergeTerms(style, termListParser.parse(child.elements()), origin);
                case INFO -> LOG.trace("Ignoring <info> of locale {}", locale.attr("lang"));
                default -> throw new StyleStructureException(
                        "<" + child.tag() + "> is not allowed inside <locale>", source);
            }
        }
    }

    private void mergeDate(CompiledStyle.Builder style, StyleNode date) {
        Map<String, Map<String, String>> parts = new LinkedHashMap<>();
        for (StyleNode part : date.elements()) {
            String name = part.attr("name");
            if (!ElementTag.DATE_PART.xmlName().equals(part.tag()) || name == null) {
                throw new StyleStructureException("Locale <date> may only contain named <date-part> elements", source);
            }
            parts.put(name, part.attributes());
        }
        DateFormat format = new DateFormat(date.attributes(), parts);
        if (!style.dateFormatIfAbsent(format)) {
            LOG.debug("Date format '{}' already defined, keeping the first definition", date.attr("form"));
        }
    }

    private static void mergeTerms(CompiledStyle.Builder style, TermList parsed, Origin origin) {
        TermList existing = style.terms();
        if (existing.isEmpty()) {
            style.terms(parsed);
        } else if (origin == Origin.STYLE) {
            style.terms(parsed.overriding(existing));
        } else {
            style.terms(existing.overriding(parsed));
        }
    }
}
