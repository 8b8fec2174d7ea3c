package io.citestyle.core.engine;

import io.citestyle.core.error.StyleException;
import io.citestyle.core.model.CompiledStyle;
import io.citestyle.core.model.StyleNode;
import io.citestyle.core.spi.LocaleProvider;
import io.citestyle.core.style.LocaleMerger;
import io.citestyle.core.style.OptionDefaults;
import io.citestyle.core.style.StyleAssembler;
import io.citestyle.core.style.StyleReader;
import io.citestyle.core.style.StyleSource;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles CSL styles into {@link CompiledStyle} instances: reads the style, assembles it for the
 * effective locale, merges the external locale and applies option defaults.
 *
 * <p>
 * Compilation is synchronous and either returns a complete style or throws a
 * {@link StyleException}; partially built styles never escape. Instances are immutable and
 * thread-safe as long as the configured {@link LocaleProvider} is.
 */
public final class StyleCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(StyleCompiler.class);

    /** Locale used when neither the caller nor the style names one. */
    public static final String DEFAULT_FALLBACK_LOCALE = "en-US";

    private final LocaleProvider localeProvider;
    private final boolean localesConfigured;
    private final String fallbackLocale;
    private final StyleReader reader = new StyleReader();

    private StyleCompiler(Builder builder) {
        this.localeProvider = builder.localeProvider;
        this.localesConfigured = builder.localesConfigured;
        this.fallbackLocale = builder.fallbackLocale;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Creates a compiler with the given locale provider and the default fallback locale. */
    public static StyleCompiler withLocales(LocaleProvider localeProvider) {
        return builder().localeProvider(localeProvider).build();
    }

    /**
     * Compiles a style, letting its {@code default-locale} take precedence over {@code locale}.
     *
     * @param style  inline XML or a path to a style file
     * @param locale requested locale, may be {@code null}
     * @throws StyleException if the style cannot be read, parsed or compiled
     */
    public CompiledStyle compile(String style, String locale) {
        return compile(style, locale, false);
    }

    /**
     * Compiles a style.
     *
     * @param style       inline XML or a path to a style file
     * @param locale      requested locale, may be {@code null}
     * @param forceLocale if {@code true}, {@code locale} wins over the style's
     *                    {@code default-locale}
     * @throws StyleException if the style cannot be read, parsed or compiled
     */
    public CompiledStyle compile(String style, String locale, boolean forceLocale) {
        StyleSource source = reader.read(style);
        String effectiveLocale = effectiveLocale(source.root(), locale, forceLocale);

        CompiledStyle.Builder builder = new StyleAssembler(source.origin()).assemble(source, effectiveLocale);
        Optional<StyleNode> external = localeProvider.load(effectiveLocale);
        if (external.isPresent()) {
            new LocaleMerger(source.origin()).merge(builder, external.get(), LocaleMerger.Origin.EXTERNAL);
        } else if (localesConfigured) {
            LOG.warn("No locale available for '{}'; {} keeps only its embedded locale data",
                    effectiveLocale, source.origin());
        } else {
            LOG.debug("No locale provider configured; {} keeps only its embedded locale data", source.origin());
        }
        OptionDefaults.apply(builder);

        CompiledStyle compiled = builder.build();
        LOG.info(
                "Compiled style {} (locale={}, macros={}, format={}, yearSuffixVar={})",
                compiled.source(),
                compiled.locale(),
                compiled.macros().size(),
                compiled.citeNote() ? "note" : "in-text",
                compiled.usesYearSuffixVar());
        return compiled;
    }

    /**
     * Chooses the locale a style is compiled for: a forced {@code requested} locale, else the
     * style's {@code default-locale}, else {@code requested}, else the fallback locale.
     */
    String effectiveLocale(StyleNode root, String requested, boolean forceLocale) {
        if (forceLocale && requested != null) {
            return requested;
        }
        String styleDefault = root.attr("default-locale");
        if (styleDefault != null && !styleDefault.isBlank()) {
            return styleDefault;
        }
        return requested != null ? requested : fallbackLocale;
    }

    /** Builder for {@link StyleCompiler}. */
    public static final class Builder {

        private LocaleProvider localeProvider = LocaleProvider.none();
        private boolean localesConfigured;
        private String fallbackLocale = DEFAULT_FALLBACK_LOCALE;

        private Builder() {}

        public Builder localeProvider(LocaleProvider localeProvider) {
            this.localeProvider = Objects.requireNonNull(localeProvider, "localeProvider must not be null");
            this.localesConfigured = true;
            return this;
        }

        public Builder fallbackLocale(String fallbackLocale) {
            this.fallbackLocale = Objects.requireNonNull(fallbackLocale, "fallbackLocale must not be null");
            return this;
        }

        public StyleCompiler build() {
            return new StyleCompiler(this);
        }
    }
}
