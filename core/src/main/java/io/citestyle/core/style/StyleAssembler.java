package io.citestyle.core.style;

import io.citestyle.core.compiler.ElementCompiler;
import io.citestyle.core.compiler.ElementTag;
import io.citestyle.core.error.StyleStructureException;
import io.citestyle.core.model.CompiledStyle;
import io.citestyle.core.model.StyleNode;
import io.citestyle.core.spi.RenderFn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks the direct children of a parsed {@code style} element and accumulates a
 * {@link CompiledStyle.Builder}: {@code info} is stored, the first compatible {@code locale} is
 * merged, {@code citation} and {@code bibliography} are compiled through {@link FragmentParser},
 * and {@code macro} bodies are compiled and registered by name.
 *
 * <p>
 * One instance per style; not thread-safe.
 */
public final class StyleAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(StyleAssembler.class);

    private final String source;
    private final ElementCompiler compiler;
    private final FragmentParser fragmentParser;
    private final LocaleMerger localeMerger;

    public StyleAssembler(String source) {
        this.source = source;
        this.compiler = new ElementCompiler(source);
        this.fragmentParser = new FragmentParser(compiler, source);
        this.localeMerger = new LocaleMerger(source);
    }

    /**
     * Assembles a style for the given locale. The result still lacks the external locale and the
     * option defaults.
     *
     * @param style           the parsed style
     * @param requestedLocale locale used to pick the embedded {@code locale} block
     * @throws StyleStructureException if the tree is not a well-shaped {@code style}
     */
    public CompiledStyle.Builder assemble(StyleSource style, String requestedLocale) {
        StyleNode root = style.root();
        if (!ElementTag.STYLE.xmlName().equals(root.tag())) {
            throw new StyleStructureException("Root element must be <style>, found <" + root.tag() + ">", source);
        }

        CompiledStyle.Builder builder = CompiledStyle.builder()
                .source(style.origin())
                .locale(requestedLocale)
                .usesYearSuffixVar(style.usesYearSuffixVar());
        root.attributes().forEach(builder.options()::set);

        boolean localeLoaded = false;
        for (StyleNode child : root.elements()) {
            ElementTag tag = ElementTag.fromName(child.tag())
                    .orElseThrow(() -> new StyleStructureException(
                            "Unknown element <" + child.tag() + "> in <style>", source));
            switch (tag) {
                case INFO -> {
                    builder.info(child);
                    builder.citeNote(declaresNoteFormat(child));
                }
                case LOCALE -> localeLoaded = mergeLocale(builder, child, requestedLocale, localeLoaded);
                case CITATION -> {
                    LayoutFragment citation = fragmentParser.parse(child);
                    citation.options().forEach(builder.citeOptions()::set);
                    builder.citeLayout(citation.layout()).citeSort(citation.sort());
                }
                case BIBLIOGRAPHY -> {
                    LayoutFragment bibliography = fragmentParser.parse(child);
                    bibliography.options().forEach(builder.bibOptions()::set);
                    builder.bibLayout(bibliography.layout()).bibSort(bibliography.sort());
                }
                case MACRO -> registerMacro(builder, child);
                default -> throw new StyleStructureException(
                        "<" + child.tag() + "> is not allowed directly inside <style>", source);
            }
        }
        return builder;
    }

    private boolean mergeLocale(
            CompiledStyle.Builder builder, StyleNode locale, String requestedLocale, boolean localeLoaded) {
        String lang = locale.attr("lang");
        if (localeLoaded) {
            LOG.debug("Skipping embedded locale '{}': a locale was already merged", lang);
            return true;
        }
        if (!LocaleMatcher.isCompatible(lang, requestedLocale)) {
            LOG.debug("Skipping embedded locale '{}': not compatible with '{}'", lang, requestedLocale);
            return false;
        }
        localeMerger.merge(builder, locale, LocaleMerger.Origin.STYLE);
        LOG.debug("Merged embedded locale '{}' for '{}'", lang, requestedLocale);
        return true;
    }

    private void registerMacro(CompiledStyle.Builder builder, StyleNode macro) {
        String name = macro.attr("name");
        if (name == null || name.isEmpty()) {
            throw new StyleStructureException("<macro> requires a 'name' attribute", source);
        }
        RenderFn body = compiler.compile(macro.withoutAttributes());
        if (builder.macro(name, body) != null) {
            LOG.warn("Macro '{}' is defined more than once in {}; the last definition wins", name, source);
        }
    }

    private static boolean declaresNoteFormat(StyleNode info) {
        for (StyleNode child : info.elements()) {
            if ("category".equals(child.tag()) && "note".equals(child.attr("citation-format"))) {
                return true;
            }
        }
        return false;
    }
}
