package io.citestyle.core.compiler;

import io.citestyle.core.error.StyleStructureException;
import io.citestyle.core.model.NodeContent;
import io.citestyle.core.model.Rendered;
import io.citestyle.core.model.StyleNode;
import io.citestyle.core.spi.RenderContext;
import io.citestyle.core.spi.RenderFn;
import io.citestyle.core.spi.RenderPrimitives;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Translates parsed style elements into {@link RenderFn} trees. Every element becomes a call to
 * the {@link RenderPrimitives} method of the same name, with the element's attributes captured
 * at compile time and its children compiled recursively. {@code names} elements are handed to
 * {@link NamesCompiler}.
 *
 * <p>
 * Stateless apart from its source label; thread-safe.
 */
public final class ElementCompiler {

    /** A render primitive selected at compile time. */
    @FunctionalInterface
    private interface Primitive {
        Rendered call(
                RenderPrimitives primitives,
                Map<String, String> attributes,
                RenderContext context,
                List<RenderFn> children);
    }

    private final String source;
    private final NamesCompiler namesCompiler;

    /**
     * @param source style path or {@code <inline>}, reported in compile errors
     */
    public ElementCompiler(String source) {
        this.source = source;
        this.namesCompiler = new NamesCompiler(this, source);
    }

    /**
     * Compiles one child of a style element.
     *
     * @throws StyleStructureException for comments, unknown tags or elements that cannot be
     *                                 rendered at this position
     */
    public RenderFn compile(NodeContent content) {
        if (content instanceof NodeContent.Text text) {
            Rendered constant = Rendered.text(text.value());
            return context -> constant;
        }
        if (content instanceof StyleNode node) {
            return compileElement(node);
        }
        throw new StyleStructureException("Comment nodes must be stripped before compilation", source);
    }

    /** Compiles every child of {@code node}, in document order. */
    public List<RenderFn> compileChildren(StyleNode node) {
        List<RenderFn> compiled = new ArrayList<>(node.children().size());
        for (NodeContent child : node.children()) {
            compiled.add(compile(child));
        }
        return List.copyOf(compiled);
    }

    private RenderFn compileElement(StyleNode node) {
        ElementTag tag = resolve(node);
        if (tag == ElementTag.NAMES) {
            return namesCompiler.compile(node);
        }
        Primitive primitive = primitiveFor(tag, node);
        Map<String, String> attributes = node.attributes();
        List<RenderFn> children = compileChildren(node);
        return context -> primitive.call(context.primitives(), attributes, context, children);
    }

    ElementTag resolve(StyleNode node) {
        return ElementTag.fromName(node.tag())
                .orElseThrow(() -> new StyleStructureException("Unknown element <" + node.tag() + ">", source));
    }

    private Primitive primitiveFor(ElementTag tag, StyleNode node) {
        return switch (tag) {
            case LAYOUT -> RenderPrimitives::renderLayout;
            case GROUP -> RenderPrimitives::renderGroup;
            case TEXT -> RenderPrimitives::renderText;
            case NUMBER -> RenderPrimitives::renderNumber;
            case LABEL -> RenderPrimitives::renderLabel;
            case DATE -> RenderPrimitives::renderDate;
            case DATE_PART -> RenderPrimitives::renderDatePart;
            case CHOOSE -> RenderPrimitives::renderChoose;
            case IF -> RenderPrimitives::renderIf;
            case ELSE_IF -> RenderPrimitives::renderElseIf;
            case ELSE -> RenderPrimitives::renderElse;
            case MACRO -> RenderPrimitives::renderMacro;
            case SORT -> RenderPrimitives::renderSort;
            case KEY -> RenderPrimitives::renderKey;
            case NAME, NAME_PART, ET_AL, SUBSTITUTE -> throw new StyleStructureException(
                    "<" + node.tag() + "> is only allowed inside <names>", source);
            case NAMES, STYLE, INFO, LOCALE, CITATION, BIBLIOGRAPHY, STYLE_OPTIONS, TERMS -> throw new StyleStructureException(
                    "<" + node.tag() + "> cannot be rendered", source);
        };
    }
}
