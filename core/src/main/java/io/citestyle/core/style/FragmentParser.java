package io.citestyle.core.style;

import io.citestyle.core.compiler.ElementCompiler;
import io.citestyle.core.compiler.ElementTag;
import io.citestyle.core.error.StyleStructureException;
import io.citestyle.core.model.CompiledLayout;
import io.citestyle.core.model.CompiledSort;
import io.citestyle.core.model.StyleNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a {@code citation} or {@code bibliography} element into its options, optional sort
 * specification and layout, and compiles the latter two.
 *
 * <p>
 * The element's children are positional: an optional {@code sort} followed by exactly one
 * {@code layout}.
 */
public final class FragmentParser {

    private static final String DESCENDING = "descending";

    private final ElementCompiler compiler;
    private final String source;

    public FragmentParser(ElementCompiler compiler, String source) {
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.source = source;
    }

    /**
     * Parses and compiles a fragment.
     *
     * @param fragment a {@code citation} or {@code bibliography} element
     * @throws StyleStructureException if the layout is missing or the children are out of shape
     */
    public LayoutFragment parse(StyleNode fragment) {
        List<StyleNode> children = fragment.elements();
        int layoutIndex = 0;
        StyleNode sortNode = null;
        if (!children.isEmpty() && ElementTag.SORT.xmlName().equals(children.get(0).tag())) {
            sortNode = children.get(0);
            layoutIndex = 1;
        }
        if (children.size() <= layoutIndex) {
            throw new StyleStructureException("<" + fragment.tag() + "> has no <layout>", source);
        }
        StyleNode layoutNode = children.get(layoutIndex);
        if (!ElementTag.LAYOUT.xmlName().equals(layoutNode.tag())) {
            throw new StyleStructureException(
                    "<" + fragment.tag() + "> expects <layout> but found <" + layoutNode.tag() + ">", source);
        }
        if (children.size() > layoutIndex + 1) {
            throw new StyleStructureException(
                    "<" + fragment.tag() + "> has unexpected <" + children.get(layoutIndex + 1).tag()
                            + "> after its <layout>",
                    source);
        }

        CompiledLayout layout = new CompiledLayout(compiler.compile(layoutNode), layoutNode.attributes());
        CompiledSort sort = sortNode != null ? compileSort(sortNode) : null;
        return new LayoutFragment(fragment.attributes(), layout, sort);
    }

    private CompiledSort compileSort(StyleNode sortNode) {
        List<Boolean> ascending = new ArrayList<>();
        for (StyleNode key : sortNode.elements()) {
            ascending.add(!DESCENDING.equals(key.attr("sort")));
        }
        return new CompiledSort(compiler.compile(sortNode), ascending);
    }
}
