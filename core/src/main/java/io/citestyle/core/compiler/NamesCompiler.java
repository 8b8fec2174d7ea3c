package io.citestyle.core.compiler;

import io.citestyle.core.error.StyleStructureException;
import io.citestyle.core.model.NamesSpec;
import io.citestyle.core.model.Rendered;
import io.citestyle.core.model.StyleNode;
import io.citestyle.core.spi.RenderContext;
import io.citestyle.core.spi.RenderFn;
import io.citestyle.core.spi.RenderPrimitives;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles CSL {@code names} elements. The generic translation does not fit them: a
 * {@code names} element is rendered through {@link RenderPrimitives#renderNameVars} with the
 * settings of its {@code name}, {@code et-al} and {@code label} children, falls back to its
 * {@code substitute} alternatives when all its variables are empty, and can render a count
 * instead of the names.
 */
final class NamesCompiler {

    private final ElementCompiler elementCompiler;
    private final String source;

    NamesCompiler(ElementCompiler elementCompiler, String source) {
        this.elementCompiler = elementCompiler;
        this.source = source;
    }

    RenderFn compile(StyleNode names) {
        NamesSpec spec = parseSpec(names, null);
        List<RenderFn> substitutions = new ArrayList<>();
        for (StyleNode child : names.elements()) {
            if (elementCompiler.resolve(child) == ElementTag.SUBSTITUTE) {
                for (StyleNode alternative : child.elements()) {
                    substitutions.add(compileSubstitution(alternative, spec));
                }
            }
        }
        return new CompiledNames(spec, substitutions);
    }

    private RenderFn compileSubstitution(StyleNode alternative, NamesSpec parent) {
        if (elementCompiler.resolve(alternative) != ElementTag.NAMES) {
            return elementCompiler.compile(alternative);
        }
        NamesSpec spec = parseSpec(alternative, parent);
        return context -> context.primitives().renderNameVars(spec, context);
    }

    /**
     * Reads the variables and child settings of a {@code names} element.
     *
     * @param names  the element
     * @param parent the enclosing settings when {@code names} is a substitution, else {@code null}
     */
    private NamesSpec parseSpec(StyleNode names, NamesSpec parent) {
        List<String> variables = variables(names);
        List<StyleNode> body = names.elements();
        if (parent != null && body.isEmpty()) {
            return parent.forVariables(variables, names.attributes());
        }

        Map<String, String> nameAttrs = null;
        Map<String, Map<String, String>> nameParts = new LinkedHashMap<>();
        Map<String, String> etAlAttrs = null;
        Map<String, String> labelAttrs = null;
        for (StyleNode child : body) {
            switch (elementCompiler.resolve(child)) {
                case NAME -> {
                    nameAttrs = child.attributes();
                    nameParts = nameParts(child);
                }
                case ET_AL -> etAlAttrs = child.attributes();
                case LABEL -> labelAttrs = child.attributes();
                case SUBSTITUTE -> {
                    if (parent != null) {
                        throw new StyleStructureException("<substitute> cannot be nested in a substitution", source);
                    }
                }
                default -> throw new StyleStructureException(
                        "<" + child.tag() + "> is not allowed inside <names>", source);
            }
        }

        boolean labelBeforeNames;
        if (labelAttrs != null) {
            labelBeforeNames = false;
        } else if (nameAttrs != null) {
            labelBeforeNames = true;
        } else {
            throw new StyleStructureException(
                    "<names variable=\"" + names.attr("variable")
                            + "\"> needs a <name> or <label> child to order its output",
                    source);
        }
        return new NamesSpec(
                variables, names.attributes(), nameAttrs, nameParts, etAlAttrs, labelAttrs, labelBeforeNames);
    }

    private List<String> variables(StyleNode names) {
        String variable = names.attr("variable");
        if (variable == null || variable.isBlank()) {
            throw new StyleStructureException("<names> requires a non-empty 'variable' attribute", source);
        }
        return Arrays.asList(variable.trim().split("\\s+"));
    }

    private Map<String, Map<String, String>> nameParts(StyleNode name) {
        Map<String, Map<String, String>> parts = new LinkedHashMap<>();
        for (StyleNode part : name.elements()) {
            if (elementCompiler.resolve(part) != ElementTag.NAME_PART) {
                throw new StyleStructureException("<" + part.tag() + "> is not allowed inside <name>", source);
            }
            String partName = part.attr("name");
            if (partName == null) {
                throw new StyleStructureException("<name-part> requires a 'name' attribute", source);
            }
            parts.put(partName, part.attributes());
        }
        return parts;
    }

    /** Render function of one {@code names} element. */
    private static final class CompiledNames implements RenderFn {

        private final NamesSpec spec;
        private final List<RenderFn> substitutions;

        CompiledNames(NamesSpec spec, List<RenderFn> substitutions) {
            this.spec = spec;
            this.substitutions = List.copyOf(substitutions);
        }

        @Override
        public Rendered render(RenderContext context) {
            if (context.suppressAuthor()) {
                return Rendered.emptyVars();
            }
            RenderPrimitives primitives = context.primitives();
            Rendered result = primitives.renderNameVars(spec, context);
            if (result.isEmpty()) {
                result = firstSubstitution(context);
            }
            if (spec.countForm()) {
                int count = primitives.countNames(result);
                result = result.withContent(count > 0 ? Integer.toString(count) : "");
            }
            return result;
        }

        // Substitutions are alternatives: stop at the first one that renders anything.
        private Rendered firstSubstitution(RenderContext context) {
            for (RenderFn substitution : substitutions) {
                Rendered candidate = substitution.render(context);
                if (!candidate.isEmpty()) {
                    return candidate.asSubstituted();
                }
            }
            return Rendered.emptyVars();
        }
    }
}
