package io.citestyle.core.style;

import io.citestyle.core.error.StyleStructureException;
import io.citestyle.core.model.StyleNode;
import io.citestyle.core.model.Term;
import io.citestyle.core.model.TermList;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the {@code term} children of a locale {@code terms} element. A term with
 * {@code single}/{@code multiple} children yields one {@link Term} per variant.
 */
public final class TermListParser {

    private static final String TERM = "term";
    private static final String SINGLE = "single";
    private static final String MULTIPLE = "multiple";

    private final String source;

    public TermListParser(String source) {
        this.source = source;
    }

    /**
     * @param termNodes the children of a {@code terms} element
     * @throws StyleStructureException if a child is not a {@code term} or lacks a name
     */
    public TermList parse(List<StyleNode> termNodes) {
        List<Term> terms = new ArrayList<>();
        for (StyleNode node : termNodes) {
            if (!TERM.equals(node.tag())) {
                throw new StyleStructureException("<terms> may only contain <term>, found <" + node.tag() + ">", source);
            }
            String name = node.attr("name");
            if (name == null || name.isBlank()) {
                throw new StyleStructureException("<term> requires a 'name' attribute", source);
            }
            String form = node.attr("form");
            String gender = node.attr("gender");
            String genderForm = node.attr("gender-form");
            String match = node.attr("match");

            List<StyleNode> variants = node.elements();
            if (variants.isEmpty()) {
                terms.add(new Term(name, form, null, gender, genderForm, match, node.text()));
                continue;
            }
            for (StyleNode variant : variants) {
                Term.Plurality number = switch (variant.tag()) {
                    case SINGLE -> Term.Plurality.SINGLE;
                    case MULTIPLE -> Term.Plurality.MULTIPLE;
                    default -> throw new StyleStructureException(
                            "<term name=\"" + name + "\"> may only contain <single> and <multiple>", source);
                };
                terms.add(new Term(name, form, number, gender, genderForm, match, variant.text()));
            }
        }
        return new TermList(terms);
    }
}
