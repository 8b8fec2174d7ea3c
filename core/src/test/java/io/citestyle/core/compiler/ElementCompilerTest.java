package io.citestyle.core.compiler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.citestyle.core.error.StyleStructureException;
import io.citestyle.core.model.NodeContent;
import io.citestyle.core.model.Rendered;
import io.citestyle.core.model.StyleNode;
import io.citestyle.core.spi.RenderFn;
import io.citestyle.core.style.StyleReader;
import io.citestyle.core.testkit.TestPrimitives;
import io.citestyle.core.testkit.TestRenderContext;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for the generic element-to-render-function translation. */
class ElementCompilerTest {

    private final ElementCompiler compiler = new ElementCompiler("<test>");
    private final StyleReader reader = new StyleReader();

    private RenderFn compileXml(String xml) {
        return compiler.compile(reader.parse(xml, StyleReader.INLINE).withoutComments());
    }

    @Test
    void textLeafCompilesToConstant() {
        RenderFn fn = compiler.compile(new NodeContent.Text("literal"));

        Rendered rendered = fn.render(TestRenderContext.of(Map.of()));

        assertThat(rendered.content()).isEqualTo("literal");
        assertThat(rendered.status()).isEqualTo(Rendered.VarStatus.TEXT_ONLY);
    }

    @Test
    void elementsDispatchToPrimitivesWithTheirAttributes() {
        RenderFn fn = compileXml("""
                <layout prefix="(" suffix=")" delimiter="; ">
                  <text variable="title"/>
                  <text value="static"/>
                </layout>
                """);

        Rendered rendered = fn.render(TestRenderContext.of(Map.of("title", "Dune")));

        assertThat(TestPrimitives.plain(rendered)).isEqualTo("(Dune; static)");
    }

    @Test
    void contextIsSuppliedFreshOnEveryRender() {
        RenderFn fn = compileXml("<group delimiter=\" \"><text variable=\"title\"/></group>");

        assertThat(TestPrimitives.plain(fn.render(TestRenderContext.of(Map.of("title", "First")))))
                .isEqualTo("First");
        assertThat(TestPrimitives.plain(fn.render(TestRenderContext.of(Map.of("title", "Second")))))
                .isEqualTo("Second");
    }

    @Test
    void chooseReceivesUnevaluatedBranches() {
        RenderFn fn = compileXml("""
                <choose>
                  <if variable="DOI"><text variable="DOI" prefix="doi:"/></if>
                  <else-if variable="URL"><text variable="URL"/></else-if>
                  <else><text value="no link"/></else>
                </choose>
                """);

        assertThat(TestPrimitives.plain(fn.render(TestRenderContext.of(Map.of("URL", "http://x")))))
                .isEqualTo("http://x");
        assertThat(TestPrimitives.plain(fn.render(TestRenderContext.of(Map.of("DOI", "10.1/2")))))
                .isEqualTo("doi:10.1/2");
        assertThat(TestPrimitives.plain(fn.render(TestRenderContext.of(Map.of())))).isEqualTo("no link");
    }

    @Test
    void groupWithOnlyEmptyVariablesIsSuppressed() {
        RenderFn fn = compileXml("""
                <group delimiter=" "><text value="Vol."/><number variable="volume"/></group>
                """);

        assertThat(TestPrimitives.plain(fn.render(TestRenderContext.of(Map.of())))).isEmpty();
        assertThat(TestPrimitives.plain(fn.render(TestRenderContext.of(Map.of("volume", "3")))))
                .isEqualTo("Vol. 3");
    }

    @Test
    void unknownElementIsAStructureError() {
        assertThatThrownBy(() -> compileXml("<layout><blink/></layout>"))
                .isInstanceOf(StyleStructureException.class)
                .hasMessageContaining("<blink>");
    }

    @Test
    void nameOutsideNamesIsAStructureError() {
        assertThatThrownBy(() -> compileXml("<layout><name form=\"short\"/></layout>"))
                .isInstanceOf(StyleStructureException.class)
                .hasMessageContaining("only allowed inside <names>");
    }

    @Test
    void structuralElementsCannotBeRendered() {
        assertThatThrownBy(() -> compileXml("<group><citation/></group>"))
                .isInstanceOf(StyleStructureException.class)
                .hasMessageContaining("cannot be rendered");
    }

    @Test
    void commentsMustBeStrippedFirst() {
        assertThatThrownBy(() -> compiler.compile(new NodeContent.Comment("note")))
                .isInstanceOf(StyleStructureException.class);
    }

    @Test
    void compileChildrenPreservesDocumentOrder() {
        StyleNode node = new StyleNode(
                "macro", Map.of(), List.of(new NodeContent.Text("a"), new NodeContent.Text("b")));

        List<RenderFn> children = compiler.compileChildren(node);

        assertThat(children).hasSize(2);
        assertThat(children.get(0).render(TestRenderContext.of(Map.of())).content()).isEqualTo("a");
        assertThat(children.get(1).render(TestRenderContext.of(Map.of())).content()).isEqualTo("b");
    }

    @Test
    void elementTagResolvesCslNames() {
        assertThat(ElementTag.fromName("else-if")).hasValue(ElementTag.ELSE_IF);
        assertThat(ElementTag.fromName("date-part")).hasValue(ElementTag.DATE_PART);
        assertThat(ElementTag.fromName("unknown")).isEmpty();
    }
}
