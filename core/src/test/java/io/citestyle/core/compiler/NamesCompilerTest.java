package io.citestyle.core.compiler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.citestyle.core.error.StyleStructureException;
import io.citestyle.core.model.NamesSpec;
import io.citestyle.core.model.Rendered;
import io.citestyle.core.spi.RenderContext;
import io.citestyle.core.spi.RenderFn;
import io.citestyle.core.spi.RenderPrimitives;
import io.citestyle.core.style.StyleReader;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/** Tests for {@code names} compilation: suppression, substitution and counting. */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class NamesCompilerTest {

    private static final String WITH_SUBSTITUTES = """
            <names variable="author">
              <name and="text"/>
              <substitute>
                <names variable="editor"/>
                <text variable="title"/>
              </substitute>
            </names>
            """;

    @Mock
    private RenderPrimitives primitives;

    @Mock
    private RenderContext context;

    private final ElementCompiler compiler = new ElementCompiler("<test>");

    @BeforeEach
    void setUp() {
        when(context.primitives()).thenReturn(primitives);
        when(context.suppressAuthor()).thenReturn(false);
    }

    private RenderFn compile(String xml) {
        return compiler.compile(new StyleReader().parse(xml, StyleReader.INLINE).withoutComments());
    }

    private void namesRenderAs(String variable, Rendered rendered) {
        when(primitives.renderNameVars(argThat(spec -> spec != null && spec.variables().contains(variable)), any()))
                .thenReturn(rendered);
    }

    private NamesSpec capturedSpec(String xml) {
        when(primitives.renderNameVars(any(), any())).thenReturn(Rendered.presentVar("x"));
        compile(xml).render(context);
        ArgumentCaptor<NamesSpec> captor = ArgumentCaptor.forClass(NamesSpec.class);
        verify(primitives).renderNameVars(captor.capture(), any());
        return captor.getValue();
    }

    @Nested
    @DisplayName("rendering")
    class Rendering {

        @Test
        void suppressedAuthorRendersEmptyWithoutCallingTheRuntime() {
            when(context.suppressAuthor()).thenReturn(true);

            Rendered rendered = compile(WITH_SUBSTITUTES).render(context);

            assertThat(rendered.isEmpty()).isTrue();
            assertThat(rendered.status()).isEqualTo(Rendered.VarStatus.EMPTY_VARS);
            verify(primitives, never()).renderNameVars(any(), any());
        }

        @Test
        void nonEmptyPrimaryIsReturnedWithoutTryingSubstitutes() {
            namesRenderAs("author", Rendered.presentVar("Doe"));

            Rendered rendered = compile(WITH_SUBSTITUTES).render(context);

            assertThat(rendered.content()).isEqualTo("Doe");
            assertThat(rendered.substituted()).isFalse();
            verify(primitives, times(1)).renderNameVars(any(), any());
            verify(primitives, never()).renderText(anyMap(), any(), anyList());
        }

        @Test
        void firstNonEmptySubstitutionWinsAndStopsEvaluation() {
            namesRenderAs("author", Rendered.emptyVars());
            namesRenderAs("editor", Rendered.presentVar("Roe (ed.)"));

            Rendered rendered = compile(WITH_SUBSTITUTES).render(context);

            assertThat(rendered.content()).isEqualTo("Roe (ed.)");
            assertThat(rendered.substituted()).isTrue();
            verify(primitives, never()).renderText(anyMap(), any(), anyList());
        }

        @Test
        void laterSubstitutionIsUsedWhenEarlierOnesAreEmpty() {
            namesRenderAs("author", Rendered.emptyVars());
            namesRenderAs("editor", Rendered.emptyVars());
            when(primitives.renderText(anyMap(), any(), anyList())).thenReturn(Rendered.presentVar("A Title"));

            Rendered rendered = compile(WITH_SUBSTITUTES).render(context);

            assertThat(rendered.content()).isEqualTo("A Title");
            assertThat(rendered.substituted()).isTrue();
        }

        @Test
        void noSuccessfulSubstitutionRendersEmptyVars() {
            namesRenderAs("author", Rendered.emptyVars());
            namesRenderAs("editor", Rendered.emptyVars());
            when(primitives.renderText(anyMap(), any(), anyList())).thenReturn(Rendered.emptyVars());

            Rendered rendered = compile(WITH_SUBSTITUTES).render(context);

            assertThat(rendered).isEqualTo(Rendered.emptyVars());
        }

        @Test
        void countFormRendersNumberOfNames() {
            namesRenderAs("author", Rendered.presentVar(List.of("Doe", "Roe", "Poe")));
            when(primitives.countNames(any())).thenReturn(3);

            Rendered rendered = compile("<names variable=\"author\"><name form=\"count\"/></names>")
                    .render(context);

            assertThat(rendered.content()).isEqualTo("3");
            assertThat(rendered.status()).isEqualTo(Rendered.VarStatus.PRESENT_VAR);
        }

        @Test
        void countFormWithZeroNamesRendersEmptyString() {
            namesRenderAs("author", Rendered.emptyVars());
            when(primitives.countNames(any())).thenReturn(0);

            Rendered rendered = compile("<names variable=\"author\"><name form=\"count\"/></names>")
                    .render(context);

            assertThat(rendered.content()).isEqualTo("");
            assertThat(rendered.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("settings passed to the runtime")
    class Settings {

        @Test
        void gathersNameEtAlAndLabelAttributes() {
            NamesSpec spec = capturedSpec("""
                    <names variable="author editor" delimiter=", ">
                      <name and="symbol" delimiter-precedes-last="always">
                        <name-part name="family" text-case="uppercase"/>
                        <name-part name="given" font-style="italic"/>
                      </name>
                      <et-al term="and others"/>
                      <label form="short" prefix=" (" suffix=")"/>
                    </names>
                    """);

            assertThat(spec.variables()).containsExactly("author", "editor");
            assertThat(spec.namesAttributes()).containsEntry("delimiter", ", ");
            assertThat(spec.nameAttributes()).containsEntry("and", "symbol");
            assertThat(spec.nameParts()).containsOnlyKeys("family", "given");
            assertThat(spec.nameParts().keySet()).containsExactly("family", "given");
            assertThat(spec.nameParts().get("family")).containsEntry("text-case", "uppercase");
            assertThat(spec.etAlAttributes()).containsEntry("term", "and others");
            assertThat(spec.labelAttributes()).containsEntry("form", "short");
            assertThat(spec.labelBeforeNames()).isFalse();
        }

        @Test
        void nameWithoutLabelPutsLabelBeforeNames() {
            NamesSpec spec = capturedSpec("<names variable=\"author\"><name/></names>");

            assertThat(spec.labelBeforeNames()).isTrue();
            assertThat(spec.labelAttributes()).isEmpty();
        }

        @Test
        void childlessSubstituteNamesInheritParentSettings() {
            namesRenderAs("author", Rendered.emptyVars());
            namesRenderAs("translator", Rendered.presentVar("Tee"));

            compile("""
                    <names variable="author" delimiter="; ">
                      <name form="short"/>
                      <et-al font-style="italic"/>
                      <substitute><names variable="translator"/></substitute>
                    </names>
                    """).render(context);

            ArgumentCaptor<NamesSpec> captor = ArgumentCaptor.forClass(NamesSpec.class);
            verify(primitives, times(2)).renderNameVars(captor.capture(), any());
            NamesSpec substitute = captor.getAllValues().get(1);
            assertThat(substitute.variables()).containsExactly("translator");
            assertThat(substitute.nameAttributes()).isEqualTo(Map.of("form", "short"));
            assertThat(substitute.etAlAttributes()).isEqualTo(Map.of("font-style", "italic"));
            assertThat(substitute.namesAttributes()).isEqualTo(Map.of("variable", "translator"));
            assertThat(substitute.labelBeforeNames()).isTrue();
        }
    }

    @Nested
    @DisplayName("malformed names")
    class Malformed {

        @Test
        void missingVariableIsAStructureError() {
            assertThatThrownBy(() -> compile("<names><name/></names>"))
                    .isInstanceOf(StyleStructureException.class)
                    .hasMessageContaining("variable");
        }

        @Test
        void neitherNameNorLabelIsAStructureError() {
            assertThatThrownBy(() -> compile("<names variable=\"author\"/>"))
                    .isInstanceOf(StyleStructureException.class)
                    .hasMessageContaining("<name> or <label>");
        }

        @Test
        void labelAloneIsAccepted() {
            NamesSpec spec = capturedSpec("<names variable=\"editor\"><label/></names>");

            assertThat(spec.labelBeforeNames()).isFalse();
        }

        @Test
        void unexpectedChildIsAStructureError() {
            assertThatThrownBy(() -> compile("<names variable=\"author\"><name/><group/></names>"))
                    .isInstanceOf(StyleStructureException.class)
                    .hasMessageContaining("<group>");
        }

        @Test
        void namePartWithoutNameIsAStructureError() {
            assertThatThrownBy(() -> compile("<names variable=\"author\"><name><name-part/></name></names>"))
                    .isInstanceOf(StyleStructureException.class);
        }
    }
}
