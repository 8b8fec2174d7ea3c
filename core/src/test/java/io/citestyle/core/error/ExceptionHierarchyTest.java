package io.citestyle.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/** Tests for the style exception hierarchy: common fields and one kind per concrete type. */
class ExceptionHierarchyTest {

    @Test
    void styleExceptionIsAbstractAndUnchecked() {
        assertThat(StyleException.class).isAbstract();
        assertThat(StyleException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void inputExceptionCarriesSourceAndKind() {
        var ex = new StyleInputException("cannot read", "styles/apa.csl");

        assertThat(ex).isInstanceOf(StyleException.class);
        assertThat(ex.kind()).isEqualTo(StyleException.Kind.INPUT);
        assertThat(ex.source()).isEqualTo("styles/apa.csl");
        assertThat(ex.detail()).isEqualTo("cannot read");
    }

    @Test
    void parseExceptionKeepsItsCause() {
        var cause = new IllegalArgumentException("unexpected end of file");
        var ex = new StyleParseException("Malformed XML", cause, "<inline>");

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.kind()).isEqualTo(StyleException.Kind.PARSE);
        assertThat(ex.source()).isEqualTo("<inline>");
    }

    @Test
    void structureExceptionKind() {
        var ex = new StyleStructureException("<citation> has no <layout>", "<inline>");

        assertThat(ex.kind()).isEqualTo(StyleException.Kind.STRUCTURE);
        assertThat(ex.getMessage()).isEqualTo("<citation> has no <layout>");
    }

    @Test
    void optionValueExceptionKind() {
        var ex = new OptionValueException("line-spacing must be a number", null);

        assertThat(ex.kind()).isEqualTo(StyleException.Kind.OPTION_VALUE);
        assertThat(ex.source()).isNull();
    }
}
