package io.formulagen.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: one abstract root, phases and the accessors of each type. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void formulaExceptionIsAbstractAndRoot() {
        assertThat(FormulaException.class).isAbstract();
        assertThat(FormulaException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void syntaxExceptionIsAbstract() {
        assertThat(FormulaSyntaxException.class).isAbstract();
        assertThat(FormulaSyntaxException.class.getSuperclass()).isEqualTo(FormulaException.class);
    }

    // --- Syntax errors ---

    @Test
    void lexExceptionCarriesPosition() {
        var ex = new LexException("Unexpected character '#'", "fldA", 4);

        assertThat(ex).isInstanceOf(FormulaSyntaxException.class);
        assertThat(ex.position()).hasValue(4);
        assertThat(ex.fieldId()).isEqualTo("fldA");
        assertThat(ex.phase()).isEqualTo(FormulaException.Phase.SYNTAX);
        assertThat(ex.detail()).isEqualTo("Unexpected character '#'");
        assertThat(ex.location()).isEqualTo("fldA@4");
    }

    @Test
    void syntaxErrorCanBeBoundToItsFieldLater() {
        var unbound = new ParseException(5, "expression", "end of formula");

        ParseException bound = unbound.inField("fldTotal", "{a} +");

        assertThat(unbound.location()).isEqualTo("@5");
        assertThat(unbound.formula()).isNull();
        assertThat(unbound.excerpt()).isEmpty();
        assertThat(bound.fieldId()).isEqualTo("fldTotal");
        assertThat(bound.location()).isEqualTo("fldTotal@5");
        assertThat(bound.getMessage()).isEqualTo(unbound.getMessage());
        assertThat(bound.expected()).isEqualTo("expression");
        assertThat(bound.excerpt()).isEqualTo("{a} +\n     ^");
    }

    @Test
    void lexErrorExcerptClampsTheCaretToTheText() {
        var ex = new LexException("Unterminated string", 99).inField("fldA", "\"open\nline");

        assertThat(ex).isInstanceOf(LexException.class);
        assertThat(ex.excerpt()).isEqualTo("\"open line\n" + " ".repeat(10) + "^");
    }

    @Test
    void parseExceptionBuildsItsMessage() {
        var ex = new ParseException(7, "')'", "end of input");

        assertThat(ex).isInstanceOf(FormulaSyntaxException.class);
        assertThat(ex.getMessage()).isEqualTo("Expected ')' but found end of input at position 7");
        assertThat(ex.expected()).isEqualTo("')'");
        assertThat(ex.found()).isEqualTo("end of input");
        assertThat(ex.fieldId()).isNull();
    }

    // --- Other phases ---

    @Test
    void schemaParseExceptionKeepsSourceAndCause() {
        var cause = new IllegalStateException("bad json");
        var ex = new SchemaParseException("Malformed schema", cause, "/tmp/schema.json");

        assertThat(ex.phase()).isEqualTo(FormulaException.Phase.SCHEMA);
        assertThat(ex.source()).isEqualTo("/tmp/schema.json");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void cyclicDependencyExceptionFormatsThePath() {
        var ex = new CyclicDependencyException("fldA", List.of("fldA", "fldB", "fldA"));

        assertThat(ex.phase()).isEqualTo(FormulaException.Phase.ANALYSIS);
        assertThat(ex.getMessage()).isEqualTo("Cyclic dependency: fldA -> fldB -> fldA");
        assertThat(ex.cyclePath()).containsExactly("fldA", "fldB", "fldA");
        assertThat(ex.position()).isEmpty();
        assertThat(ex.location()).isEqualTo("fldA");
    }

    @Test
    void fieldConfigurationExceptionIsAnAnalysisError() {
        var ex = new FieldConfigurationException("no link", "fldL");

        assertThat(ex.phase()).isEqualTo(FormulaException.Phase.ANALYSIS);
        assertThat(ex.fieldId()).isEqualTo("fldL");
    }

    @Test
    void functionArityExceptionNamesTheFunction() {
        var ex = new FunctionArityException("LEFT expects 1 to 2 argument(s) but got 0", "LEFT", "fldX");

        assertThat(ex.phase()).isEqualTo(FormulaException.Phase.GENERATION);
        assertThat(ex.functionName()).isEqualTo("LEFT");
        assertThat(ex.fieldId()).isEqualTo("fldX");
    }

    @Test
    void evaluationExceptionHasNoField() {
        var ex = new EvaluationException("Division by zero");

        assertThat(ex.phase()).isEqualTo(FormulaException.Phase.EVALUATION);
        assertThat(ex.fieldId()).isNull();
        assertThat(ex.location()).isEmpty();
    }

    @Test
    void everyConcreteTypeIsAFormulaException() {
        List<Class<?>> types = List.of(
                LexException.class,
                ParseException.class,
                SchemaParseException.class,
                CyclicDependencyException.class,
                FieldConfigurationException.class,
                FunctionArityException.class,
                EvaluationException.class);

        assertThat(types).allSatisfy(type -> {
            assertThat(FormulaException.class).isAssignableFrom(type);
            assertThat(type).isFinal();
        });
    }
}
