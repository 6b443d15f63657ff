package io.formulagen.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.formulagen.core.backend.javascript.JavaScriptBackend;
import io.formulagen.core.backend.python.PythonBackend;
import io.formulagen.core.backend.sql.SqlBackend;
import io.formulagen.core.spi.CodeGenBackend;
import io.formulagen.core.graph.ComputationGraph;
import io.formulagen.core.graph.DependencyGraphBuilder;
import io.formulagen.core.graph.DepthCalculator;
import io.formulagen.core.model.Diagnostic;
import io.formulagen.core.model.Diagnostic.Kind;
import io.formulagen.core.model.Field;
import io.formulagen.core.model.FieldType;
import io.formulagen.core.model.GeneratorOptions;
import io.formulagen.core.model.Schema;
import io.formulagen.core.model.Table;
import io.formulagen.core.spi.CompilationListener;
import io.formulagen.core.testkit.SampleSchemas;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.slf4j.LoggerFactory;

/** Tests for {@link ModuleAssembler}: per-field isolation, listeners and logging. */
class ModuleAssemblerTest {

    private static ComputationGraph order(Schema schema) {
        return new DepthCalculator().compute(new DependencyGraphBuilder().build(schema));
    }

    private static GenerationResult python(Schema schema, CompilationListener... listeners) {
        return new ModuleAssembler(List.of(listeners))
                .assemble(order(schema), new PythonBackend(), GeneratorOptions.defaults());
    }

    private static String pythonSource(Schema schema) {
        return python(schema).file("computed_fields.py").orElseThrow();
    }

    /** One table with a stored number and the given formula fields. */
    private static Schema withFormulas(Field... formulas) {
        List<Field> fields = new ArrayList<>();
        fields.add(Field.basic("fldA", "A", FieldType.NUMBER, "tblT"));
        fields.addAll(List.of(formulas));
        return Schema.of(new Table("tblT", "T", fields));
    }

    @Nested
    @DisplayName("Stubs")
    class Stubs {

        @Test
        void cyclicFieldsAreStubbedAndTheRestIsGenerated() {
            GenerationResult result = python(SampleSchemas.cyclic());

            assertThat(result.errors())
                    .extracting(Diagnostic::kind, Diagnostic::fieldId)
                    .containsExactlyInAnyOrder(
                            tuple(Kind.CYCLIC_DEPENDENCY, "fldX"),
                            tuple(Kind.CYCLIC_DEPENDENCY, "fldY"),
                            tuple(Kind.CYCLIC_DEPENDENCY, "fldZ"));
            assertThat(result.hasErrors()).isTrue();
            assertThat(result.file("computed_fields.py").orElseThrow())
                    .contains("return (record.v - 1)")
                    .contains("def get_z(self, record: Any) -> Any:\n"
                            + "        \"\"\"formula field Z.\"\"\"\n"
                            + "        # Cyclic dependency: fldX -> fldY -> fldX\n"
                            + "        return None\n");
        }

        @Test
        void unsupportedFunctionStubsTheWholeGetter() {
            GenerationResult result =
                    python(withFormulas(Field.formula("fldR", "R", "tblT", "IF(REGEX_MATCH({fldA}, \"x\"), 1, 0)")));

            assertThat(result.hasErrors()).isFalse();
            assertThat(result.warnings())
                    .singleElement()
                    .satisfies(d -> {
                        assertThat(d.kind()).isEqualTo(Kind.UNSUPPORTED_FUNCTION);
                        assertThat(d.fieldId()).isEqualTo("fldR");
                    });
            assertThat(result.file("computed_fields.py").orElseThrow())
                    .contains("# Unsupported function(s): REGEX_MATCH\n        return None\n");
        }

        @Test
        void wrongArityIsAnError() {
            GenerationResult result = python(withFormulas(
                    Field.formula("fldL", "L", "tblT", "LEFT()"), Field.formula("fldOk", "Ok", "tblT", "{fldA} * 2")));

            assertThat(result.errors()).singleElement().satisfies(d -> {
                assertThat(d.kind()).isEqualTo(Kind.INVALID_FUNCTION_CALL);
                assertThat(d.fieldId()).isEqualTo("fldL");
                assertThat(d.message()).isEqualTo("LEFT expects 1 to 2 argument(s) but got 0");
            });
            assertThat(result.file("computed_fields.py").orElseThrow())
                    .contains("# LEFT expects 1 to 2 argument(s) but got 0")
                    .contains("return (record.a * 2)");
        }

        @Test
        void unparseableFormula() {
            GenerationResult result = python(withFormulas(Field.formula("fldP", "P", "tblT", "({fldA} + ")));

            assertThat(result.errors()).extracting(Diagnostic::kind).containsExactly(Kind.PARSE_ERROR);
            assertThat(result.file("computed_fields.py").orElseThrow()).contains("# Formula did not parse: ");
        }

        @Test
        void invalidLookupIsReportedOnce() {
            Schema schema = withFormulas(Field.lookup("fldL", "L", "tblT", "fldA", "fldA"));

            GenerationResult result = python(schema);

            assertThat(result.errors())
                    .filteredOn(d -> d.kind() == Kind.INVALID_FIELD_CONFIGURATION)
                    .hasSize(1)
                    .first()
                    .satisfies(d -> assertThat(d.fieldId()).isEqualTo("fldL"));
            assertThat(result.file("computed_fields.py").orElseThrow())
                    .contains("# Field 'L' does not name a valid link field");
        }
    }

    @Nested
    @DisplayName("Layout")
    class Layout {

        @Test
        void tablesWithoutComputedFieldsAreSkipped() {
            Schema schema = Schema.of(
                    SampleSchemas.chain().tables().get(0),
                    new Table("tblRaw", "Raw", List.of(Field.basic("fldN", "N", FieldType.NUMBER, "tblRaw"))));

            String source = pythonSource(schema);

            assertThat(source).contains("class CalcComputedFields:").doesNotContain("class RawComputedFields:");
        }

        @Test
        void emptySchemaStillProducesAModule() {
            GenerationResult result = new ModuleAssembler()
                    .assemble(order(Schema.of(List.of())), new JavaScriptBackend(), GeneratorOptions.defaults());

            assertThat(result.file("computedFields.js").orElseThrow())
                    .contains("export class DataAccess {")
                    .endsWith("export const COMPUTATION_ORDER = [];\n");
            assertThat(result.diagnostics()).isEmpty();
        }

        @Test
        void backendIsConfiguredWithTheRunOptions() {
            GenerationResult result = new ModuleAssembler()
                    .assemble(
                            order(SampleSchemas.chain()),
                            new PythonBackend(),
                            GeneratorOptions.builder().moduleName("calc").build());

            assertThat(result.files()).containsOnlyKeys("calc.py");
        }

        static List<Arguments> backends() {
            return List.of(
                    Arguments.of("python", (Supplier<CodeGenBackend>) PythonBackend::new),
                    Arguments.of("javascript", (Supplier<CodeGenBackend>) JavaScriptBackend::new),
                    Arguments.of("sql", (Supplier<CodeGenBackend>) SqlBackend::new));
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("backends")
        void regeneratingFromTheSameSchemaGivesIdenticalFiles(String target, Supplier<CodeGenBackend> backend) {
            GeneratorOptions options = GeneratorOptions.builder().target(target).build();

            GenerationResult first = new ModuleAssembler()
                    .assemble(order(SampleSchemas.orders()), backend.get(), options);
            GenerationResult second = new ModuleAssembler()
                    .assemble(order(SampleSchemas.orders()), backend.get(), options);

            assertThat(second.files()).isEqualTo(first.files());
            assertThat(second.files().keySet()).containsExactlyElementsOf(first.files().keySet());
            assertThat(second.diagnostics()).isEqualTo(first.diagnostics());
        }
    }

    @Nested
    @DisplayName("Listeners")
    class Listeners {

        @Test
        void eventsForEveryFieldAndTheModule() {
            var listener = new CapturingListener();

            python(SampleSchemas.orders(), listener);

            assertThat(listener.generated).hasSize(9);
            assertThat(listener.generated)
                    .filteredOn(e -> e.fieldId().equals("fldOrderTotal"))
                    .singleElement()
                    .satisfies(e -> {
                        assertThat(e.fieldName()).isEqualTo("Total");
                        assertThat(e.depth()).isEqualTo(4);
                    });
            assertThat(listener.failed).isEmpty();
            assertThat(listener.modules).singleElement().satisfies(e -> {
                assertThat(e.target()).isEqualTo("python");
                assertThat(e.fileName()).isEqualTo("computed_fields.py");
                assertThat(e.fieldCount()).isEqualTo(9);
                assertThat(e.diagnostics()).isEmpty();
            });
        }

        @Test
        void stubsAreReportedAsFailures() {
            var listener = new CapturingListener();

            python(SampleSchemas.cyclic(), listener);

            assertThat(listener.failed)
                    .extracting(CompilationListener.FieldFailedEvent::fieldId)
                    .containsExactlyInAnyOrder("fldX", "fldY", "fldZ");
            assertThat(listener.failed).allSatisfy(e -> assertThat(e.reason()).startsWith("Cyclic dependency: "));
            assertThat(listener.generated)
                    .extracting(CompilationListener.FieldGeneratedEvent::fieldId)
                    .containsExactly("fldW");
        }

        @Test
        void throwingListenerDoesNotAffectOutput() {
            var capturing = new CapturingListener();
            CompilationListener throwing = new CompilationListener() {
                @Override
                public void onFieldGenerated(FieldGeneratedEvent event) {
                    throw new IllegalStateException("boom");
                }

                @Override
                public void onFieldFailed(FieldFailedEvent event) {
                    throw new IllegalStateException("boom");
                }

                @Override
                public void onModuleGenerated(ModuleGeneratedEvent event) {
                    throw new IllegalStateException("boom");
                }
            };

            GenerationResult result = python(SampleSchemas.chain(), throwing, capturing);

            assertThat(result.file("computed_fields.py")).isPresent();
            assertThat(capturing.generated).hasSize(2);
            assertThat(capturing.modules).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Logging")
    class Logging {

        private Logger logger;
        private ListAppender<ILoggingEvent> appender;

        @BeforeEach
        void attach() {
            logger = (Logger) LoggerFactory.getLogger(ModuleAssembler.class);
            appender = new ListAppender<>();
            appender.start();
            logger.addAppender(appender);
        }

        @AfterEach
        void detach() {
            logger.detachAppender(appender);
            appender.stop();
        }

        @Test
        void summaryIsLoggedAtInfo() {
            python(SampleSchemas.orders());

            assertThat(appender.list)
                    .filteredOn(e -> e.getLevel() == Level.INFO)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .containsExactly(
                            "Module generated: target=python, file=computed_fields.py, fields=9, stubs=0, diagnostics=0");
        }

        @Test
        void summaryCountsStubs() {
            python(SampleSchemas.cyclic());

            assertThat(appender.list)
                    .filteredOn(e -> e.getLevel() == Level.INFO)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .containsExactly(
                            "Module generated: target=python, file=computed_fields.py, fields=4, stubs=3, diagnostics=3");
        }

        @Test
        void listenerFailuresAreLoggedAtWarn() {
            CompilationListener throwing = new CapturingListener() {
                @Override
                public void onModuleGenerated(ModuleGeneratedEvent event) {
                    throw new IllegalStateException("boom");
                }
            };

            python(SampleSchemas.chain(), throwing);

            assertThat(appender.list)
                    .filteredOn(e -> e.getLevel() == Level.WARN)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .containsExactly("CompilationListener.onModuleGenerated failed");
        }
    }

    /** Test double that records every event. */
    private static class CapturingListener implements CompilationListener {
        final List<FieldGeneratedEvent> generated = new ArrayList<>();
        final List<FieldFailedEvent> failed = new ArrayList<>();
        final List<ModuleGeneratedEvent> modules = new ArrayList<>();

        @Override
        public void onFieldGenerated(FieldGeneratedEvent event) {
            generated.add(event);
        }

        @Override
        public void onFieldFailed(FieldFailedEvent event) {
            failed.add(event);
        }

        @Override
        public void onModuleGenerated(ModuleGeneratedEvent event) {
            modules.add(event);
        }
    }
}
