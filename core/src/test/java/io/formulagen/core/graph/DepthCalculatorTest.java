package io.formulagen.core.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.formulagen.core.error.CyclicDependencyException;
import io.formulagen.core.model.Field;
import io.formulagen.core.model.FieldType;
import io.formulagen.core.model.Schema;
import io.formulagen.core.model.Table;
import io.formulagen.core.testkit.SampleSchemas;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Tests for {@link DepthCalculator}. */
class DepthCalculatorTest {

    private final DependencyGraphBuilder builder = new DependencyGraphBuilder();
    private final DepthCalculator calculator = new DepthCalculator();

    private ComputationGraph order(Schema schema) {
        return calculator.compute(builder.build(schema));
    }

    @Test
    @DisplayName("A, B stored; C = A + B; D = C * 2 -> {0: [A, B], 1: [C], 2: [D]}")
    void simpleChain() {
        ComputationGraph order = order(SampleSchemas.chain());

        assertThat(order.levels())
                .containsExactly(
                        Map.entry(0, Set.of("fldA", "fldB")),
                        Map.entry(1, Set.of("fldC")),
                        Map.entry(2, Set.of("fldD")));
        assertThat(order.levels().get(0)).containsExactly("fldA", "fldB");
        assertThat(order.maxDepth()).isEqualTo(2);
        assertThat(order.hasCycles()).isFalse();
    }

    @Test
    void crossTableDepths() {
        ComputationGraph order = order(SampleSchemas.orders());

        assertThat(order.depthOf("fldCustFull")).hasValue(1);
        assertThat(order.depthOf("fldCustOrderCount")).hasValue(1);
        assertThat(order.depthOf("fldItemAmount")).hasValue(1);
        assertThat(order.depthOf("fldOrderCustName")).hasValue(2);
        assertThat(order.depthOf("fldOrderSubtotal")).hasValue(2);
        assertThat(order.depthOf("fldOrderTax")).hasValue(3);
        assertThat(order.depthOf("fldOrderLabel")).hasValue(3);
        assertThat(order.depthOf("fldOrderTotal")).hasValue(4);
        assertThat(order.depthOf("fldCustSpend")).hasValue(5);
        assertThat(order.depthOf("fldOrderCustomer")).hasValue(0);
    }

    @Test
    void depthStrictlyIncreasesAlongEveryDependency() {
        ComputationGraph order = order(SampleSchemas.orders());
        DependencyGraph graph = order.graph();

        for (String fieldId : graph.fieldIds()) {
            for (String dependency : graph.dependenciesOf(fieldId)) {
                assertThat(order.depthOf(fieldId).getAsInt())
                        .as("%s depends on %s", fieldId, dependency)
                        .isGreaterThan(order.depthOf(dependency).getAsInt());
            }
        }
    }

    @Test
    void fieldsWithinALevelKeepSchemaOrder() {
        ComputationGraph order = order(SampleSchemas.orders());

        assertThat(order.fieldsAtDepth(1)).containsExactly("fldCustFull", "fldCustOrderCount", "fldItemAmount");
        assertThat(order.fieldsAtDepth(9)).isEmpty();
    }

    @Test
    void longChainsDoNotOverflowTheStack() {
        List<Field> fields = new ArrayList<>();
        fields.add(Field.basic("f0", "F0", FieldType.NUMBER, "t"));
        for (int i = 1; i <= 5_000; i++) {
            fields.add(Field.formula("f" + i, "F" + i, "t", "{f" + (i - 1) + "} + 1"));
        }

        ComputationGraph order = order(Schema.of(new Table("t", "T", fields)));

        assertThat(order.depthOf("f5000")).hasValue(5_000);
    }

    @Nested
    @DisplayName("Cycles")
    class Cycles {

        private Logger logger;
        private ListAppender<ILoggingEvent> appender;

        @BeforeEach
        void attachAppender() {
            logger = (Logger) LoggerFactory.getLogger(DepthCalculator.class);
            appender = new ListAppender<>();
            appender.start();
            logger.addAppender(appender);
        }

        @AfterEach
        void detachAppender() {
            logger.detachAppender(appender);
            appender.stop();
        }

        @Test
        void cycleAndItsDependentsFailWhileTheRestIsOrdered() {
            ComputationGraph order = order(SampleSchemas.cyclic());

            assertThat(order.failures()).containsOnlyKeys("fldX", "fldY", "fldZ");
            assertThat(order.depthOf("fldX")).isEmpty();
            assertThat(order.depthOf("fldW")).hasValue(1);
            assertThat(order.orderedFieldIds()).containsExactly("fldV", "fldW");
        }

        @Test
        void cyclePathRepeatsTheFirstField() {
            ComputationGraph order = order(SampleSchemas.cyclic());

            CyclicDependencyException failure = order.failures().get("fldX");
            assertThat(failure.cyclePath()).containsExactly("fldX", "fldY", "fldX");
            assertThat(failure.getMessage()).isEqualTo("Cyclic dependency: fldX -> fldY -> fldX");
            assertThat(order.failures().get("fldZ").cyclePath()).containsExactly("fldX", "fldY", "fldX");
        }

        @Test
        void selfReferenceIsACycle() {
            Schema schema = Schema.of(new Table("t", "T", List.of(Field.formula("fldS", "S", "t", "{fldS} + 1"))));

            ComputationGraph order = order(schema);

            assertThat(order.failures().get("fldS").cyclePath()).containsExactly("fldS", "fldS");
        }

        @Test
        void requireAcyclicThrowsTheFirstFailure() {
            ComputationGraph order = order(SampleSchemas.cyclic());

            assertThatThrownBy(order::requireAcyclic)
                    .isInstanceOf(CyclicDependencyException.class)
                    .hasMessageContaining("fldX -> fldY");
        }

        @Test
        void cycleIsLoggedOnceAsWarning() {
            order(SampleSchemas.cyclic());

            assertThat(appender.list)
                    .filteredOn(e -> e.getLevel() == Level.WARN)
                    .singleElement()
                    .satisfies(e -> assertThat(e.getFormattedMessage())
                            .isEqualTo("Cyclic dependency detected: path=fldX -> fldY -> fldX"));
        }
    }
}
