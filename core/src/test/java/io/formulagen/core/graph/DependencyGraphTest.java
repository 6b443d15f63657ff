package io.formulagen.core.graph;

import static org.assertj.core.api.Assertions.assertThat;

import io.formulagen.core.testkit.SampleSchemas;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for the traversal and usage queries of {@link DependencyGraph}. */
class DependencyGraphTest {

    private final DependencyGraphBuilder builder = new DependencyGraphBuilder();

    @Nested
    @DisplayName("Upstream and downstream")
    class Traversal {

        private final DependencyGraph chain = builder.build(SampleSchemas.chain());

        @Test
        void upstreamIsTransitiveAndNearestFirst() {
            assertThat(chain.upstream("fldD")).containsExactly("fldC", "fldA", "fldB");
            assertThat(chain.upstream("fldA")).isEmpty();
        }

        @Test
        void downstreamIsTransitiveAndNearestFirst() {
            assertThat(chain.downstream("fldA")).containsExactly("fldC", "fldD");
            assertThat(chain.downstream("fldD")).isEmpty();
        }

        @Test
        void cyclesTerminateAndLeaveTheStartOut() {
            DependencyGraph cyclic = builder.build(SampleSchemas.cyclic());

            assertThat(cyclic.upstream("fldX")).containsExactly("fldY");
            assertThat(cyclic.downstream("fldX")).containsExactly("fldY", "fldZ");
        }

        @Test
        void linkedFieldsAreFollowedThroughTheirLink() {
            DependencyGraph graph = builder.build(SampleSchemas.aggregates());

            assertThat(graph.upstream("fldAggAvgQtys")).containsExactly("fldAggQtys", "fldAggLines", "fldAggLineQty");
            assertThat(graph.downstream("fldAggLineQty"))
                    .containsExactly("fldAggQtys", "fldAggMinAll", "fldAggAvgQtys", "fldAggSumAll", "fldAggLabel");
        }

        @Test
        void unknownFieldHasNoNeighbours() {
            assertThat(chain.upstream("fldMissing")).isEmpty();
            assertThat(chain.downstream("fldMissing")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Unused fields")
    class Unused {

        @Test
        void onlyFieldsNothingReadsFrom() {
            assertThat(builder.build(SampleSchemas.chain()).unusedFields()).containsExactly("fldD");
            assertThat(builder.build(SampleSchemas.cyclic()).unusedFields()).containsExactly("fldZ", "fldW");
        }

        @Test
        void recordLinksAloneAreNotAUse() {
            assertThat(builder.build(SampleSchemas.aggregates()).unusedFields())
                    .containsExactly(
                            "fldAggSumQty",
                            "fldAggMaxQty",
                            "fldAggMinAll",
                            "fldAggAvgQtys",
                            "fldAggSumAll",
                            "fldAggLabel",
                            "fldAggOrder");
        }
    }

    @Nested
    @DisplayName("Complexity")
    class Complexity {

        @Test
        void formulaAtTheEndOfAChain() {
            FieldComplexity complexity =
                    builder.build(SampleSchemas.chain()).complexity("fldD").orElseThrow();

            assertThat(complexity.upstreamCount()).isEqualTo(3);
            assertThat(complexity.downstreamCount()).isZero();
            assertThat(complexity.chainLength()).isEqualTo(2);
            assertThat(complexity.upstreamTables()).containsExactly("tblCalc");
            assertThat(complexity.edgeCounts()).isEqualTo(Map.of(EdgeKind.FORMULA_REF, 3));
            assertThat(complexity.score()).isEqualTo(20.0);
        }

        @Test
        void storedFieldScoresOnlyItsDependents() {
            FieldComplexity complexity =
                    builder.build(SampleSchemas.chain()).complexity("fldA").orElseThrow();

            assertThat(complexity.upstreamCount()).isZero();
            assertThat(complexity.downstreamCount()).isEqualTo(2);
            assertThat(complexity.upstreamTables()).isEmpty();
            assertThat(complexity.score()).isEqualTo(3.0);
        }

        @Test
        void crossTableLookupsWeighMore() {
            FieldComplexity complexity =
                    builder.build(SampleSchemas.aggregates()).complexity("fldAggAvgQtys").orElseThrow();

            assertThat(complexity.upstreamTables()).containsExactlyInAnyOrder("tblAggOrders", "tblAggLines");
            assertThat(complexity.edgeCounts())
                    .containsEntry(EdgeKind.FORMULA_REF, 1)
                    .containsEntry(EdgeKind.LOOKUP_VIA, 1)
                    .containsEntry(EdgeKind.LOOKUP, 1)
                    .doesNotContainKey(EdgeKind.RECORD_LINK);
            assertThat(complexity.score()).isEqualTo(24.5);
        }

        @Test
        void tablesAndUnknownIdsHaveNoScore() {
            DependencyGraph graph = builder.build(SampleSchemas.chain());

            assertThat(graph.complexity("tblCalc")).isEmpty();
            assertThat(graph.complexity("fldMissing")).isEmpty();
        }
    }
}
