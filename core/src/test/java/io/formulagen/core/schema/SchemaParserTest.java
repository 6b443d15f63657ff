package io.formulagen.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formulagen.core.error.SchemaParseException;
import io.formulagen.core.model.Aggregation;
import io.formulagen.core.model.Field;
import io.formulagen.core.model.FieldType;
import io.formulagen.core.model.Schema;
import io.formulagen.core.model.Table;
import io.formulagen.core.testkit.SampleSchemas;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link SchemaParser}: metadata mapping and conformance errors. */
class SchemaParserTest {

    private final SchemaParser parser = new SchemaParser();

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("JSON fixture")
    class JsonFixture {

        @Test
        void tablesAndFieldsAreMappedInOrder() {
            Schema schema = SampleSchemas.orders();

            assertThat(schema.tables()).extracting(Table::id).containsExactly("tblCustomers", "tblOrders", "tblLineItems");
            assertThat(schema.table("tblLineItems").orElseThrow().fields())
                    .extracting(Field::name)
                    .containsExactly("Quantity", "Unit Price", "Amount", "Order");
        }

        @Test
        void platformOptionNamesAreRead() {
            Schema schema = SampleSchemas.orders();
            Field spend = schema.field("fldCustSpend").orElseThrow();

            assertThat(spend.type()).isEqualTo(FieldType.ROLLUP);
            assertThat(spend.linkFieldId()).isEqualTo("fldCustOrders");
            assertThat(spend.targetFieldId()).isEqualTo("fldOrderTotal");
            assertThat(spend.resolvedAggregation()).hasValue(Aggregation.SUM);
        }

        @Test
        void linkOptionsAreRead() {
            Field customer = SampleSchemas.orders().field("fldOrderCustomer").orElseThrow();

            assertThat(customer.type()).isEqualTo(FieldType.LINK);
            assertThat(customer.linkedTableId()).isEqualTo("tblCustomers");
            assertThat(customer.inverseLinkFieldId()).isEqualTo("fldCustOrders");
            assertThat(customer.prefersSingleRecordLink()).isTrue();
        }

        @Test
        void formulaOptionsAreRead() {
            Field full = SampleSchemas.orders().field("fldCustFull").orElseThrow();

            assertThat(full.formula()).isEqualTo("{fldCustFirst} & \" \" & {fldCustLast}");
            assertThat(full.referencedFieldIds()).containsExactly("fldCustFirst", "fldCustLast");
            assertThat(full.resultType()).isEqualTo(FieldType.SINGLE_LINE_TEXT);
        }
    }

    @Test
    void yamlMetadataIsAccepted() {
        Schema schema = parser.parse(SampleSchemas.resource("schemas/minimal.yaml"));

        assertThat(schema.fieldCount()).isEqualTo(3);
        assertThat(schema.field("fldGreeting").orElseThrow().formula()).startsWith("\"Hello, \"");
    }

    @Test
    void shortOptionNamesAreAccepted() {
        Schema schema = parser.parse(
                """
                {"tables": [{"id": "t", "name": "T", "fields": [
                  {"id": "l", "name": "L", "type": "multipleRecordLinks", "options": {"linkedTableId": "t"}},
                  {"id": "r", "name": "R", "type": "rollup",
                   "options": {"linkedFieldId": "l", "targetFieldId": "l", "aggregation": "COUNTALL"}}
                ]}]}
                """,
                "inline");

        Field rollup = schema.field("r").orElseThrow();
        assertThat(rollup.linkFieldId()).isEqualTo("l");
        assertThat(rollup.targetFieldId()).isEqualTo("l");
        assertThat(rollup.resolvedAggregation()).hasValue(Aggregation.COUNTALL);
    }

    @Test
    void unknownFieldTypeIsKeptAsStoredData() {
        Schema schema = parser.parse(
                "{\"tables\": [{\"id\": \"t\", \"name\": \"T\", \"fields\": [{\"id\": \"f\", \"name\": \"F\", \"type\": \"aiText\"}]}]}",
                "inline");

        assertThat(schema.field("f").orElseThrow().type()).isEqualTo(FieldType.UNKNOWN);
        assertThat(schema.field("f").orElseThrow().isComputed()).isFalse();
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void missingFileFails() {
            Path missing = tempDir.resolve("missing.json");

            assertThatThrownBy(() -> parser.parse(missing))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("not found")
                    .satisfies(e -> assertThat(((SchemaParseException) e).source()).isEqualTo(missing.toString()));
        }

        @Test
        void malformedContentFails() {
            assertThatThrownBy(() -> parser.parse("{\"tables\": [", "broken.json"))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("Failed to parse");
        }

        @Test
        void missingTablesFails() {
            assertThatThrownBy(() -> parser.parse("{\"bases\": []}", "no-tables.json"))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("does not conform")
                    .hasMessageContaining("tables");
        }

        @Test
        void fieldWithoutTypeFails() {
            assertThatThrownBy(() -> parser.parse(
                            "{\"tables\": [{\"id\": \"t\", \"name\": \"T\", \"fields\": [{\"id\": \"f\", \"name\": \"F\"}]}]}",
                            "no-type.json"))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("type");
        }

        @Test
        void duplicateFieldIdsFail() {
            assertThatThrownBy(() -> parser.parse(
                            """
                            {"tables": [
                              {"id": "a", "name": "A", "fields": [{"id": "f", "name": "F", "type": "number"}]},
                              {"id": "b", "name": "B", "fields": [{"id": "f", "name": "G", "type": "number"}]}
                            ]}
                            """,
                            "dupes.json"))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("Duplicate field id");
        }

        @Test
        void emptyDocumentFails() {
            assertThatThrownBy(() -> parser.parse("", "empty.yaml"))
                    .isInstanceOf(SchemaParseException.class);
        }
    }
}
