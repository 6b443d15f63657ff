package io.formulagen.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Schema} snapshots. */
class SchemaTest {

    @Test
    void indexesTablesAndFields() {
        Schema schema = Schema.of(
                new Table("t1", "One", List.of(Field.basic("f1", "A", FieldType.NUMBER, "t1"))),
                new Table("t2", "Two", List.of(Field.formula("f2", "B", "t2", "{f1}"))));

        assertThat(schema.table("t2")).map(Table::name).hasValue("Two");
        assertThat(schema.field("f2")).map(Field::type).hasValue(FieldType.FORMULA);
        assertThat(schema.tableOf("f1")).map(Table::id).hasValue("t1");
        assertThat(schema.fields()).extracting(Field::id).containsExactly("f1", "f2");
        assertThat(schema.fieldCount()).isEqualTo(2);
    }

    @Test
    void fieldsAreRehomedToTheirTable() {
        Schema schema = Schema.of(new Table("t1", "One", List.of(Field.basic("f1", "A", FieldType.NUMBER, null))));

        assertThat(schema.field("f1")).map(Field::tableId).hasValue("t1");
    }

    @Test
    void duplicateFieldIdsAreRejected() {
        assertThatThrownBy(() -> Schema.of(
                        new Table("t1", "One", List.of(Field.basic("f1", "A", FieldType.NUMBER, "t1"))),
                        new Table("t2", "Two", List.of(Field.basic("f1", "B", FieldType.NUMBER, "t2")))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate field id");
    }

    @Test
    void computedFieldsKeepMetadataOrder() {
        Table table = new Table(
                "t1",
                "One",
                List.of(
                        Field.formula("f3", "C", "t1", "1"),
                        Field.basic("f1", "A", FieldType.NUMBER, "t1"),
                        Field.count("f2", "B", "t1", "fL")));

        assertThat(table.computedFields()).extracting(Field::id).containsExactly("f3", "f2");
    }
}
