package io.formulagen.core.testkit;

import io.formulagen.core.model.Field;
import io.formulagen.core.model.FieldType;
import io.formulagen.core.model.Schema;
import io.formulagen.core.model.Table;
import io.formulagen.core.schema.SchemaParser;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

/** Schemas shared by tests. */
public final class SampleSchemas {

    private SampleSchemas() {}

    /** Classpath fixture as a filesystem path. */
    public static Path resource(String name) {
        try {
            return Path.of(SampleSchemas.class.getClassLoader().getResource(name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Customers, Orders and Line Items from {@code schemas/orders.json}. Depths:
     * <pre>
     * 0: stored fields and links
     * 1: Full Name, Order Count, Amount
     * 2: Customer Name, Subtotal
     * 3: Tax, Label
     * 4: Total
     * 5: Total Spend
     * </pre>
     */
    public static Schema orders() {
        return new SchemaParser().parse(resource("schemas/orders.json"));
    }

    /** One table: stored A and B, C = A + B, D = C * 2. */
    public static Schema chain() {
        return Schema.of(new Table(
                "tblCalc",
                "Calc",
                List.of(
                        Field.basic("fldA", "A", FieldType.NUMBER, "tblCalc"),
                        Field.basic("fldB", "B", FieldType.NUMBER, "tblCalc"),
                        Field.formula("fldC", "C", "tblCalc", "{fldA} + {fldB}"),
                        Field.formula("fldD", "D", "tblCalc", "{fldC} * 2"))));
    }

    /** X and Y reference each other, Z depends on X, W is independent. */
    public static Schema cyclic() {
        return Schema.of(new Table(
                "tblLoop",
                "Loop",
                List.of(
                        Field.basic("fldV", "V", FieldType.NUMBER, "tblLoop"),
                        Field.formula("fldX", "X", "tblLoop", "{fldY} + 1"),
                        Field.formula("fldY", "Y", "tblLoop", "{fldX} + 1"),
                        Field.formula("fldZ", "Z", "tblLoop", "{fldX} * 2"),
                        Field.formula("fldW", "W", "tblLoop", "{fldV} - 1"))));
    }

    /**
     * Orders with a stored scalar {@code Qty}, a multi-record lookup {@code Qtys} of the line
     * quantities and formulas aggregating over both.
     */
    public static Schema aggregates() {
        return Schema.of(
                new Table(
                        "tblAggOrders",
                        "Orders",
                        List.of(
                                Field.basic("fldAggQty", "Qty", FieldType.NUMBER, "tblAggOrders"),
                                Field.link("fldAggLines", "Lines", "tblAggOrders", "tblAggLines", "fldAggOrder"),
                                Field.lookup("fldAggQtys", "Qtys", "tblAggOrders", "fldAggLines", "fldAggLineQty"),
                                Field.formula("fldAggSumQty", "Sum Qty", "tblAggOrders", "SUM({fldAggQty})"),
                                Field.formula("fldAggMaxQty", "Max Qty", "tblAggOrders", "MAX({fldAggQty})"),
                                Field.formula(
                                        "fldAggMinAll", "Min All", "tblAggOrders", "MIN({fldAggQty}, {fldAggQtys})"),
                                Field.formula("fldAggAvgQtys", "Avg Qtys", "tblAggOrders", "AVERAGE({fldAggQtys})"),
                                Field.formula(
                                        "fldAggSumAll", "Sum All", "tblAggOrders", "SUM({fldAggQty}, {fldAggQtys})"),
                                Field.formula(
                                        "fldAggLabel", "Qty Label", "tblAggOrders", "\"Qtys: \" & {fldAggQtys}"))),
                new Table(
                        "tblAggLines",
                        "Lines",
                        List.of(
                                Field.basic("fldAggLineQty", "Line Qty", FieldType.NUMBER, "tblAggLines"),
                                Field.link("fldAggOrder", "Order", "tblAggLines", "tblAggOrders", "fldAggLines"))));
    }
}
