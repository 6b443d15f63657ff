package io.formulagen.core.backend;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class IdentifiersTest {

    @ParameterizedTest
    @CsvSource({
        "Customer Name, customer_name",
        "unitPrice, unit_price",
        "Total $ (USD), total_usd",
        "2024 Sales, _2024_sales",
        "Qty2Go, qty2_go",
        "  --Status--  , status"
    })
    void snakeCase(String name, String expected) {
        assertThat(Identifiers.snakeCase(name)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"Customer Name, customerName", "line_items, lineItems", "unit price, unitPrice"})
    void camelCase(String name, String expected) {
        assertThat(Identifiers.camelCase(name)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"line items, LineItems", "ORDERS, Orders", "2nd place, _2ndPlace"})
    void pascalCase(String name, String expected) {
        assertThat(Identifiers.pascalCase(name)).isEqualTo(expected);
    }

    @Test
    void blankNamesFallBack() {
        assertThat(Identifiers.snakeCase("  ")).isEqualTo("field");
        assertThat(Identifiers.snakeCase(null)).isEqualTo("field");
        assertThat(Identifiers.pascalCase("!!")).isEqualTo("Field");
        assertThat(Identifiers.camelCase("")).isEqualTo("field");
    }

    @Test
    void leadingDigitKeepsUnderscoreInCamelCase() {
        assertThat(Identifiers.camelCase("3 Month Avg")).isEqualTo("_3MonthAvg");
    }

    @Test
    void wordsSplitOnCaseBoundaries() {
        assertThat(Identifiers.words("orderID totalAmount")).containsExactly("order", "ID", "total", "Amount");
    }
}
