package io.formulagen.core.compress;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FormulaFormatterTest {

    @Test
    void compactRemovesSpacingAroundPunctuation() {
        assertThat(FormulaFormatter.compact("IF( {a} ,  1 ,\n 2 )")).isEqualTo("IF({a},1,2)");
    }

    @Test
    void compactCollapsesOtherWhitespace() {
        assertThat(FormulaFormatter.compact("  {a}   +\t\t{b}  ")).isEqualTo("{a} + {b}");
    }

    @Test
    void compactLeavesLiteralsAndReferencesAlone() {
        assertThat(FormulaFormatter.compact("\"a   ( b\"  &  {x  ,  y}")).isEqualTo("\"a   ( b\" & {x  ,  y}");
    }

    @Test
    void logicalIndentsEachArgument() {
        assertThat(FormulaFormatter.logical("IF({a} > 1, \"x\", \"y\")"))
                .isEqualTo("IF(\n    {a} > 1,\n    \"x\",\n    \"y\"\n)");
    }

    @Test
    void logicalNestsBlocks() {
        assertThat(FormulaFormatter.logical("AND(OR(1,2),3)", "  "))
                .isEqualTo("AND(\n  OR(\n    1,\n    2\n  ),\n  3\n)");
    }

    @Test
    void logicalKeepsEmptyArgumentLists() {
        assertThat(FormulaFormatter.logical("DAY(NOW())")).isEqualTo("DAY(\n    NOW()\n)");
    }

    @Test
    void logicalIgnoresCommasInStrings() {
        assertThat(FormulaFormatter.logical("CONCATENATE(\"a,b\", {c})"))
                .isEqualTo("CONCATENATE(\n    \"a,b\",\n    {c}\n)");
    }
}
