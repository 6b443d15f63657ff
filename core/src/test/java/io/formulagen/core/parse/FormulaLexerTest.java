package io.formulagen.core.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formulagen.core.error.LexException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link FormulaLexer}. */
class FormulaLexerTest {

    private static List<TokenKind> kinds(String formula) {
        return FormulaLexer.tokenize(formula).stream().map(Token::kind).toList();
    }

    @Test
    void emptyFormulaYieldsOnlyEof() {
        assertThat(kinds("")).containsExactly(TokenKind.EOF);
        assertThat(kinds("   \n\t")).containsExactly(TokenKind.EOF);
    }

    @Test
    void tokenStreamAlwaysEndsWithEof() {
        List<Token> tokens = FormulaLexer.tokenize("IF({fldA}, 1, 2)");

        assertThat(tokens.get(tokens.size() - 1).kind()).isEqualTo(TokenKind.EOF);
        assertThat(tokens).extracting(Token::kind).containsExactly(
                TokenKind.IDENTIFIER,
                TokenKind.LEFT_PAREN,
                TokenKind.FIELD_REF,
                TokenKind.COMMA,
                TokenKind.NUMBER,
                TokenKind.COMMA,
                TokenKind.NUMBER,
                TokenKind.RIGHT_PAREN,
                TokenKind.EOF);
    }

    @Nested
    @DisplayName("Field references")
    class FieldReferences {

        @Test
        void fieldReferenceCarriesBareId() {
            Token token = FormulaLexer.tokenize("{fldAbc123}").get(0);

            assertThat(token.kind()).isEqualTo(TokenKind.FIELD_REF);
            assertThat(token.value()).isEqualTo("fldAbc123");
            assertThat(token.text()).isEqualTo("{fldAbc123}");
            assertThat(token.position()).isZero();
        }

        @Test
        void fieldNameWithSpacesIsOneToken() {
            Token token = FormulaLexer.tokenize("{ Unit Price }").get(0);

            assertThat(token.value()).isEqualTo("Unit Price");
        }

        @Test
        void unterminatedReferenceFails() {
            assertThatThrownBy(() -> FormulaLexer.tokenize("1 + {fldA"))
                    .isInstanceOf(LexException.class)
                    .hasMessageContaining("Unterminated field reference")
                    .satisfies(e -> assertThat(((LexException) e).position()).hasValue(4));
        }

        @Test
        void emptyReferenceFails() {
            assertThatThrownBy(() -> FormulaLexer.tokenize("{ }")).isInstanceOf(LexException.class);
        }
    }

    @Nested
    @DisplayName("String literals")
    class StringLiterals {

        @Test
        void doubleAndSingleQuotesAreAccepted() {
            assertThat(FormulaLexer.tokenize("\"abc\"").get(0).value()).isEqualTo("abc");
            assertThat(FormulaLexer.tokenize("'abc'").get(0).value()).isEqualTo("abc");
        }

        @Test
        void escapesAreDecoded() {
            Token token = FormulaLexer.tokenize("\"say \\\"hi\\\"\\n\"").get(0);

            assertThat(token.kind()).isEqualTo(TokenKind.STRING);
            assertThat(token.value()).isEqualTo("say \"hi\"\n");
        }

        @Test
        void otherQuoteNeedsNoEscape() {
            assertThat(FormulaLexer.tokenize("\"it's\"").get(0).value()).isEqualTo("it's");
        }

        @Test
        void unterminatedStringFails() {
            assertThatThrownBy(() -> FormulaLexer.tokenize("\"abc"))
                    .isInstanceOf(LexException.class)
                    .hasMessageContaining("Unterminated string");
        }
    }

    @Nested
    @DisplayName("Operators and keywords")
    class OperatorsAndKeywords {

        @Test
        void twoCharacterOperatorsWinOverSingle() {
            List<Token> tokens = FormulaLexer.tokenize("1 <= 2 >= 3 != 4");

            assertThat(tokens).filteredOn(t -> t.kind() == TokenKind.OPERATOR)
                    .extracting(Token::value)
                    .containsExactly("<=", ">=", "!=");
        }

        @Test
        void aliasesAreNormalised() {
            List<Token> tokens = FormulaLexer.tokenize("1 == 2 <> 3");

            assertThat(tokens).filteredOn(t -> t.kind() == TokenKind.OPERATOR)
                    .extracting(Token::value)
                    .containsExactly("=", "!=");
            assertThat(tokens.get(3).text()).isEqualTo("<>");
        }

        @Test
        void booleansAreKeywordsInAnyCase() {
            List<Token> tokens = FormulaLexer.tokenize("true FALSE True");

            assertThat(tokens.subList(0, 3)).allSatisfy(t -> assertThat(t.kind()).isEqualTo(TokenKind.BOOLEAN));
            assertThat(tokens.subList(0, 3)).extracting(Token::value).containsExactly("TRUE", "FALSE", "TRUE");
        }

        @Test
        void identifiersAreUpperCased() {
            Token token = FormulaLexer.tokenize("concatenate").get(0);

            assertThat(token.kind()).isEqualTo(TokenKind.IDENTIFIER);
            assertThat(token.value()).isEqualTo("CONCATENATE");
            assertThat(token.text()).isEqualTo("concatenate");
        }

        @Test
        void decimalNumbers() {
            assertThat(FormulaLexer.tokenize("3.25").get(0).value()).isEqualTo("3.25");
            assertThat(FormulaLexer.tokenize(".5").get(0).value()).isEqualTo(".5");
        }

        @Test
        void unexpectedCharacterReportsPosition() {
            assertThatThrownBy(() -> FormulaLexer.tokenize("1 + #"))
                    .isInstanceOf(LexException.class)
                    .hasMessageContaining("'#'")
                    .hasMessageContaining("position 4");
        }
    }
}
