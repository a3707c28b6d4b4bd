package org.stackpp.compiler.frontend;

import org.stackpp.compiler.frontend.lexer.Tokenizer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Tokenizer}.
 * These tests verify how source text is segmented, in particular that nested blocks and
 * quoted strings come out as single tokens and that unterminated input is dropped.
 */
@Tag("unit")
class TokenizerTest {

    @Test
    void splitsOnWhitespace() {
        assertThat(Tokenizer.tokenize("3 4 add")).containsExactly("3", "4", "add");
    }

    @Test
    void treatsAllSeparatorsAlike() {
        String source = "1\t2\n3\r4\u30005  6";
        assertThat(Tokenizer.tokenize(source)).containsExactly("1", "2", "3", "4", "5", "6");
    }

    @Test
    void keepsNestedBlockAsOneToken() {
        List<String> tokens = Tokenizer.tokenize("{1 {2 3} add} print");
        assertThat(tokens).containsExactly("{1 {2 3} add}", "print");
    }

    @Test
    void preservesWhitespaceInsideBlock() {
        assertThat(Tokenizer.tokenize("{1  \n 2}")).containsExactly("{1  \n 2}");
    }

    @Test
    void keepsQuotedStringWithSpacesAsOneToken() {
        assertThat(Tokenizer.tokenize("\"hello world\" print"))
                .containsExactly("\"hello world\"", "print");
    }

    @Test
    void quoteInsideBlockDoesNotToggleQuoting() {
        assertThat(Tokenizer.tokenize("{\"a b\" print} eval"))
                .containsExactly("{\"a b\" print}", "eval");
    }

    @Test
    void bracesInsideStringAreOrdinaryCharacters() {
        assertThat(Tokenizer.tokenize("\"{x\" \"}\"")).containsExactly("\"{x\"", "\"}\"");
    }

    @Test
    void adjacentStringsAreSeparateTokens() {
        assertThat(Tokenizer.tokenize("\"a\"\"b\"")).containsExactly("\"a\"", "\"b\"");
    }

    @Test
    void closingBraceEndsTokenImmediately() {
        assertThat(Tokenizer.tokenize("{a}b")).containsExactly("{a}", "b");
        assertThat(Tokenizer.tokenize("abc{d}")).containsExactly("abc{d}");
    }

    @Test
    void dropsUnterminatedBlockAtEndOfInput() {
        assertThat(Tokenizer.tokenize("1 {2 {3}")).containsExactly("1");
    }

    @Test
    void dropsUnterminatedStringAtEndOfInput() {
        assertThat(Tokenizer.tokenize("1 \"abc def")).containsExactly("1");
    }

    @Test
    void discardsStrayClosingBrace() {
        assertThat(Tokenizer.tokenize("1 } 2")).containsExactly("1", "2");
    }

    @Test
    void emptyAndBlankInputYieldNoTokens() {
        assertThat(Tokenizer.tokenize("")).isEmpty();
        assertThat(Tokenizer.tokenize("  \n\t ")).isEmpty();
    }
}
