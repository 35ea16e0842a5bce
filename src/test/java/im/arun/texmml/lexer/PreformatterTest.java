package im.arun.texmml.lexer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

final class PreformatterTest {

    @Test
    void lineEndingsAreNormalized() {
        assertThat(Preformatter.apply("a\r\nb\rc")).isEqualTo("a\nb\nc");
    }

    @Test
    void delimitersBeforeNewlineGetATrailingSpace() {
        assertThat(Preformatter.apply("[a]\n{b}\n$c$\n")).isEqualTo("[a] \n{b} \n$c$ \n");
    }

    @Test
    void lineBreakCommandGetsATrailingSpace() {
        assertThat(Preformatter.apply("a\\\\b")).isEqualTo("a\\\\ b");
    }
}
