package im.arun.texmml.lexer;

import im.arun.texmml.catalog.ConstructCatalog;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.ExpressionType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

final class MathTextSegmenterTest {

    @Test
    void implicitProductBetweenNumberAndVariable() {
        List<Expression> tokens = MathTextSegmenter.segment("2x(", 1, false);

        assertThat(tokens).extracting(Expression::getName)
                .containsExactly("2", ConstructCatalog.INVISIBLE_TIMES, "x", ConstructCatalog.INVISIBLE_TIMES, "(");
        assertThat(tokens.get(1).getType()).isEqualTo(ExpressionType.COMMAND);
        assertThat(tokens).allMatch(Expression::isMathMode);
    }

    @Test
    void operatorsSeparateWithoutMarker() {
        assertThat(MathTextSegmenter.segment("a+1", 1, false)).extracting(Expression::getName)
                .containsExactly("a", "+", "1");
    }

    @Test
    void decimalNumbersAndComparisonsStayWhole() {
        assertThat(MathTextSegmenter.segment("3.14<=x", 1, false)).extracting(Expression::getName)
                .containsExactly("3.14", "<=", "x");
    }

    @Test
    void placeholdersAreSingleTokens() {
        assertThat(MathTextSegmenter.segment("X#1Y", 1, false)).extracting(Expression::getName)
                .containsExactly("X", ConstructCatalog.INVISIBLE_TIMES, "#1", ConstructCatalog.INVISIBLE_TIMES, "Y");
    }

    @Test
    void whitespaceIsRecordedOnTheFollowingToken() {
        List<Expression> tokens = MathTextSegmenter.segment("a = b", 4, true);

        assertThat(tokens).extracting(Expression::isWhitespaceBefore).containsExactly(true, true, true);
        assertThat(tokens).extracting(Expression::getLine).containsOnly(4);
    }
}
