package org.zplot;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorHandlingTest {

    private final ExpressionCompiler compiler = new ExpressionCompiler();

    // 1. ExpressionLexException — carries expression text and position
    @Test
    void lexError_carriesExpressionAndPosition() {
        String badExpression = "z + 2 # 3";
        assertThatThrownBy(() -> compiler.compile(badExpression))
            .isInstanceOf(ExpressionLexException.class)
            .satisfies(e -> {
                ExpressionLexException le = (ExpressionLexException) e;
                assertThat(le.getExpression()).isEqualTo(badExpression);
                assertThat(le.getPosition()).isEqualTo(6);
                assertThat(le.getMessage()).contains("Invalid character '#'");
            });
    }

    // 2. ExpressionSyntaxException — names the offending token
    @Test
    void syntaxError_namesOffendingToken() {
        assertThatThrownBy(() -> compiler.compile("sin(z) * foo"))
            .isInstanceOf(ExpressionSyntaxException.class)
            .satisfies(e -> {
                ExpressionSyntaxException se = (ExpressionSyntaxException) e;
                assertThat(se.getReason()).isEqualTo(ExpressionSyntaxException.Reason.UNKNOWN_IDENTIFIER);
                assertThat(se.getToken()).isEqualTo("foo");
                assertThat(se.getPosition()).isEqualTo(9);
                assertThat(se.getMessage()).startsWith("Syntax error: ").contains("'foo'");
            });
    }

    // 3. Whole-expression failures have no position
    @Test
    void structureError_hasNoPosition() {
        assertThatThrownBy(() -> compiler.compile("(z)(z)"))
            .isInstanceOf(ExpressionSyntaxException.class)
            .satisfies(e -> {
                ExpressionSyntaxException se = (ExpressionSyntaxException) e;
                assertThat(se.getPosition()).isEqualTo(-1);
                assertThat(se.getToken()).isNull();
                assertThat(se.getMessage()).contains("Invalid expression structure");
            });
    }

    // 4. Hierarchy — all exceptions extend ZPlotException
    @Test
    void exceptionHierarchy_allExtendRoot() {
        assertThat(ZPlotException.class).isAssignableFrom(ExpressionParseException.class);
        assertThat(ExpressionParseException.class).isAssignableFrom(ExpressionLexException.class);
        assertThat(ExpressionParseException.class).isAssignableFrom(ExpressionSyntaxException.class);
        assertThat(RuntimeException.class).isAssignableFrom(ZPlotException.class);
    }

    // 5. catch(ZPlotException) catches all subtypes
    @Test
    void catchRoot_catchesAllSubtypes() {
        assertCaughtByRoot(ExpressionLexException.emptyInput(""));
        assertCaughtByRoot(ExpressionLexException.invalidCharacter("$", 0));
        assertCaughtByRoot(new ExpressionSyntaxException(
            ExpressionSyntaxException.Reason.MISSING_OPERAND, "test", "+", "z+", 1));
        assertCaughtByRoot(new ExpressionParseException("test", "expr", 0));
    }

    // 6. Numeric singularities are values, not errors
    @Test
    void singularities_doNotThrow() {
        CompiledExpression compiled = compiler.compile("1/z + log(z) + sqrt(z) + z^0");
        assertThat(compiled.evaluate(org.zplot.math.Complex.ZERO).isFinite()).isFalse();
    }

    // 7. Nesting too deep for the code generators is a rejection, not an Error
    @Test
    void deepNesting_isRejectedWithReason() {
        String deep = "sin(".repeat(1000) + "z" + ")".repeat(1000);
        assertThatThrownBy(() -> compiler.compile(deep))
            .isInstanceOf(ExpressionSyntaxException.class)
            .satisfies(e -> {
                ExpressionSyntaxException se = (ExpressionSyntaxException) e;
                assertThat(se.getReason()).isEqualTo(ExpressionSyntaxException.Reason.NESTING_TOO_DEEP);
                assertThat(se.getToken()).isEqualTo("sin");
                assertThat(se.getMessage()).contains("nested deeper than");
            });
    }

    private void assertCaughtByRoot(ZPlotException ex) {
        try {
            throw ex;
        } catch (ZPlotException caught) {
            assertThat(caught).isSameAs(ex);
        }
    }
}
