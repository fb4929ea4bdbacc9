package org.zplot.codegen;

import java.util.stream.Collectors;

import org.zplot.parser.ast.BinaryOperationNode;
import org.zplot.parser.ast.ConstantNode;
import org.zplot.parser.ast.ExpressionNode;
import org.zplot.parser.ast.FunctionCallNode;
import org.zplot.parser.ast.UnaryMinusNode;
import org.zplot.parser.ast.VariableNode;
import org.zplot.parser.ast.visitor.ExpressionVisitor;
import org.zplot.symbols.Symbols;

/**
 * Emits the GLSL definition of {@code vec2 F_Z(vec2 z)} for an expression tree.
 * <p>
 * Pure text synthesis: nothing is folded or evaluated. Every operator and function becomes a call
 * to its {@code c_*} routine, which the companion library spliced into the fragment shader provides.
 */
public final class ShaderCodeGenerator implements ExpressionVisitor<String> {

    private static final String MINUS_ONE = ShaderLiterals.vec2("-1.0", "0.0");

    private final int precision;

    public ShaderCodeGenerator() {
        this(ShaderLiterals.MIN_PRECISION);
    }

    public ShaderCodeGenerator(int precision) {
        if (precision < ShaderLiterals.MIN_PRECISION) {
            throw new IllegalArgumentException("Shader literal precision must be at least "
                    + ShaderLiterals.MIN_PRECISION + ", got " + precision);
        }
        this.precision = precision;
    }

    public String generate(ExpressionNode root) {
        return function(root.accept(this));
    }

    public static String identityFunction() {
        return function(Symbols.FREE_VARIABLE);
    }

    private static String function(String body) {
        return "vec2 " + Symbols.SHADER_FUNCTION + "(vec2 " + Symbols.FREE_VARIABLE + ") {\n"
                + "    return " + body + ";\n"
                + "}";
    }

    @Override
    public String visit(ConstantNode n) {
        return ShaderLiterals.vec2(ShaderLiterals.real(n.value(), precision), "0.0");
    }

    @Override
    public String visit(VariableNode n) {
        if (n.isFreeVariable()) {
            return Symbols.FREE_VARIABLE;
        }
        return n.constant().shaderLiteral();
    }

    @Override
    public String visit(BinaryOperationNode n) {
        return n.operator().shaderRoutine() + "(" + n.left().accept(this) + ", " + n.right().accept(this) + ")";
    }

    @Override
    public String visit(FunctionCallNode n) {
        return n.arguments().stream()
                .map(arg -> arg.accept(this))
                .collect(Collectors.joining(", ", n.function().shaderRoutine() + "(", ")"));
    }

    @Override
    public String visit(UnaryMinusNode n) {
        return "c_mul(" + MINUS_ONE + ", " + n.operand().accept(this) + ")";
    }
}
