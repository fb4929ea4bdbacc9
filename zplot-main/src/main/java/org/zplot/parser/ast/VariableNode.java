package org.zplot.parser.ast;

import java.util.Objects;

import org.zplot.parser.ast.visitor.ExpressionVisitor;
import org.zplot.symbols.NamedConstant;
import org.zplot.symbols.Symbols;

/**
 * A name: either the free variable or one of the {@link NamedConstant}s, resolved at parse time.
 *
 * @param constant the resolved constant, {@code null} for the free variable
 */
public record VariableNode(String name, NamedConstant constant) implements ExpressionNode {

    public VariableNode {
        Objects.requireNonNull(name, "name");
    }

    public static VariableNode freeVariable() {
        return new VariableNode(Symbols.FREE_VARIABLE, null);
    }

    public static VariableNode of(NamedConstant constant) {
        return new VariableNode(constant.constantName(), constant);
    }

    public boolean isFreeVariable() {
        return constant == null;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
