package org.zplot;

import java.util.Objects;

import org.zplot.codegen.ShaderLiterals;

/**
 * Settings for {@link ExpressionCompiler} and {@link ComplexExpression}.
 * <p>
 * {@link #fromSystemProperties()} reads:
 * <ul>
 *   <li>{@code zplot.compiler.defaultExpression} - expression seeded into a new {@link ComplexExpression}, default {@code z}</li>
 *   <li>{@code zplot.compiler.strictArity} - reject calls whose comma-separated argument count differs from the arity, default {@code false}</li>
 *   <li>{@code zplot.shader.literalPrecision} - significant digits of numeric literals in GLSL, default and minimum 15</li>
 * </ul>
 */
public final class CompilerSettings {

    public static final String DEFAULT_EXPRESSION_PROPERTY = "zplot.compiler.defaultExpression";
    public static final String STRICT_ARITY_PROPERTY = "zplot.compiler.strictArity";
    public static final String LITERAL_PRECISION_PROPERTY = "zplot.shader.literalPrecision";

    private static final CompilerSettings DEFAULTS = builder().build();

    private final String defaultExpression;
    private final boolean strictArity;
    private final int literalPrecision;

    private CompilerSettings(Builder builder) {
        this.defaultExpression = builder.defaultExpression;
        this.strictArity = builder.strictArity;
        this.literalPrecision = builder.literalPrecision;
    }

    public static CompilerSettings defaults() {
        return DEFAULTS;
    }

    public static CompilerSettings fromSystemProperties() {
        Builder builder = builder();
        String defaultExpression = System.getProperty(DEFAULT_EXPRESSION_PROPERTY);
        if (defaultExpression != null) {
            builder.defaultExpression(defaultExpression);
        }
        String strict = System.getProperty(STRICT_ARITY_PROPERTY);
        if (strict != null) {
            builder.strictArity(Boolean.parseBoolean(strict.trim()));
        }
        String precision = System.getProperty(LITERAL_PRECISION_PROPERTY);
        if (precision != null) {
            try {
                builder.literalPrecision(Integer.parseInt(precision.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + LITERAL_PRECISION_PROPERTY + ": '" + precision + "'", e);
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .defaultExpression(defaultExpression)
                .strictArity(strictArity)
                .literalPrecision(literalPrecision);
    }

    public String defaultExpression() {
        return defaultExpression;
    }

    public boolean strictArity() {
        return strictArity;
    }

    public int literalPrecision() {
        return literalPrecision;
    }

    @Override
    public String toString() {
        return "CompilerSettings{" +
               "defaultExpression='" + defaultExpression + '\'' +
               ", strictArity=" + strictArity +
               ", literalPrecision=" + literalPrecision +
               '}';
    }

    public static final class Builder {
        private String defaultExpression = "z";
        private boolean strictArity;
        private int literalPrecision = ShaderLiterals.MIN_PRECISION;

        private Builder() {}

        public Builder defaultExpression(String defaultExpression) {
            this.defaultExpression = Objects.requireNonNull(defaultExpression, "defaultExpression");
            return this;
        }

        public Builder strictArity(boolean strictArity) {
            this.strictArity = strictArity;
            return this;
        }

        public Builder literalPrecision(int literalPrecision) {
            if (literalPrecision < ShaderLiterals.MIN_PRECISION) {
                throw new IllegalArgumentException("Shader literal precision must be at least "
                        + ShaderLiterals.MIN_PRECISION + ", got " + literalPrecision);
            }
            this.literalPrecision = literalPrecision;
            return this;
        }

        public CompilerSettings build() {
            return new CompilerSettings(this);
        }
    }
}
