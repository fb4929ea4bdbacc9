package org.zplot;

import java.util.List;

import org.zplot.codegen.EvaluatorCodeGenerator;
import org.zplot.codegen.ShaderCodeGenerator;
import org.zplot.parser.ExpressionParser;
import org.zplot.parser.Token;
import org.zplot.parser.Tokenizer;
import org.zplot.parser.ast.ExpressionNode;

/**
 * Tokenize, parse and generate both backends for a source string. Stateless and thread safe.
 */
public final class ExpressionCompiler {

    private final ExpressionParser parser;
    private final ShaderCodeGenerator shaderGenerator;

    public ExpressionCompiler() {
        this(CompilerSettings.defaults());
    }

    public ExpressionCompiler(CompilerSettings settings) {
        this.parser = new ExpressionParser(settings.strictArity());
        this.shaderGenerator = new ShaderCodeGenerator(settings.literalPrecision());
    }

    /**
     * @throws ExpressionLexException    if the source is empty or contains a character outside the grammar
     * @throws ExpressionSyntaxException if the tokens do not form a single well-formed expression
     */
    public CompiledExpression compile(String source) {
        List<Token> tokens = Tokenizer.tokenize(source);
        ExpressionNode ast = parser.parse(tokens, source);
        return new CompiledExpression(source, ast, shaderGenerator.generate(ast), EvaluatorCodeGenerator.INSTANCE.generate(ast));
    }
}
