package org.zplot.shader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zplot.CompiledExpression;
import org.zplot.codegen.ShaderCodeGenerator;

/**
 * Splices generated {@code F_Z} definitions into the domain coloring fragment shader.
 * <p>
 * The fragment template carries two insertion points: {@value #COMPLEX_INCLUDE}, replaced once by
 * the companion {@code c_*} routine library, and {@value #FUNCTION_INCLUDE}, replaced by the
 * function of each compiled expression.
 */
public final class ShaderProgramAssembler {

    private static final Logger log = LoggerFactory.getLogger(ShaderProgramAssembler.class);

    public static final String COMPLEX_INCLUDE = "#include <complex>";
    public static final String FUNCTION_INCLUDE = "#include <function>";

    private final String vertexSource;
    private final String fragmentTemplate;
    private final String complexLibrary;

    public ShaderProgramAssembler(String vertexSource, String fragmentTemplate, String complexLibrary) {
        requireInsertionPoint(fragmentTemplate, COMPLEX_INCLUDE);
        requireInsertionPoint(fragmentTemplate, FUNCTION_INCLUDE);
        this.vertexSource = vertexSource;
        this.complexLibrary = complexLibrary;
        this.fragmentTemplate = fragmentTemplate.replace(COMPLEX_INCLUDE, complexLibrary);
    }

    /**
     * Loads {@code vertex.glsl}, {@code fragment.glsl} and {@code complex.glsl} bundled next to this class.
     */
    public static ShaderProgramAssembler fromClasspath() {
        ShaderProgramAssembler assembler = new ShaderProgramAssembler(
                load("vertex.glsl"), load("fragment.glsl"), load("complex.glsl"));
        log.debug("Loaded shader templates from classpath");
        return assembler;
    }

    /** Program plotting {@code f(z) = z}, shown before any expression has been compiled. */
    public ShaderProgram identity() {
        return assemble(ShaderCodeGenerator.identityFunction());
    }

    public ShaderProgram assemble(CompiledExpression expression) {
        return assemble(expression.shaderSource());
    }

    public ShaderProgram assemble(String functionSource) {
        return new ShaderProgram(vertexSource, fragmentTemplate.replace(FUNCTION_INCLUDE, functionSource));
    }

    public String complexLibrary() {
        return complexLibrary;
    }

    private static void requireInsertionPoint(String template, String marker) {
        if (!template.contains(marker)) {
            throw new IllegalStateException("Fragment shader template has no '" + marker + "' insertion point");
        }
    }

    private static String load(String name) {
        try (InputStream in = ShaderProgramAssembler.class.getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalStateException("Shader resource not found: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read shader resource " + name, e);
        }
    }
}
