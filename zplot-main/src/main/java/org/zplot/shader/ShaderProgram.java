package org.zplot.shader;

/**
 * Vertex and fragment source ready to hand to a GL driver.
 */
public record ShaderProgram(String vertexSource, String fragmentSource) {
}
