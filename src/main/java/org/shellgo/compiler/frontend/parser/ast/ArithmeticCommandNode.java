package org.shellgo.compiler.frontend.parser.ast;

import org.shellgo.compiler.api.SourceInfo;

/**
 * An arithmetic command {@code (( expression ))}, kept as raw text.
 *
 * @param expression The text between the double parentheses.
 * @param source The position of the command.
 */
public record ArithmeticCommandNode(String expression, SourceInfo source) implements AstNode {
}
