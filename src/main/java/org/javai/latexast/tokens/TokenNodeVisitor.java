package org.javai.latexast.tokens;

/**
 * Visitor over the closed set of {@link TokenNode} kinds.
 *
 * @param <R> the return type of the visitor operations
 */
public interface TokenNodeVisitor<R> {

	R visitMacro(TokenNode.Macro macro);

	R visitGroup(TokenNode.Group group);

	R visitMathRegion(TokenNode.MathRegion math);

	R visitChar(TokenNode.Char ch);
}
