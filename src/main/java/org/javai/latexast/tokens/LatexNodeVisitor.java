package org.javai.latexast.tokens;

/**
 * Visitor over the raw LaTeX tree.
 *
 * @param <R> the return type of the visitor operations
 */
public interface LatexNodeVisitor<R> {

	R visitMacro(LatexNode.MacroNode macro);

	R visitGroup(LatexNode.GroupNode group);

	R visitMath(LatexNode.MathNode math);

	R visitChars(LatexNode.CharsNode chars);

	R visitEnvironment(LatexNode.EnvironmentNode environment);

	R visitSpecials(LatexNode.SpecialsNode specials);

	R visitComment(LatexNode.CommentNode comment);
}
