package org.javai.latexast.expr;

/**
 * Visitor over the closed set of {@link Expression} kinds.
 *
 * @param <R> the return type of the visitor operations
 */
public interface ExpressionVisitor<R> {

	R visitNumber(Expression.Number number);

	R visitSymbol(Expression.Symbol symbol);

	R visitAdd(Expression.Add add);

	R visitMul(Expression.Mul mul);

	R visitPow(Expression.Pow pow);

	R visitFunctionCall(Expression.FunctionCall call);

	R visitUnknown(Expression.Unknown unknown);
}
