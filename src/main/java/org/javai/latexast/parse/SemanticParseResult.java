package org.javai.latexast.parse;

import org.javai.latexast.expr.Expression;

/**
 * Outcome of a semantic parse: either an expression tree or the reason there is none.
 */
public sealed interface SemanticParseResult {

	record Parsed(Expression expression) implements SemanticParseResult {
	}

	record Failed(String message, int position) implements SemanticParseResult {
		@Override
		public String toString() {
			return message + " (at position " + position + ")";
		}
	}
}
