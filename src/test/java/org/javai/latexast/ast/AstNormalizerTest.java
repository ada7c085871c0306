package org.javai.latexast.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.latexast.expr.Expression.add;
import static org.javai.latexast.expr.Expression.call;
import static org.javai.latexast.expr.Expression.mul;
import static org.javai.latexast.expr.Expression.number;
import static org.javai.latexast.expr.Expression.pow;
import static org.javai.latexast.expr.Expression.symbol;

import java.util.List;
import org.javai.latexast.expr.Expression;
import org.javai.latexast.tokens.TokenNode;
import org.junit.jupiter.api.Test;

class AstNormalizerTest {

	private final AstNormalizer normalizer = new AstNormalizer();

	@Test
	void numberKeepsItsValue() {
		SemanticAst ast = normalizer.semantic(number(5.0));

		assertThat(ast).isEqualTo(new SemanticAst.NumberNode(5.0));
		assertThat(((SemanticAst.NumberNode) ast).value()).isEqualTo(5.0);
		assertThat(ast.type()).isEqualTo("number");
	}

	@Test
	void operatorsKeepArgumentOrder() {
		SemanticAst ast = normalizer.semantic(add(symbol("y"), mul(number(2), symbol("x"))));

		assertThat(ast).isEqualTo(new SemanticAst.OperatorNode(SemanticAst.Operator.ADD, List.of(
				new SemanticAst.SymbolNode("y"),
				new SemanticAst.OperatorNode(SemanticAst.Operator.MUL, List.of(
						new SemanticAst.NumberNode(2.0),
						new SemanticAst.SymbolNode("x"))))));
		assertThat(ast.type()).isEqualTo("add");
	}

	@Test
	void powerHasSeparateBaseAndExponent() {
		SemanticAst ast = normalizer.semantic(pow(symbol("x"), number(2)));

		assertThat(ast).isEqualTo(new SemanticAst.PowNode(
				new SemanticAst.SymbolNode("x"), new SemanticAst.NumberNode(2.0)));
	}

	@Test
	void functionsAndUnknowns() {
		assertThat(normalizer.semantic(call("sin", symbol("x")))).isEqualTo(
				new SemanticAst.FunctionNode("sin", List.of(new SemanticAst.SymbolNode("x"))));
		assertThat(normalizer.semantic(new Expression.Unknown("x = 1.0")))
				.isEqualTo(new SemanticAst.UnknownNode("x = 1.0"));
	}

	@Test
	void syntacticTreeClassifiesMacros() {
		SyntacticAst.Root root = normalizer.syntactic(List.of(
				new TokenNode.Macro("\\frac", List.of(new TokenNode.Char("a"), new TokenNode.Char("b"))),
				new TokenNode.Macro("\\times", List.of()),
				new TokenNode.Macro("\\alpha", List.of())));

		assertThat(root.type()).isEqualTo("latex_token_ast");
		assertThat(root.children()).containsExactly(
				new SyntacticAst.MacroNode("\\frac",
						List.of(new SyntacticAst.CharNode("a"), new SyntacticAst.CharNode("b")), "function"),
				new SyntacticAst.MacroNode("\\times", List.of(), "operator"),
				new SyntacticAst.MacroNode("\\alpha", List.of(), null));
	}

	@Test
	void syntacticTreeKeepsGroupsAndMathRegions() {
		SyntacticAst.Root root = normalizer.syntactic(List.of(
				new TokenNode.Group(List.of(new TokenNode.Char("x"))),
				new TokenNode.MathRegion(List.of())));

		assertThat(root.children()).containsExactly(
				new SyntacticAst.GroupNode(List.of(new SyntacticAst.CharNode("x"))),
				new SyntacticAst.MathNode(List.of()));
	}
}
