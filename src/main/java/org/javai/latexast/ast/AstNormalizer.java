package org.javai.latexast.ast;

import java.util.List;
import java.util.Objects;
import org.javai.latexast.expr.Expression;
import org.javai.latexast.expr.ExpressionVisitor;
import org.javai.latexast.tokens.TokenNode;
import org.javai.latexast.tokens.TokenNodeVisitor;
import org.javai.latexast.vocabulary.LatexVocabulary;

/**
 * Maps expression trees and token trees onto the public AST shapes.
 * <p>
 * Both mappings are pure and deterministic; child order is preserved.
 */
public class AstNormalizer {

	private final LatexVocabulary vocabulary;
	private final SemanticMapper semanticMapper = new SemanticMapper();
	private final SyntacticMapper syntacticMapper = new SyntacticMapper();

	public AstNormalizer() {
		this(LatexVocabulary.standard());
	}

	public AstNormalizer(LatexVocabulary vocabulary) {
		this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary must not be null");
	}

	public SemanticAst semantic(Expression expression) {
		return expression.accept(semanticMapper);
	}

	public SyntacticAst.Root syntactic(List<TokenNode> tokens) {
		return new SyntacticAst.Root(syntacticChildren(tokens));
	}

	private List<SemanticAst> semanticChildren(List<Expression> args) {
		return args.stream().map(this::semantic).toList();
	}

	private List<SyntacticAst> syntacticChildren(List<TokenNode> nodes) {
		return nodes.stream().map(node -> node.accept(syntacticMapper)).toList();
	}

	private final class SemanticMapper implements ExpressionVisitor<SemanticAst> {

		@Override
		public SemanticAst visitNumber(Expression.Number number) {
			return new SemanticAst.NumberNode(number.value());
		}

		@Override
		public SemanticAst visitSymbol(Expression.Symbol symbol) {
			return new SemanticAst.SymbolNode(symbol.name());
		}

		@Override
		public SemanticAst visitAdd(Expression.Add add) {
			return new SemanticAst.OperatorNode(SemanticAst.Operator.ADD, semanticChildren(add.args()));
		}

		@Override
		public SemanticAst visitMul(Expression.Mul mul) {
			return new SemanticAst.OperatorNode(SemanticAst.Operator.MUL, semanticChildren(mul.args()));
		}

		@Override
		public SemanticAst visitPow(Expression.Pow pow) {
			return new SemanticAst.PowNode(semantic(pow.base()), semantic(pow.exponent()));
		}

		@Override
		public SemanticAst visitFunctionCall(Expression.FunctionCall call) {
			return new SemanticAst.FunctionNode(call.name(), semanticChildren(call.args()));
		}

		@Override
		public SemanticAst visitUnknown(Expression.Unknown unknown) {
			return new SemanticAst.UnknownNode(unknown.text());
		}
	}

	private final class SyntacticMapper implements TokenNodeVisitor<SyntacticAst> {

		@Override
		public SyntacticAst visitMacro(TokenNode.Macro macro) {
			return new SyntacticAst.MacroNode(macro.name(), syntacticChildren(macro.args()),
					vocabulary.roleOf(macro.name()).orElse(null));
		}

		@Override
		public SyntacticAst visitGroup(TokenNode.Group group) {
			return new SyntacticAst.GroupNode(syntacticChildren(group.children()));
		}

		@Override
		public SyntacticAst visitMathRegion(TokenNode.MathRegion math) {
			return new SyntacticAst.MathNode(syntacticChildren(math.children()));
		}

		@Override
		public SyntacticAst visitChar(TokenNode.Char ch) {
			return new SyntacticAst.CharNode(ch.value());
		}
	}
}
