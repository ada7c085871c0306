package org.javai.latexast.tokens;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces the raw walker tree to the public token tree.
 * <ul>
 * <li>Each macro's argument node lists are concatenated into one child list before
 * recursing, so argument boundaries are lost.</li>
 * <li>Character runs are exploded into one {@link TokenNode.Char} per non-whitespace
 * character.</li>
 * <li>Groups and math regions recurse into their children unchanged.</li>
 * <li>Environments become groups, special characters become {@link TokenNode.Char}
 * nodes, and comments are dropped.</li>
 * </ul>
 */
public final class TokenTreeBuilder implements LatexNodeVisitor<List<TokenNode>> {

	private static final TokenTreeBuilder INSTANCE = new TokenTreeBuilder();

	private TokenTreeBuilder() {
	}

	public static List<TokenNode> build(List<LatexNode> nodes) {
		List<TokenNode> result = new ArrayList<>();
		for (LatexNode node : nodes) {
			result.addAll(node.accept(INSTANCE));
		}
		return result;
	}

	@Override
	public List<TokenNode> visitMacro(LatexNode.MacroNode macro) {
		List<LatexNode> flattened = new ArrayList<>();
		macro.arguments().forEach(flattened::addAll);
		return List.of(new TokenNode.Macro(macro.name(), build(flattened)));
	}

	@Override
	public List<TokenNode> visitGroup(LatexNode.GroupNode group) {
		return List.of(new TokenNode.Group(build(group.children())));
	}

	@Override
	public List<TokenNode> visitMath(LatexNode.MathNode math) {
		return List.of(new TokenNode.MathRegion(build(math.children())));
	}

	@Override
	public List<TokenNode> visitChars(LatexNode.CharsNode chars) {
		return explode(chars.chars());
	}

	@Override
	public List<TokenNode> visitEnvironment(LatexNode.EnvironmentNode environment) {
		return List.of(new TokenNode.Group(build(environment.children())));
	}

	@Override
	public List<TokenNode> visitSpecials(LatexNode.SpecialsNode specials) {
		return explode(specials.chars());
	}

	@Override
	public List<TokenNode> visitComment(LatexNode.CommentNode comment) {
		return List.of();
	}

	private static List<TokenNode> explode(String chars) {
		List<TokenNode> result = new ArrayList<>();
		chars.codePoints()
				.filter(cp -> !Character.isWhitespace(cp))
				.forEach(cp -> result.add(new TokenNode.Char(new String(Character.toChars(cp)))));
		return result;
	}
}
