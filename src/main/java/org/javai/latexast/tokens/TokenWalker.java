package org.javai.latexast.tokens;

import java.util.List;
import java.util.Objects;

/**
 * Syntactic fallback parser: LaTeX source to token tree.
 * <p>
 * Never consults the semantic grammar, so it accepts every input the semantic parser
 * rejects as long as the LaTeX structure itself is well formed.
 */
public class TokenWalker {

	private final LatexWalker walker;

	public TokenWalker() {
		this(new LatexWalker());
	}

	public TokenWalker(LatexWalker walker) {
		this.walker = Objects.requireNonNull(walker, "walker must not be null");
	}

	/**
	 * @throws LatexSyntaxException if the LaTeX structure is malformed
	 */
	public List<TokenNode> parseTokens(String latex) {
		return TokenTreeBuilder.build(walker.walk(latex));
	}
}
