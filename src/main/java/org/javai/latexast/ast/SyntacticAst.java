package org.javai.latexast.ast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Public shape of a syntactic parse. The root is always a {@link Root} with type
 * {@code latex_token_ast}; below it nodes are {@code macro}, {@code group},
 * {@code math} or {@code char}.
 */
public sealed interface SyntacticAst {

	@JsonProperty("type")
	String type();

	@JsonPropertyOrder({"type", "children"})
	record Root(@JsonProperty("children") List<SyntacticAst> children) implements SyntacticAst {
		public Root {
			children = List.copyOf(children);
		}

		@Override
		public String type() {
			return "latex_token_ast";
		}
	}

	/**
	 * @param role {@code operator} or {@code function} when the vocabulary classifies the
	 * macro, otherwise {@code null} and left out of the JSON
	 */
	@JsonPropertyOrder({"type", "name", "args", "role"})
	record MacroNode(
			@JsonProperty("name") String name,
			@JsonProperty("args") List<SyntacticAst> args,
			@JsonProperty("role") @JsonInclude(JsonInclude.Include.NON_NULL) String role) implements SyntacticAst {
		public MacroNode {
			args = List.copyOf(args);
		}

		@Override
		public String type() {
			return "macro";
		}
	}

	@JsonPropertyOrder({"type", "children"})
	record GroupNode(@JsonProperty("children") List<SyntacticAst> children) implements SyntacticAst {
		public GroupNode {
			children = List.copyOf(children);
		}

		@Override
		public String type() {
			return "group";
		}
	}

	@JsonPropertyOrder({"type", "children"})
	record MathNode(@JsonProperty("children") List<SyntacticAst> children) implements SyntacticAst {
		public MathNode {
			children = List.copyOf(children);
		}

		@Override
		public String type() {
			return "math";
		}
	}

	@JsonPropertyOrder({"type", "value"})
	record CharNode(@JsonProperty("value") String value) implements SyntacticAst {
		@Override
		public String type() {
			return "char";
		}
	}
}
