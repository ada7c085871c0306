package org.javai.latexast.ast;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;

/**
 * Public shape of a semantic parse. Every node carries a {@code type} discriminant:
 * {@code number}, {@code symbol}, {@code add}, {@code mul}, {@code pow}, {@code func} or
 * {@code unknown}.
 */
public sealed interface SemanticAst {

	@JsonProperty("type")
	String type();

	@JsonPropertyOrder({"type", "value"})
	record NumberNode(@JsonProperty("value") double value) implements SemanticAst {
		@Override
		public String type() {
			return "number";
		}
	}

	@JsonPropertyOrder({"type", "name"})
	record SymbolNode(@JsonProperty("name") String name) implements SemanticAst {
		@Override
		public String type() {
			return "symbol";
		}
	}

	/**
	 * A sum or product; {@code args} keep the order the parser produced.
	 */
	@JsonPropertyOrder({"type", "args"})
	record OperatorNode(@JsonIgnore Operator operator, @JsonProperty("args") List<SemanticAst> args)
			implements SemanticAst {
		public OperatorNode {
			Objects.requireNonNull(operator, "operator must not be null");
			args = List.copyOf(args);
		}

		@Override
		public String type() {
			return operator.label();
		}
	}

	/**
	 * Exponentiation keeps its operands apart rather than in an argument list.
	 */
	@JsonPropertyOrder({"type", "base", "exp"})
	record PowNode(@JsonProperty("base") SemanticAst base, @JsonProperty("exp") SemanticAst exponent)
			implements SemanticAst {
		@Override
		public String type() {
			return "pow";
		}
	}

	@JsonPropertyOrder({"type", "name", "args"})
	record FunctionNode(@JsonProperty("name") String name, @JsonProperty("args") List<SemanticAst> args)
			implements SemanticAst {
		public FunctionNode {
			args = List.copyOf(args);
		}

		@Override
		public String type() {
			return "func";
		}
	}

	/**
	 * Opaque node; consumers must not try to look inside {@code repr}.
	 */
	@JsonPropertyOrder({"type", "repr"})
	record UnknownNode(@JsonProperty("repr") String repr) implements SemanticAst {
		@Override
		public String type() {
			return "unknown";
		}
	}

	enum Operator {
		ADD("add"),
		MUL("mul");

		private final String label;

		Operator(String label) {
			this.label = label;
		}

		public String label() {
			return label;
		}
	}
}
