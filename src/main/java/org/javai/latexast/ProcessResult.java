package org.javai.latexast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import org.javai.latexast.ast.SemanticAst;
import org.javai.latexast.ast.SyntacticAst;

/**
 * Result of processing one LaTeX string. The {@code mode} field tells which AST shape
 * {@code ast} holds.
 */
public sealed interface ProcessResult {

	@JsonProperty("mode")
	String mode();

	@JsonProperty("final_result")
	String finalResult();

	/**
	 * The input was a mathematical expression.
	 *
	 * @param steps reported steps, or {@code null} when steps were not requested
	 * @param finalResult the last step the evaluator reached, even when {@code steps} is truncated
	 */
	@JsonPropertyOrder({"mode", "ast", "steps", "final_result"})
	record Semantic(
			@JsonProperty("ast") SemanticAst ast,
			@JsonProperty("steps") @JsonInclude(JsonInclude.Include.NON_NULL) List<String> steps,
			@JsonProperty("final_result") String finalResult) implements ProcessResult {

		public Semantic {
			steps = steps == null ? null : List.copyOf(steps);
		}

		@Override
		public String mode() {
			return "semantic";
		}
	}

	/**
	 * The input was only recognised as LaTeX structure. There are never any steps, and the
	 * final result is the input itself.
	 *
	 * @param error why the semantic parse failed
	 */
	@JsonPropertyOrder({"mode", "ast", "steps", "final_result", "error"})
	record Syntactic(
			@JsonProperty("ast") SyntacticAst.Root ast,
			@JsonProperty("final_result") String finalResult,
			@JsonProperty("error") @JsonInclude(JsonInclude.Include.NON_NULL) String error) implements ProcessResult {

		@Override
		public String mode() {
			return "syntactic";
		}

		@JsonProperty("steps")
		public List<String> steps() {
			return List.of();
		}
	}
}
