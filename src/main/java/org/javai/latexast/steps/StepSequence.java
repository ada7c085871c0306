package org.javai.latexast.steps;

import java.util.List;

/**
 * Ordered snapshots of an expression as it is reduced, in text form.
 * The last snapshot is the furthest the evaluator got.
 */
public record StepSequence(List<String> steps) {

	public StepSequence {
		steps = List.copyOf(steps);
		if (steps.isEmpty()) {
			throw new IllegalArgumentException("A step sequence has at least one step");
		}
	}

	public String finalStep() {
		return steps.get(steps.size() - 1);
	}

	public int size() {
		return steps.size();
	}

	/**
	 * The first {@code maxSteps} steps; a negative value means all of them.
	 */
	public List<String> firstSteps(int maxSteps) {
		if (maxSteps < 0 || maxSteps >= steps.size()) {
			return steps;
		}
		return steps.subList(0, maxSteps);
	}
}
