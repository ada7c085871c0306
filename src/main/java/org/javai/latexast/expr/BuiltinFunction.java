package org.javai.latexast.expr;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Functions the simplifier can evaluate numerically, keyed by canonical name.
 */
public enum BuiltinFunction {

	SIN("sin", 1, 1, a -> Math.sin(a[0])),
	COS("cos", 1, 1, a -> Math.cos(a[0])),
	TAN("tan", 1, 1, a -> Math.tan(a[0])),
	COT("cot", 1, 1, a -> 1.0 / Math.tan(a[0])),
	SEC("sec", 1, 1, a -> 1.0 / Math.cos(a[0])),
	CSC("csc", 1, 1, a -> 1.0 / Math.sin(a[0])),
	ASIN("asin", 1, 1, a -> Math.asin(a[0])),
	ACOS("acos", 1, 1, a -> Math.acos(a[0])),
	ATAN("atan", 1, 1, a -> Math.atan(a[0])),
	ACOT("acot", 1, 1, a -> Math.atan(1.0 / a[0])),
	SINH("sinh", 1, 1, a -> Math.sinh(a[0])),
	COSH("cosh", 1, 1, a -> Math.cosh(a[0])),
	TANH("tanh", 1, 1, a -> Math.tanh(a[0])),
	COTH("coth", 1, 1, a -> 1.0 / Math.tanh(a[0])),
	EXP("exp", 1, 1, a -> Math.exp(a[0])),
	LOG("log", 1, 2, a -> a.length == 1 ? Math.log(a[0]) : Math.log(a[0]) / Math.log(a[1])),
	ABS("Abs", 1, 1, a -> Math.abs(a[0])),
	FACTORIAL("factorial", 1, 1, a -> factorial(a[0]));

	private static final Map<String, BuiltinFunction> BY_NAME = Arrays.stream(values())
			.collect(Collectors.toUnmodifiableMap(BuiltinFunction::canonicalName, Function.identity()));

	private final String canonicalName;
	private final int minArity;
	private final int maxArity;
	private final Function<double[], Double> body;

	BuiltinFunction(String canonicalName, int minArity, int maxArity, Function<double[], Double> body) {
		this.canonicalName = canonicalName;
		this.minArity = minArity;
		this.maxArity = maxArity;
		this.body = body;
	}

	public static Optional<BuiltinFunction> forName(String name) {
		return Optional.ofNullable(BY_NAME.get(name));
	}

	public String canonicalName() {
		return canonicalName;
	}

	public boolean accepts(int arity) {
		return arity >= minArity && arity <= maxArity;
	}

	/**
	 * Applies the function.
	 *
	 * @throws SimplificationException if the arity is wrong or the result is not a finite number
	 */
	public double apply(double... args) {
		if (!accepts(args.length)) {
			throw new SimplificationException(canonicalName + " does not take " + args.length + " argument(s)");
		}
		double result = body.apply(args);
		if (!Double.isFinite(result)) {
			throw new SimplificationException(canonicalName + Arrays.toString(args) + " is not a finite number");
		}
		return result;
	}

	private static double factorial(double n) {
		if (n < 0 || n != Math.rint(n)) {
			throw new SimplificationException("factorial is only defined here for non-negative integers, got " + n);
		}
		double result = 1.0;
		for (int i = 2; i <= n && Double.isFinite(result); i++) {
			result *= i;
		}
		return result;
	}
}
