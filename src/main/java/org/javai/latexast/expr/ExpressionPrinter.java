package org.javai.latexast.expr;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an {@link Expression} in its canonical text form.
 * <p>
 * The text form is what step sequences are made of, and it is read back by
 * {@link ExpressionReader}. Both sides agree on these rules:
 * <ul>
 * <li>numbers use {@link Double#toString(double)}</li>
 * <li>sums join terms with {@code " + "}, a term carrying a negative leading number is
 * written with {@code " - "} and the number's magnitude</li>
 * <li>products join factors with {@code "*"}; a product led by {@code -1.0} is written
 * as a bare minus sign when the next factor is not a number</li>
 * <li>powers are written {@code base**exponent}</li>
 * <li>sums and products with fewer than two arguments are written in call form,
 * {@code Add(...)} and {@code Mul(...)}</li>
 * </ul>
 */
public final class ExpressionPrinter implements ExpressionVisitor<String> {

	private static final ExpressionPrinter INSTANCE = new ExpressionPrinter();

	private ExpressionPrinter() {
	}

	public static String print(Expression expression) {
		return expression.accept(INSTANCE);
	}

	@Override
	public String visitNumber(Expression.Number number) {
		return Double.toString(number.value());
	}

	@Override
	public String visitSymbol(Expression.Symbol symbol) {
		return symbol.name();
	}

	@Override
	public String visitAdd(Expression.Add add) {
		List<Expression> args = add.args();
		if (args.size() < 2) {
			return callForm("Add", args);
		}
		StringBuilder sb = new StringBuilder(leadingTerm(args.get(0)));
		for (Expression term : args.subList(1, args.size())) {
			appendTerm(sb, term);
		}
		return sb.toString();
	}

	@Override
	public String visitMul(Expression.Mul mul) {
		List<Expression> args = mul.args();
		if (args.size() < 2) {
			return callForm("Mul", args);
		}
		if (isMinusOne(args.get(0)) && !(args.get(1) instanceof Expression.Number)) {
			return "-" + factors(args.subList(1, args.size()));
		}
		return factors(args);
	}

	@Override
	public String visitPow(Expression.Pow pow) {
		return base(pow.base()) + "**" + exponent(pow.exponent());
	}

	@Override
	public String visitFunctionCall(Expression.FunctionCall call) {
		return callForm(call.name(), call.args());
	}

	@Override
	public String visitUnknown(Expression.Unknown unknown) {
		return unknown.text();
	}

	private String leadingTerm(Expression term) {
		if (term instanceof Expression.Add || term instanceof Expression.Unknown) {
			return parenthesize(term);
		}
		return print(term);
	}

	private void appendTerm(StringBuilder sb, Expression term) {
		if (term instanceof Expression.Number n && isNegative(n.value())) {
			sb.append(" - ").append(Double.toString(-n.value()));
			return;
		}
		if (term instanceof Expression.Mul m && m.args().size() >= 2
				&& m.args().get(0) instanceof Expression.Number lead && isNegative(lead.value())) {
			List<Expression> rest = m.args().subList(1, m.args().size());
			if (lead.value() == -1.0 && !(rest.get(0) instanceof Expression.Number)) {
				sb.append(" - ").append(factors(rest));
			}
			else {
				sb.append(" - ").append(Double.toString(-lead.value())).append('*').append(factors(rest));
			}
			return;
		}
		sb.append(" + ").append(leadingTerm(term));
	}

	private String factors(List<Expression> factors) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < factors.size(); i++) {
			Expression factor = factors.get(i);
			if (i > 0) {
				sb.append('*');
			}
			if (factor instanceof Expression.Add
					|| factor instanceof Expression.Mul
					|| factor instanceof Expression.Unknown
					|| (i > 0 && factor instanceof Expression.Number n && isNegative(n.value()))) {
				sb.append(parenthesize(factor));
			}
			else {
				sb.append(print(factor));
			}
		}
		return sb.toString();
	}

	private String base(Expression base) {
		if (base instanceof Expression.Symbol || base instanceof Expression.FunctionCall) {
			return print(base);
		}
		if (base instanceof Expression.Number n && !isNegative(n.value())) {
			return print(base);
		}
		return parenthesize(base);
	}

	private String exponent(Expression exponent) {
		return base(exponent);
	}

	private String callForm(String name, List<Expression> args) {
		return args.stream()
				.map(ExpressionPrinter::print)
				.collect(Collectors.joining(", ", name + "(", ")"));
	}

	private String parenthesize(Expression expression) {
		return "(" + print(expression) + ")";
	}

	private static boolean isMinusOne(Expression expression) {
		return expression instanceof Expression.Number n && n.value() == -1.0;
	}

	static boolean isNegative(double value) {
		return Math.copySign(1.0, value) < 0;
	}
}
