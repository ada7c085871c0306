package org.javai.latexast.vocabulary;

import java.io.InputStream;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The LaTeX vocabulary both parsers consult.
 * <p>
 * Instances are immutable. The bundled vocabulary is loaded once, on first use, and
 * shared by every parser in the process.
 *
 * @param functions function macros mapped to canonical function names ({@code \sin -> sin})
 * @param symbols symbol macros mapped to symbol names ({@code \alpha -> alpha})
 * @param spacing macros that only produce space and carry no meaning
 * @param macroArguments argument specs per macro; {@code '{'} is a mandatory argument,
 * {@code '['} an optional one
 * @param operatorMacros macros and characters classified as operators
 * @param functionMacros macros classified as functions
 */
public record LatexVocabulary(
		Map<String, String> functions,
		Map<String, String> symbols,
		Set<String> spacing,
		Map<String, String> macroArguments,
		Set<String> operatorMacros,
		Set<String> functionMacros) {

	public static final String STANDARD_RESOURCE = "META-INF/latex-vocabulary.yml";

	public LatexVocabulary {
		functions = Map.copyOf(functions);
		symbols = Map.copyOf(symbols);
		spacing = Set.copyOf(spacing);
		macroArguments = Map.copyOf(macroArguments);
		operatorMacros = Set.copyOf(operatorMacros);
		functionMacros = Set.copyOf(functionMacros);
	}

	/**
	 * The vocabulary bundled with this library.
	 *
	 * @throws VocabularyException if the bundled resource is missing or malformed
	 */
	public static LatexVocabulary standard() {
		return StandardHolder.INSTANCE;
	}

	public Optional<String> functionFor(String macro) {
		return Optional.ofNullable(functions.get(macro));
	}

	public Optional<String> symbolFor(String macro) {
		return Optional.ofNullable(symbols.get(macro));
	}

	public boolean isSpacing(String macro) {
		return spacing.contains(macro);
	}

	/**
	 * Argument spec for a macro; macros the vocabulary does not list take no arguments.
	 */
	public String argumentsOf(String macro) {
		return macroArguments.getOrDefault(macro, "");
	}

	/**
	 * @return {@code operator}, {@code function}, or empty when the macro is not classified
	 */
	public Optional<String> roleOf(String macro) {
		if (operatorMacros.contains(macro)) {
			return Optional.of("operator");
		}
		if (functionMacros.contains(macro)) {
			return Optional.of("function");
		}
		return Optional.empty();
	}

	private static final class StandardHolder {
		private static final LatexVocabulary INSTANCE = load();

		private static LatexVocabulary load() {
			try (InputStream is = LatexVocabulary.class.getClassLoader().getResourceAsStream(STANDARD_RESOURCE)) {
				if (is == null) {
					throw new VocabularyException("Resource not found: " + STANDARD_RESOURCE);
				}
				return new VocabularyParser().parse(is);
			}
			catch (VocabularyException e) {
				throw e;
			}
			catch (Exception e) {
				throw new VocabularyException("Failed to load vocabulary from resource: " + STANDARD_RESOURCE, e);
			}
		}
	}
}
