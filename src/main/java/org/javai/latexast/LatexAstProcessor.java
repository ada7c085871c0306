package org.javai.latexast;

import java.util.List;
import java.util.Objects;
import org.javai.latexast.ast.AstNormalizer;
import org.javai.latexast.expr.Simplifier;
import org.javai.latexast.parse.LatexExpressionParser;
import org.javai.latexast.parse.SemanticParseResult;
import org.javai.latexast.steps.StepEvaluator;
import org.javai.latexast.steps.StepSequence;
import org.javai.latexast.tokens.LatexSyntaxException;
import org.javai.latexast.tokens.LatexWalker;
import org.javai.latexast.tokens.TokenNode;
import org.javai.latexast.tokens.TokenWalker;
import org.javai.latexast.vocabulary.LatexVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: turns a LaTeX string into a semantic or a syntactic result.
 * <p>
 * The semantic parser is tried first. When it fails, the input is walked as plain LaTeX
 * structure instead and the semantic failure is reported in the result's {@code error}
 * field rather than thrown. Only malformed structure ({@link LatexSyntaxException}) and
 * exceeded limits ({@link ResourceLimitExceededException}) reach the caller.
 * <p>
 * Instances hold no per-request state and may be shared between threads.
 */
public class LatexAstProcessor {

	private static final Logger logger = LoggerFactory.getLogger(LatexAstProcessor.class);

	/** Step limit meaning "report every step". */
	public static final int ALL_STEPS = -1;

	private final ProcessorSettings settings;
	private final LatexExpressionParser parser;
	private final TokenWalker tokenWalker;
	private final AstNormalizer normalizer;
	private final StepEvaluator evaluator;

	public LatexAstProcessor() {
		this(ProcessorSettings.load(), LatexVocabulary.standard());
	}

	public LatexAstProcessor(ProcessorSettings settings, LatexVocabulary vocabulary) {
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
		Objects.requireNonNull(vocabulary, "vocabulary must not be null");
		this.parser = new LatexExpressionParser(vocabulary, settings.maxDepth());
		this.tokenWalker = new TokenWalker(new LatexWalker(vocabulary, settings.maxDepth()));
		this.normalizer = new AstNormalizer(vocabulary);
		this.evaluator = new StepEvaluator(new Simplifier(), settings.maxDepth());
	}

	public ProcessorSettings settings() {
		return settings;
	}

	/**
	 * Processes one LaTeX string.
	 *
	 * @param wantSteps whether a semantic result lists its evaluation steps
	 * @throws LatexSyntaxException if the input is neither an expression nor well-formed LaTeX
	 * @throws ResourceLimitExceededException if the input is too long or too deeply nested
	 */
	public ProcessResult process(String latex, boolean wantSteps) {
		return process(latex, wantSteps, ALL_STEPS);
	}

	/**
	 * Processes one LaTeX string, reporting at most {@code maxSteps} steps.
	 * A negative limit reports all of them. The final result is always the last step
	 * the evaluator reached, reported or not.
	 *
	 * @throws LatexSyntaxException if the input is neither an expression nor well-formed LaTeX
	 * @throws ResourceLimitExceededException if the input is too long or too deeply nested
	 */
	public ProcessResult process(String latex, int maxSteps) {
		return process(latex, true, maxSteps);
	}

	/**
	 * Recognises a formula image and processes the LaTeX it yields.
	 *
	 * @throws RecognitionException if the recognizer cannot read the image
	 * @throws LatexSyntaxException if the recognised text is not well-formed LaTeX
	 */
	public ProcessResult processImage(FormulaRecognizer recognizer, byte[] image, int maxSteps) {
		Objects.requireNonNull(recognizer, "recognizer must not be null");
		Objects.requireNonNull(image, "image must not be null");
		String latex = recognizer.recognize(image);
		logger.debug("Recognised {} image bytes as: {}", image.length, latex);
		return process(latex, maxSteps);
	}

	private ProcessResult process(String latex, boolean wantSteps, int maxSteps) {
		String input = latex == null ? "" : latex;
		if (input.length() > settings.maxInputLength()) {
			throw new ResourceLimitExceededException("input length", settings.maxInputLength());
		}

		SemanticParseResult parsed = parser.parse(input);
		if (parsed instanceof SemanticParseResult.Parsed success) {
			StepSequence steps = evaluator.evaluate(success.expression());
			List<String> reported = wantSteps ? steps.firstSteps(maxSteps) : null;
			logger.debug("Parsed '{}' semantically; {} step(s), final result {}", input, steps.size(),
					steps.finalStep());
			return new ProcessResult.Semantic(normalizer.semantic(success.expression()), reported,
					steps.finalStep());
		}

		SemanticParseResult.Failed failure = (SemanticParseResult.Failed) parsed;
		logger.debug("Semantic parse of '{}' failed, falling back to token walk: {}", input, failure);
		List<TokenNode> tokens = tokenWalker.parseTokens(input);
		return new ProcessResult.Syntactic(normalizer.syntactic(tokens), input, failure.message());
	}
}
