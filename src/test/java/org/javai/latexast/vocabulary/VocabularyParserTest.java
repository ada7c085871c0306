package org.javai.latexast.vocabulary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VocabularyParserTest {

	private final VocabularyParser parser = new VocabularyParser();

	private LatexVocabulary loadResource(String resourceName) throws Exception {
		try (InputStream stream = getClass().getClassLoader().getResourceAsStream(resourceName)) {
			if (stream == null) {
				throw new IllegalStateException("Could not load vocabulary resource: " + resourceName);
			}
			return parser.parse(stream);
		}
	}

	@Test
	void parsesEverySection() throws Exception {
		LatexVocabulary vocabulary = loadResource("vocabulary/test-vocabulary.yml");

		assertThat(vocabulary.functionFor("\\sgn")).contains("sign");
		assertThat(vocabulary.symbolFor("\\hbar")).contains("hbar");
		assertThat(vocabulary.isSpacing("\\,")).isTrue();
		assertThat(vocabulary.argumentsOf("\\pair")).isEqualTo("[{");
		assertThat(vocabulary.argumentsOf("\\unknown")).isEmpty();
		assertThat(vocabulary.roleOf("\\times")).contains("operator");
		assertThat(vocabulary.roleOf("\\frac")).contains("function");
		assertThat(vocabulary.roleOf("\\pi")).isEmpty();
	}

	@Test
	void missingSectionsAreEmpty() {
		LatexVocabulary vocabulary = parser.parseString("symbols:\n  '\\pi': pi\n");

		assertThat(vocabulary.functions()).isEmpty();
		assertThat(vocabulary.spacing()).isEmpty();
		assertThat(vocabulary.symbolFor("\\pi")).contains("pi");
	}

	@Test
	void parsesFromPath(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("vocabulary.yml");
		Files.writeString(file, "functions:\n  '\\cos': cos\n");

		assertThat(parser.parse(file).functionFor("\\cos")).contains("cos");
	}

	@Test
	void rejectsInvalidArgumentSpec() {
		assertThatThrownBy(() -> parser.parseString("macro_arguments:\n  '\\frac': '{('\n"))
				.isInstanceOf(VocabularyException.class)
				.hasMessageContaining("Invalid argument spec");
	}

	@Test
	void rejectsMalformedDocuments() {
		assertThatThrownBy(() -> parser.parseString(""))
				.isInstanceOf(VocabularyException.class)
				.hasMessageContaining("empty");
		assertThatThrownBy(() -> parser.parseString("- a\n- b\n"))
				.isInstanceOf(VocabularyException.class)
				.hasMessageContaining("must be a mapping");
		assertThatThrownBy(() -> parser.parseString("spacing: '\\,'\n"))
				.isInstanceOf(VocabularyException.class)
				.hasMessageContaining("must be a list");
		assertThatThrownBy(() -> parser.parseString("functions: [a, b]\n"))
				.isInstanceOf(VocabularyException.class);
	}

	@Test
	void missingFileIsReportedWithItsPath(@TempDir Path dir) {
		Path missing = dir.resolve("absent.yml");

		assertThatThrownBy(() -> parser.parse(missing))
				.isInstanceOf(VocabularyException.class)
				.hasMessageContaining("absent.yml");
	}

	@Test
	void bundledVocabularyKnowsCommonMacros() {
		LatexVocabulary standard = LatexVocabulary.standard();

		assertThat(standard.functionFor("\\ln")).contains("log");
		assertThat(standard.functionFor("\\arcsin")).contains("asin");
		assertThat(standard.symbolFor("\\alpha")).contains("alpha");
		assertThat(standard.argumentsOf("\\sqrt")).isEqualTo("[{");
		assertThat(standard.roleOf("\\leq")).contains("operator");
		assertThat(LatexVocabulary.standard()).isSameAs(standard);
	}
}
