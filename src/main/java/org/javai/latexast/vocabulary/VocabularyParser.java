package org.javai.latexast.vocabulary;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for vocabulary YAML files.
 * <p>
 * Expected layout:
 * <pre>
 * functions:          # macro -> canonical function name
 *   '\sin': sin
 * symbols:            # macro -> symbol name
 *   '\alpha': alpha
 * spacing: ['\,', '\quad']
 * macro_arguments:    # macro -> argument spec
 *   '\frac': '{{'
 * roles:
 *   operator: ['+', '\times']
 *   function: ['\sin', '\frac']
 * </pre>
 * Every section is optional; a missing section is empty.
 */
public class VocabularyParser {

	private static final Logger logger = LoggerFactory.getLogger(VocabularyParser.class);

	private final Yaml yaml = new Yaml();

	/**
	 * Parse a vocabulary YAML file from a path.
	 */
	public LatexVocabulary parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (VocabularyException e) {
			throw e;
		} catch (Exception e) {
			throw new VocabularyException("Failed to parse vocabulary from path: " + path, e);
		}
	}

	/**
	 * Parse a vocabulary YAML document from an input stream.
	 */
	public LatexVocabulary parse(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (VocabularyException e) {
			throw e;
		} catch (Exception e) {
			throw new VocabularyException("Failed to parse vocabulary from input stream", e);
		}
	}

	/**
	 * Parse a vocabulary YAML document from a reader.
	 */
	public LatexVocabulary parse(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (VocabularyException e) {
			throw e;
		} catch (Exception e) {
			throw new VocabularyException("Failed to parse vocabulary from reader", e);
		}
	}

	/**
	 * Parse a vocabulary YAML document from a string.
	 */
	public LatexVocabulary parseString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (VocabularyException e) {
			throw e;
		} catch (Exception e) {
			throw new VocabularyException("Failed to parse vocabulary from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private LatexVocabulary build(Object document) {
		if (document == null) {
			throw new VocabularyException("Vocabulary document is empty");
		}
		if (!(document instanceof Map<?, ?>)) {
			throw new VocabularyException("Vocabulary document must be a mapping, found: "
					+ document.getClass().getSimpleName());
		}
		Map<String, Object> data = (Map<String, Object>) document;

		Map<String, Object> roles = section(data, "roles");
		LatexVocabulary vocabulary = new LatexVocabulary(
				stringMap(data, "functions"),
				stringMap(data, "symbols"),
				stringSet(data, "spacing"),
				argumentSpecs(data),
				stringSet(roles, "operator"),
				stringSet(roles, "function"));
		logger.debug("Loaded vocabulary with {} functions, {} symbols and {} macro argument specs",
				vocabulary.functions().size(), vocabulary.symbols().size(), vocabulary.macroArguments().size());
		return vocabulary;
	}

	private Map<String, String> argumentSpecs(Map<String, Object> data) {
		Map<String, String> specs = stringMap(data, "macro_arguments");
		specs.forEach((macro, spec) -> {
			for (char c : spec.toCharArray()) {
				if (c != '{' && c != '[') {
					throw new VocabularyException("Invalid argument spec '" + spec + "' for macro " + macro
							+ ": only '{' and '[' are allowed");
				}
			}
		});
		return specs;
	}

	@SuppressWarnings("unchecked")
	private Map<String, Object> section(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map<?, ?>)) {
			throw new VocabularyException("Section '" + key + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private Map<String, String> stringMap(Map<String, Object> data, String key) {
		Map<String, String> result = new LinkedHashMap<>();
		section(data, key).forEach((name, value) -> {
			if (value == null) {
				throw new VocabularyException("Missing value for '" + name + "' in section '" + key + "'");
			}
			result.put(name, String.valueOf(value));
		});
		return result;
	}

	private Set<String> stringSet(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value == null) {
			return Set.of();
		}
		if (!(value instanceof List<?> list)) {
			throw new VocabularyException("Section '" + key + "' must be a list");
		}
		List<String> items = new ArrayList<>(list.size());
		for (Object item : list) {
			items.add(String.valueOf(item));
		}
		return new LinkedHashSet<>(items);
	}
}
