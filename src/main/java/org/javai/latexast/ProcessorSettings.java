package org.javai.latexast;

import java.io.InputStream;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Limits applied to every request.
 * <p>
 * Settings are read from {@code META-INF/latex-ast.yml} when that resource is on the
 * classpath:
 * <pre>
 * max_depth: 200
 * max_input_length: 10000
 * </pre>
 * Keys that are absent keep their defaults.
 *
 * @param maxDepth deepest nesting the parsers and the evaluator accept
 * @param maxInputLength longest input string accepted, in characters
 */
public record ProcessorSettings(int maxDepth, int maxInputLength) {

	private static final Logger logger = LoggerFactory.getLogger(ProcessorSettings.class);

	public static final int DEFAULT_MAX_DEPTH = 200;
	public static final int DEFAULT_MAX_INPUT_LENGTH = 10_000;
	public static final String RESOURCE = "META-INF/latex-ast.yml";

	public ProcessorSettings {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
		}
		if (maxInputLength < 1) {
			throw new IllegalArgumentException("maxInputLength must be positive, got " + maxInputLength);
		}
	}

	public static ProcessorSettings defaults() {
		return new ProcessorSettings(DEFAULT_MAX_DEPTH, DEFAULT_MAX_INPUT_LENGTH);
	}

	/**
	 * Settings from {@link #RESOURCE} on this class' loader, or the defaults if there is none.
	 */
	public static ProcessorSettings load() {
		return load(ProcessorSettings.class.getClassLoader());
	}

	/**
	 * Settings from {@link #RESOURCE} on the given loader, or the defaults if there is none.
	 *
	 * @throws IllegalStateException if the resource exists but cannot be read
	 */
	public static ProcessorSettings load(ClassLoader loader) {
		try (InputStream is = loader.getResourceAsStream(RESOURCE)) {
			if (is == null) {
				logger.debug("No {} on the classpath; using default settings", RESOURCE);
				return defaults();
			}
			return fromYaml(is);
		} catch (IllegalArgumentException | IllegalStateException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load settings from resource: " + RESOURCE, e);
		}
	}

	/**
	 * @throws IllegalArgumentException if a value is not a positive integer
	 */
	public static ProcessorSettings fromYaml(InputStream inputStream) {
		Object document = new Yaml().load(inputStream);
		if (document == null) {
			return defaults();
		}
		if (!(document instanceof Map<?, ?> data)) {
			throw new IllegalArgumentException("Settings document must be a mapping");
		}
		return new ProcessorSettings(
				intValue(data, "max_depth", DEFAULT_MAX_DEPTH),
				intValue(data, "max_input_length", DEFAULT_MAX_INPUT_LENGTH));
	}

	private static int intValue(Map<?, ?> data, String key, int defaultValue) {
		Object value = data.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Integer i) {
			return i;
		}
		throw new IllegalArgumentException("Setting '" + key + "' must be an integer, got: " + value);
	}
}
