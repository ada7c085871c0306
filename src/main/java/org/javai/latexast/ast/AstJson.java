package org.javai.latexast.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Renders ASTs and processing results as JSON.
 */
public final class AstJson {

	private static final ObjectMapper mapper = new ObjectMapper();

	private AstJson() {}

	public static JsonNode toTree(Object value) {
		return mapper.valueToTree(value);
	}

	public static String toJson(Object value) {
		try {
			return mapper.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render JSON: " + e.getMessage(), e);
		}
	}

	public static String toPrettyJson(Object value) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render JSON: " + e.getMessage(), e);
		}
	}
}
