package org.ontodsl.compiler.backend.cypher;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Quoting helpers for generated Cypher.
 */
public final class CypherText {

	private static final Pattern PLAIN_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	private CypherText() {}

	/**
	 * @param value A string value.
	 * @return The value as a single-quoted Cypher string literal.
	 */
	public static String quote(String value) {
		return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
	}

	/**
	 * @param value A URL or path.
	 * @return The value as a double-quoted Cypher string literal.
	 */
	public static String doubleQuote(String value) {
		return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
	}

	/**
	 * Renders a label, property key or variable name. DSL identifiers may contain {@code -},
	 * which Cypher only accepts inside backticks.
	 *
	 * @param name The name.
	 * @return The name, backtick-quoted if needed.
	 */
	public static String name(String name) {
		if (PLAIN_NAME.matcher(name).matches()) {
			return name;
		}
		return "`" + name.replace("`", "``") + "`";
	}

	/**
	 * @param alias An alias.
	 * @return A relationship type derived from the alias: upper case, non-word characters as {@code _}.
	 */
	public static String relationshipSuffix(String alias) {
		return alias.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9_]", "_");
	}

	/**
	 * @param text Free text.
	 * @return The text on one line, for use in a {@code //} comment.
	 */
	public static String commentText(String text) {
		return text.replaceAll("[\\r\\n]+", " ");
	}

	/**
	 * Renders a multi-line map literal, one {@code key: value} entry per line.
	 *
	 * @param entries The rendered entries.
	 * @return {@code {\n  e1,\n  e2\n}}
	 */
	public static String propertyMap(List<String> entries) {
		return "{\n  " + String.join(",\n  ", entries) + "\n}";
	}

	/**
	 * @param key   A property key.
	 * @param value A rendered value.
	 * @return {@code key: value}
	 */
	public static String entry(String key, String value) {
		return name(key) + ": " + value;
	}
}
