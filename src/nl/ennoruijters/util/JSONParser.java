package nl.ennoruijters.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal JSON reader. Objects are returned as insertion-ordered
 * {@link LinkedHashMap}s, arrays as {@link List}s, integral numbers as
 * {@link Long} and all other numbers as {@link Double}.
 */
public class JSONParser
{
	private static final Pattern NUMBER
		= Pattern.compile("-?(0|[1-9]\\d*)(\\.\\d+)?([eE][+-]?\\d+)?");
	private static final Pattern INTEGER
		= Pattern.compile("-?(0|[1-9]\\d*)");

	private final String data;
	private int pos;

	private JSONParser(String data) {
		this.data = data;
	}

	private char peek() {
		if (pos >= data.length())
			throw new IllegalArgumentException("Not JSON: unexpected end of input");
		return data.charAt(pos);
	}

	private void skipWhiteSpace() {
		while (pos < data.length()) {
			char c = data.charAt(pos);
			if (c != ' ' && c != '\t' && c != '\n' && c != '\r')
				return;
			pos++;
		}
	}

	private void expect(char c) {
		if (peek() != c)
			throw error("expected '" + c + "'");
		pos++;
	}

	private IllegalArgumentException error(String what) {
		int end = Math.min(data.length(), pos + 20);
		return new IllegalArgumentException("Not JSON (" + what + ") at offset " + pos + ": " + data.substring(pos, end));
	}

	private Map<String, Object> parseObject() {
		LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
		pos++; /* Skip the opening brace */
		skipWhiteSpace();
		if (peek() == '}') {
			pos++;
			return ret;
		}
		while (true) {
			skipWhiteSpace();
			if (peek() != '"')
				throw error("object key should be a string");
			String key = parseString();
			skipWhiteSpace();
			expect(':');
			skipWhiteSpace();
			if (ret.containsKey(key))
				throw error("duplicate key '" + key + "'");
			ret.put(key, parseValue());
			skipWhiteSpace();
			char c = peek();
			pos++;
			if (c == '}')
				return ret;
			if (c != ',')
				throw error("expected ',' or '}'");
		}
	}

	private List<Object> parseArray() {
		ArrayList<Object> ret = new ArrayList<>();
		pos++; /* Skip the opening bracket */
		skipWhiteSpace();
		if (peek() == ']') {
			pos++;
			return ret;
		}
		while (true) {
			skipWhiteSpace();
			ret.add(parseValue());
			skipWhiteSpace();
			char c = peek();
			pos++;
			if (c == ']')
				return ret;
			if (c != ',')
				throw error("expected ',' or ']'");
		}
	}

	private String parseString() {
		StringBuilder ret = new StringBuilder();
		pos++; /* Skip the opening quotation mark */
		char c;
		while ((c = peek()) != '"') {
			pos++;
			if (c != '\\') {
				ret.append(c);
				continue;
			}
			char escaped = peek();
			pos++;
			switch (escaped) {
			case '\\':
			case '"':
			case '/':
				ret.append(escaped);
				break;
			case 'b':
				ret.append('\b');
				break;
			case 'f':
				ret.append('\f');
				break;
			case 'n':
				ret.append('\n');
				break;
			case 'r':
				ret.append('\r');
				break;
			case 't':
				ret.append('\t');
				break;
			case 'u':
				if (pos + 4 > data.length())
					throw error("truncated unicode escape");
				try {
					ret.append((char)Integer.parseInt(data.substring(pos, pos + 4), 16));
				} catch (NumberFormatException e) {
					throw error("invalid unicode escape");
				}
				pos += 4;
				break;
			default:
				throw error("invalid escape '\\" + escaped + "'");
			}
		}
		pos++; /* Skip trailing quotation mark */
		return ret.toString();
	}

	private Number parseNumber() {
		Matcher m = NUMBER.matcher(data);
		m.region(pos, data.length());
		if (!m.lookingAt())
			throw error("number");
		String nr = m.group();
		pos = m.end();
		if (INTEGER.matcher(nr).matches()) {
			try {
				return Long.valueOf(nr);
			} catch (NumberFormatException e) {
				throw error("integer out of range: " + nr);
			}
		}
		return Double.valueOf(nr);
	}

	private boolean consumeKeyword(String word) {
		if (!data.startsWith(word, pos))
			return false;
		pos += word.length();
		return true;
	}

	private Object parseValue() {
		char c = peek();
		if (c == '{')
			return parseObject();
		if (c == '[')
			return parseArray();
		if (c == '"')
			return parseString();
		if (consumeKeyword("true"))
			return Boolean.TRUE;
		if (consumeKeyword("false"))
			return Boolean.FALSE;
		if (consumeKeyword("null"))
			return null;
		return parseNumber();
	}

	/** Parse a complete JSON document. */
	public static Object parse(String text) throws IllegalArgumentException
	{
		JSONParser p = new JSONParser(text);
		p.skipWhiteSpace();
		Object ret = p.parseValue();
		p.skipWhiteSpace();
		if (p.pos != text.length())
			throw p.error("trailing data");
		return ret;
	}

	public static Object parse(byte[] toParse) throws IllegalArgumentException
	{
		return parse(new String(toParse, StandardCharsets.UTF_8));
	}

	public static Object readJsonFromFile(String file) throws IOException
	{
		return parse(Files.readAllBytes(Paths.get(file)));
	}
}
