package nl.utwente.ewi.fmt.JANIGEN;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import nl.ennoruijters.util.JSONParser;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniBaseType;
import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniType;

class JaniUtilsTest
{
	@Test
	void parsesScalarTypeTags() {
		assertEquals(JaniType.of(JaniBaseType.BOOLEAN), JaniUtils.parseTypeTag("bool", 10));
		assertEquals(JaniType.of(JaniBaseType.BOOLEAN), JaniUtils.parseTypeTag("boolean", 10));
		assertEquals(JaniType.of(JaniBaseType.INTEGER), JaniUtils.parseTypeTag("int32", 10));
		assertEquals(JaniType.of(JaniBaseType.INTEGER), JaniUtils.parseTypeTag("uint8", 10));
		assertEquals(JaniType.of(JaniBaseType.INTEGER), JaniUtils.parseTypeTag("int", 10));
		assertEquals(JaniType.of(JaniBaseType.REAL), JaniUtils.parseTypeTag("float32", 10));
		assertEquals(JaniType.of(JaniBaseType.REAL), JaniUtils.parseTypeTag("double", 10));
		assertEquals(JaniType.of(JaniBaseType.REAL), JaniUtils.parseTypeTag(" real ", 10));
	}

	@Test
	void parsesArrayTypeTags() {
		JaniType t = JaniUtils.parseTypeTag("float64[]", 10);
		assertTrue(t.isArray());
		assertEquals(JaniBaseType.REAL, t.base);
		assertEquals(List.of(10), t.shape.maxSizes);

		t = JaniUtils.parseTypeTag("int16[5][]", 7);
		assertEquals(2, t.dimensions);
		assertEquals(List.of(5, 7), t.shape.maxSizes);
	}

	@Test
	void rejectsInvalidTypeTags() {
		for (String bad : List.of("bool8", "float", "double64", "int12", "string", "int32[x]", "Int32"))
			assertThrows(IllegalArgumentException.class, () -> JaniUtils.parseTypeTag(bad, 10), bad);
		assertThrows(ConfigurationException.class, () -> JaniUtils.parseTypeTag("int32[0]", 10));
	}

	@Test
	void parsesJaniTypes() {
		assertEquals(JaniType.of(JaniBaseType.INTEGER), JaniUtils.parseType("int"));
		JaniType bounded = JaniUtils.parseType(JSONParser.parse(
				"{\"kind\": \"bounded\", \"base\": \"int\", \"lower-bound\": 0, \"upper-bound\": 5}"));
		assertEquals(0L, bounded.minimum);
		assertEquals(5L, bounded.maximum);
		assertFalse(bounded.isArray());

		JaniType arr = JaniUtils.parseType(JSONParser.parse(
				"{\"kind\": \"array\", \"base\": {\"kind\": \"array\", \"base\": \"bool\"}}"));
		assertEquals(2, arr.dimensions);
		assertEquals(JaniBaseType.BOOLEAN, arr.base);
		assertNull(arr.shape);

		assertThrows(IllegalArgumentException.class, () -> JaniUtils.parseType("string"));
		assertThrows(IllegalArgumentException.class,
				() -> JaniUtils.parseType(JSONParser.parse("{\"kind\": \"clock\"}")));
	}

	@Test
	void convertsNumbersToIntegersExactly() {
		assertEquals(3, JaniUtils.safeToInteger(3L));
		assertEquals(4, JaniUtils.safeToInteger(4.0));
		assertThrows(ArithmeticException.class, () -> JaniUtils.safeToInteger(4.5));
		assertThrows(ArithmeticException.class, () -> JaniUtils.safeToInteger(1L << 40));
	}
}
