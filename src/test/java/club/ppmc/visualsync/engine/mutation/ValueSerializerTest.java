package club.ppmc.visualsync.engine.mutation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import club.ppmc.visualsync.model.value.BoolValue;
import club.ppmc.visualsync.model.value.ListValue;
import club.ppmc.visualsync.model.value.NumberValue;
import club.ppmc.visualsync.model.value.OpaqueExpression;
import club.ppmc.visualsync.model.value.StringValue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValueSerializerTest {

    @Test
    void plainWordsBecomeStringLiterals() {
        assertEquals("'hello world'", ValueSerializer.serialize("hello world"));
        assertEquals("''", ValueSerializer.serialize(""));
        assertEquals("'red'", ValueSerializer.serialize(new StringValue("red")));
    }

    @Test
    void codeLikeStringsAreEmittedVerbatim() {
        assertEquals("Colors.blue", ValueSerializer.serialize("Colors.blue"));
        assertEquals("EdgeInsets.all(8)", ValueSerializer.serialize("EdgeInsets.all(8)"));
        assertEquals("TextStyle()", ValueSerializer.serialize("TextStyle()"));
        assertEquals("8", ValueSerializer.serialize("8"));
        assertEquals("-1.5", ValueSerializer.serialize("-1.5"));
        // 大写开头的普通文本同样被当成代码
        assertEquals("Hello", ValueSerializer.serialize("Hello"));
    }

    @Test
    void quoteEscapesSpecialCharacters() {
        assertEquals("'it\\'s'", ValueSerializer.quote("it's"));
        assertEquals("'a\\\\b'", ValueSerializer.quote("a\\b"));
        assertEquals("'\\$name'", ValueSerializer.quote("$name"));
        assertEquals("'one\\ntwo\\t'", ValueSerializer.quote("one\ntwo\t"));
        assertEquals("'Hello'", ValueSerializer.quote("Hello"));
    }

    @Test
    void quoteTemplateKeepsInterpolation() {
        assertEquals("'Hi $name, ${items.length}'", ValueSerializer.quoteTemplate("Hi $name, ${items.length}"));
        assertEquals("'it\\'s $name'", ValueSerializer.quoteTemplate("it's $name"));
    }

    @Test
    void primitivesAndTypedValues() {
        assertEquals("null", ValueSerializer.serialize(null));
        assertEquals("42", ValueSerializer.serialize(42));
        assertEquals("true", ValueSerializer.serialize(Boolean.TRUE));
        assertEquals("2.5", ValueSerializer.serialize(new NumberValue(2.5)));
        assertEquals("false", ValueSerializer.serialize(new BoolValue(false)));
        assertEquals("Colors.red", ValueSerializer.serialize(new OpaqueExpression("Colors.red")));
    }

    @Test
    void listsSerializeElementWise() {
        assertEquals("[1, 'a', Icons.add]", ValueSerializer.serialize(List.of(1, "a", "Icons.add")));
        assertEquals("[1, 'b']",
                ValueSerializer.serialize(new ListValue(List.of(new NumberValue(1L), new StringValue("b")))));
    }

    @Test
    void insetsMapsBecomeEdgeInsets() {
        assertEquals("EdgeInsets.all(16)", ValueSerializer.serialize(Map.of("all", 16)));

        var only = new LinkedHashMap<String, Object>();
        only.put("top", 4);
        only.put("left", 2);
        assertEquals("EdgeInsets.only(top: 4, bottom: 0, left: 2, right: 0)", ValueSerializer.serialize(only));

        var other = new LinkedHashMap<String, Object>();
        other.put("width", 10);
        other.put("label", "x");
        assertEquals("{width: 10, label: 'x'}", ValueSerializer.serialize(other));
    }

    @Test
    void placeholdersCannotBeSerialized() {
        assertTrue(ValueSerializer.isPlaceholder(OpaqueExpression.construct("Text")));
        assertTrue(ValueSerializer.isPlaceholder(OpaqueExpression.FUNCTION));
        assertFalse(ValueSerializer.isPlaceholder(new OpaqueExpression("a < b")));

        assertThrows(IllegalArgumentException.class,
                () -> ValueSerializer.serialize(OpaqueExpression.CONDITIONAL));
        assertThrows(IllegalArgumentException.class,
                () -> ValueSerializer.serialize(new ListValue(List.of(OpaqueExpression.construct("Icon")))));
    }

    @Test
    void textDetection() {
        assertTrue(ValueSerializer.isText("x"));
        assertTrue(ValueSerializer.isText(new StringValue("x")));
        assertFalse(ValueSerializer.isText(3));
        assertEquals("x", ValueSerializer.textOf(new StringValue("x")));
    }
}
