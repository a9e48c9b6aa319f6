/**
 * ValueSerializer.java
 *
 * 把属性值序列化为源代码文本。
 *
 * 字符串采用启发式规则区分 "字面量" 与 "代码表达式"：以大写字母开头、包含 '.' 或本身是数字字面量的字符串
 * 原样输出为代码 (如 Colors.blue、EdgeInsets.all(8)、8)，其余字符串输出为单引号字面量。
 * 没有类型信息可供参考，这只是启发式规则，并不保证符合调用方的意图。
 * 替换已有参数时 StructuralMutator 会参考原值：原值是字符串字面量时，新的字符串值直接用 quote() 输出，
 * 原值是插值字符串时用 quoteTemplate() 输出。
 */
package club.ppmc.visualsync.engine.mutation;

import club.ppmc.visualsync.model.value.AttributeValue;
import club.ppmc.visualsync.model.value.BoolValue;
import club.ppmc.visualsync.model.value.ListValue;
import club.ppmc.visualsync.model.value.NumberValue;
import club.ppmc.visualsync.model.value.OpaqueExpression;
import club.ppmc.visualsync.model.value.StringValue;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class ValueSerializer {

    private static final Pattern NUMERIC_LITERAL = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final Pattern PLACEHOLDER = Pattern.compile("<[A-Za-z_$][\\w$.]*>");

    private ValueSerializer() {}

    /**
     * @throws IllegalArgumentException 当值是无法还原为源代码的占位符 (如 "&lt;Text&gt;") 时。
     */
    public static String serialize(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof AttributeValue attribute) {
            return serializeAttribute(attribute);
        }
        if (value instanceof String s) {
            return serializeString(s);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(ValueSerializer::serialize).collect(Collectors.joining(", ", "[", "]"));
        }
        if (value instanceof Map<?, ?> map) {
            return serializeMap(map);
        }
        return value.toString();
    }

    public static String serializeString(String value) {
        if (value.isEmpty()) {
            return "''";
        }
        if (looksLikeCode(value)) {
            return value;
        }
        return quote(value);
    }

    /** 不经启发式判断，直接输出为单引号字符串字面量。 */
    public static String quote(String value) {
        return quote(value, true);
    }

    /** 输出为保留插值的字符串字面量：'$' 不转义，$name 与 ${...} 仍然是插值。 */
    public static String quoteTemplate(String value) {
        return quote(value, false);
    }

    private static String quote(String value, boolean escapeDollar) {
        var escaped = new StringBuilder("'");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> escaped.append("\\\\");
                case '\'' -> escaped.append("\\'");
                case '$' -> escaped.append(escapeDollar ? "\\$" : "$");
                case '\n' -> escaped.append("\\n");
                case '\t' -> escaped.append("\\t");
                default -> escaped.append(c);
            }
        }
        return escaped.append('\'').toString();
    }

    static boolean looksLikeCode(String value) {
        return Character.isUpperCase(value.charAt(0))
                || value.contains(".")
                || NUMERIC_LITERAL.matcher(value).matches();
    }

    /** 值是否为字符串 (String 或 StringValue)。 */
    public static boolean isText(Object value) {
        return value instanceof String || value instanceof StringValue;
    }

    static String textOf(Object value) {
        return value instanceof StringValue s ? s.value() : value.toString();
    }

    public static boolean isPlaceholder(AttributeValue value) {
        return value instanceof OpaqueExpression opaque
                && PLACEHOLDER.matcher(opaque.text()).matches();
    }

    private static String serializeAttribute(AttributeValue attribute) {
        if (attribute instanceof StringValue s) {
            return serializeString(s.value());
        }
        if (attribute instanceof NumberValue || attribute instanceof BoolValue) {
            return attribute.toDisplayString();
        }
        if (attribute instanceof ListValue list) {
            return list.elements().stream()
                    .map(ValueSerializer::serializeAttribute)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
        if (isPlaceholder(attribute)) {
            throw new IllegalArgumentException("占位符无法还原为源代码: " + attribute.toDisplayString());
        }
        return attribute.toDisplayString();
    }

    private static String serializeMap(Map<?, ?> map) {
        if (map.containsKey("all") && map.get("all") != null) {
            return "EdgeInsets.all(" + map.get("all") + ")";
        }
        if (map.containsKey("top") || map.containsKey("left")) {
            return String.format(
                    "EdgeInsets.only(top: %s, bottom: %s, left: %s, right: %s)",
                    orZero(map.get("top")),
                    orZero(map.get("bottom")),
                    orZero(map.get("left")),
                    orZero(map.get("right")));
        }
        return map.entrySet().stream()
                .map(e -> e.getKey() + ": " + serialize(e.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private static Object orZero(Object value) {
        return value == null ? 0 : value;
    }
}
