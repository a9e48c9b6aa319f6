/**
 * StringValue.java
 *
 * 字符串字面量 (包括相邻字符串拼接后的结果)。
 */
package club.ppmc.visualsync.model.value;

public record StringValue(String value) implements AttributeValue {

    @Override
    public String toDisplayString() {
        return value;
    }

    @Override
    public Object toPlainObject() {
        return value;
    }
}
