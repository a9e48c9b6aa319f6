/**
 * NumberValue.java
 *
 * 数字字面量。整数保存为 Long，小数保存为 Double。
 */
package club.ppmc.visualsync.model.value;

public record NumberValue(Number value) implements AttributeValue {

    @Override
    public String toDisplayString() {
        return value.toString();
    }

    @Override
    public Object toPlainObject() {
        return value;
    }

    public NumberValue negate() {
        if (value instanceof Double d) {
            return new NumberValue(-d);
        }
        return new NumberValue(-value.longValue());
    }
}
