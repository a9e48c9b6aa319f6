/**
 * BoolValue.java
 */
package club.ppmc.visualsync.model.value;

public record BoolValue(boolean value) implements AttributeValue {

    @Override
    public String toDisplayString() {
        return Boolean.toString(value);
    }

    @Override
    public Object toPlainObject() {
        return value;
    }
}
