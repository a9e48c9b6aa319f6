/**
 * OpaqueExpression.java
 *
 * 任何非字面量表达式的文本重建结果，例如:
 * - 限定名/属性访问: "Colors.blue"
 * - 调用表达式: "Theme.of(context)"
 * - 嵌套构造: "<Text>"
 * - 函数字面量: "<Function>"
 * - 条件表达式: "<Conditional>"
 */
package club.ppmc.visualsync.model.value;

public record OpaqueExpression(String text) implements AttributeValue {

    public static final OpaqueExpression FUNCTION = new OpaqueExpression("<Function>");
    public static final OpaqueExpression CONDITIONAL = new OpaqueExpression("<Conditional>");

    public static OpaqueExpression construct(String constructName) {
        return new OpaqueExpression("<" + constructName + ">");
    }

    @Override
    public String toDisplayString() {
        return text;
    }

    @Override
    public Object toPlainObject() {
        return text;
    }
}
