/**
 * AttributeValue.java
 *
 * 构造体命名参数值的统一抽象。
 * 取值只可能是字符串、数字、布尔、列表或不透明表达式 (OpaqueExpression) 之一。
 * 不透明表达式是对任何非字面量 (限定名、调用、嵌套构造、函数字面量、条件表达式) 的尽力文本重建。
 */
package club.ppmc.visualsync.model.value;

import com.fasterxml.jackson.annotation.JsonValue;

public interface AttributeValue {

    /**
     * 用于重建调用表达式 (如 {@code foo.bar(a, b)}) 时的文本形式。
     */
    String toDisplayString();

    /**
     * 转换为可直接序列化为 JSON 的普通 Java 对象 (String / Number / Boolean / List)。
     */
    @JsonValue
    Object toPlainObject();
}
