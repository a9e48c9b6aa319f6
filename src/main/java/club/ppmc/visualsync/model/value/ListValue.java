/**
 * ListValue.java
 *
 * 列表字面量，元素按源代码顺序递归提取。
 */
package club.ppmc.visualsync.model.value;

import java.util.List;
import java.util.stream.Collectors;

public record ListValue(List<AttributeValue> elements) implements AttributeValue {

    public ListValue {
        elements = List.copyOf(elements);
    }

    @Override
    public String toDisplayString() {
        return elements.stream()
                .map(AttributeValue::toDisplayString)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public Object toPlainObject() {
        return elements.stream().map(AttributeValue::toPlainObject).toList();
    }
}
