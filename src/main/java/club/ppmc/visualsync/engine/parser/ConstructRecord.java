/**
 * ConstructRecord.java
 *
 * 第一遍扫描产出的扁平记录，尚未建立父子关系。
 */
package club.ppmc.visualsync.engine.parser;

import club.ppmc.visualsync.model.value.AttributeValue;
import java.util.List;
import java.util.Map;

public record ConstructRecord(
        String constructName,
        int startLine,
        int endLine,
        int startOffset,
        int endOffset,
        Map<String, AttributeValue> attributes,
        List<AttributeValue> positionalArguments,
        int nestingLevel,
        String slotName) {}
