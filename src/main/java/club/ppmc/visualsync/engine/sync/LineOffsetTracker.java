/**
 * LineOffsetTracker.java
 *
 * 在两次重新解析之间跟踪行号的漂移。
 * 例如：用户选中了第 10 行的节点，随后在第 5 行插入了两行，该节点实际已位于第 12 行。
 * 维护一个稀疏映射 "原始行号 -> 当前行号"，只有被查询过的行才会进入跟踪 (惰性)。
 *
 * 非线程安全：由 SyncOrchestrator 作为唯一写者串行访问。每次重新解析成功后必须调用 reset()，
 * 因为新树中的行号才是权威的。
 */
package club.ppmc.visualsync.engine.sync;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LineOffsetTracker {

    private final Map<Integer, Integer> lineOffsets = new HashMap<>();
    private Instant lastReset;

    /**
     * 返回原始行号对应的当前行号。未被跟踪的行从恒等映射开始跟踪。
     */
    public int getCurrentLine(int originalLine) {
        return lineOffsets.computeIfAbsent(originalLine, line -> line);
    }

    /** 当前值 >= atLine 的所有被跟踪行下移 count 行。 */
    public void recordInsertion(int atLine, int count) {
        if (count <= 0) {
            return;
        }
        lineOffsets.replaceAll((original, currentLine) ->
                currentLine >= atLine ? currentLine + count : currentLine);
        log.debug("记录插入: 第 {} 行起插入 {} 行, 当前跟踪 {} 行", atLine, count, lineOffsets.size());
    }

    /**
     * 当前值落在 [atLine, atLine + count - 1] 内的行被移出跟踪 (其构造体已被删除)，
     * 之后的行上移 count 行，之前的行保持不变。
     */
    public void recordDeletion(int atLine, int count) {
        if (count <= 0) {
            return;
        }
        int lastDeleted = atLine + count - 1;
        Iterator<Map.Entry<Integer, Integer>> it = lineOffsets.entrySet().iterator();
        while (it.hasNext()) {
            var entry = it.next();
            int currentLine = entry.getValue();
            if (currentLine >= atLine && currentLine <= lastDeleted) {
                it.remove();
            } else if (currentLine > lastDeleted) {
                entry.setValue(currentLine - count);
            }
        }
        log.debug("记录删除: 第 {} 行起删除 {} 行, 当前跟踪 {} 行", atLine, count, lineOffsets.size());
    }

    public boolean isTracking(int originalLine) {
        return lineOffsets.containsKey(originalLine);
    }

    public void reset() {
        if (!lineOffsets.isEmpty()) {
            log.debug("重置行号跟踪, 清除 {} 条记录", lineOffsets.size());
        }
        lineOffsets.clear();
        lastReset = Instant.now();
    }

    public int trackedLineCount() {
        return lineOffsets.size();
    }

    /** 最近一次 reset 的时间，从未重置时为 null。 */
    public Instant lastReset() {
        return lastReset;
    }

    public Map<Integer, Integer> offsets() {
        return Collections.unmodifiableMap(lineOffsets);
    }
}
