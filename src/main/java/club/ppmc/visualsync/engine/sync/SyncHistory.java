/**
 * SyncHistory.java
 *
 * 有界的撤销/重做历史。每个条目是一个同步事件以及该事件完成后的全文快照。
 * 在指针不位于末尾时追加新条目会截断重做历史；超过上限时丢弃最旧的条目并调整指针。
 */
package club.ppmc.visualsync.engine.sync;

import club.ppmc.visualsync.model.SyncEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public class SyncHistory {

    public record Entry(SyncEvent event, String snapshot) {}

    private final int limit;
    private final List<Entry> entries = new ArrayList<>();
    private int index = -1;

    public SyncHistory(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("历史记录上限必须为正数: " + limit);
        }
        this.limit = limit;
    }

    public void append(SyncEvent event, String snapshot) {
        if (index < entries.size() - 1) {
            entries.subList(index + 1, entries.size()).clear();
        }
        entries.add(new Entry(event, snapshot));
        index = entries.size() - 1;
        if (entries.size() > limit) {
            entries.remove(0);
            index--;
        }
    }

    /** 用新的事件和快照替换当前条目，用于合并同一防抖窗口内的连续编辑。 */
    public void replaceCurrent(SyncEvent event, String snapshot) {
        if (index < 0) {
            append(event, snapshot);
            return;
        }
        if (index < entries.size() - 1) {
            entries.subList(index + 1, entries.size()).clear();
        }
        entries.set(index, new Entry(event, snapshot));
    }

    /** 指针后退一步并返回应恢复的条目。 */
    public Optional<Entry> undo() {
        if (!canUndo()) {
            return Optional.empty();
        }
        index--;
        return Optional.of(entries.get(index));
    }

    public Optional<Entry> redo() {
        if (!canRedo()) {
            return Optional.empty();
        }
        index++;
        return Optional.of(entries.get(index));
    }

    public boolean canUndo() {
        return index > 0;
    }

    public boolean canRedo() {
        return index < entries.size() - 1;
    }

    public void clear() {
        entries.clear();
        index = -1;
    }

    public int size() {
        return entries.size();
    }

    public int index() {
        return index;
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }
}
