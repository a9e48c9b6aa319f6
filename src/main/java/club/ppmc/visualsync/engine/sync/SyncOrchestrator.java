/**
 * SyncOrchestrator.java
 *
 * 双向同步的编排器，是一个打开文档的唯一写者。
 * 它持有源缓冲区、构造体树、选区与历史记录，按顺序调用解析器和结构化编辑器，
 * 并通过 SyncListener 把结果推送给可视化渲染器、属性面板和代码编辑器。
 *
 * 状态机：IDLE / APPLYING_FROM_CODE / APPLYING_FROM_VISUAL。
 * 进入任一 "APPLYING" 状态后，反方向的命令会被丢弃，直到计划中的重新解析完成，从而避免代码视图
 * 与可视视图之间的反馈循环。同方向的连续编辑合并进同一个防抖窗口：新的编辑取消并重新安排唯一的
 * 待执行解析任务，因为重新解析总是基于最新的缓冲区进行。
 *
 * 线程模型：所有公开方法以及防抖任务都必须在同一个线程上执行 (即构造时传入的调度器线程)。
 * 本类不做任何内部同步，由 DocumentSessionService 通过单消费者队列保证串行。
 */
package club.ppmc.visualsync.engine.sync;

import club.ppmc.visualsync.engine.mutation.SourceFormatter;
import club.ppmc.visualsync.engine.mutation.StructuralMutator;
import club.ppmc.visualsync.engine.parser.ConstructTreeParser;
import club.ppmc.visualsync.engine.parser.TreeAssembler;
import club.ppmc.visualsync.model.CommandOutcome;
import club.ppmc.visualsync.model.InsertPosition;
import club.ppmc.visualsync.model.NodeBounds;
import club.ppmc.visualsync.model.NodeRef;
import club.ppmc.visualsync.model.Selection;
import club.ppmc.visualsync.model.SourceBuffer;
import club.ppmc.visualsync.model.SyncEvent;
import club.ppmc.visualsync.model.SyncEventType;
import club.ppmc.visualsync.model.SyncSource;
import club.ppmc.visualsync.model.SyncState;
import club.ppmc.visualsync.model.tree.ConstructNode;
import club.ppmc.visualsync.model.tree.RootNode;
import club.ppmc.visualsync.model.value.AttributeValue;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class SyncOrchestrator {

    private final ConstructTreeParser parser;
    private final StructuralMutator mutator;
    private final LineOffsetTracker tracker = new LineOffsetTracker();
    private final ScheduledExecutorService scheduler;
    private final SyncOptions options;
    private final SyncHistory history;
    private final List<SyncListener> listeners = new CopyOnWriteArrayList<>();

    private SourceBuffer buffer;
    private RootNode tree = TreeAssembler.emptyRoot("", null);
    private Selection selection;
    private SyncState state = SyncState.IDLE;
    private ScheduledFuture<?> pendingReparse;
    private boolean coalescingRawEdits;

    public SyncOrchestrator(
            SourceFormatter formatter, ScheduledExecutorService scheduler, SyncOptions options) {
        this.parser = new ConstructTreeParser(options.snippetMaxLength());
        this.mutator = new StructuralMutator(parser, formatter);
        this.scheduler = scheduler;
        this.options = options;
        this.history = new SyncHistory(options.historyLimit());
    }

    public void addListener(SyncListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SyncListener listener) {
        listeners.remove(listener);
    }

    // ---------------------------------------------------------------
    // 文档生命周期
    // ---------------------------------------------------------------

    /** 打开 (或切换到) 一个文档：清空选区与历史，立即解析。 */
    public void open(SourceBuffer newBuffer) {
        cancelPendingReparse();
        this.buffer = newBuffer;
        this.state = SyncState.IDLE;
        this.coalescingRawEdits = false;
        tracker.reset();
        history.clear();
        if (selection != null) {
            selection = null;
            publish(l -> l.onSelectionChanged(null));
            publish(l -> l.onAttributesChanged(Map.of()));
        }

        var event = SyncEvent.of(SyncEventType.DOCUMENT_OPENED, SyncSource.SYSTEM);
        history.append(event, newBuffer.text());
        log.info("打开文档 {} ({} 个字符)", newBuffer.path(), newBuffer.text().length());
        publish(l -> l.onCodeChanged(newBuffer));
        publish(l -> l.onSyncEvent(event));
        reparseNow();
    }

    /** 保存成功后清除脏标记。 */
    public void markSaved() {
        if (buffer != null) {
            buffer = buffer.markSaved();
        }
    }

    public void close() {
        cancelPendingReparse();
        listeners.clear();
    }

    // ---------------------------------------------------------------
    // 选区
    // ---------------------------------------------------------------

    public CommandOutcome selectNode(NodeRef ref, SyncSource source) {
        return selectNode(ref, 0, source);
    }

    /**
     * @param column 起始列，用于区分同一行上的同名节点；为 0 时取第一个匹配的节点。
     */
    public CommandOutcome selectNode(NodeRef ref, int column, SyncSource source) {
        if (buffer == null || ref == null) {
            return CommandOutcome.NO_OP;
        }
        if (state == SyncState.APPLYING_FROM_CODE) {
            return dropped("selectNode");
        }
        return locate(tree, ref, column)
                .map(node -> select(node, source))
                .orElse(CommandOutcome.NO_OP);
    }

    /** 代码编辑器光标移动时根据行号选中节点。 */
    public CommandOutcome selectNodeAtLine(int line) {
        if (buffer == null) {
            return CommandOutcome.NO_OP;
        }
        if (state == SyncState.APPLYING_FROM_VISUAL) {
            return dropped("selectNodeAtLine");
        }
        return parser.findNodeAtLine(tree, line)
                .map(node -> select(node, SyncSource.CODE_EDITOR))
                .orElse(CommandOutcome.NO_OP);
    }

    public void clearSelection() {
        if (selection != null) {
            selection = null;
            publish(l -> l.onSelectionChanged(null));
            publish(l -> l.onAttributesChanged(Map.of()));
        }
    }

    private CommandOutcome select(ConstructNode node, SyncSource source) {
        selection = snapshot(node);
        var event = SyncEvent.forNode(SyncEventType.NODE_SELECTED, source, selection.ref());
        Selection current = selection;
        publish(l -> l.onSelectionChanged(current));
        publish(l -> l.onAttributesChanged(current.attributes()));
        publish(l -> l.onSyncEvent(event));
        return CommandOutcome.APPLIED;
    }

    // ---------------------------------------------------------------
    // 可视化方向的编辑
    // ---------------------------------------------------------------

    /** 更新选中节点的一个属性，写入源代码后按属性防抖间隔安排重新解析。 */
    public CommandOutcome updateAttribute(String name, Object value) {
        if (buffer == null || selection == null) {
            return CommandOutcome.NO_OP;
        }
        if (state == SyncState.APPLYING_FROM_CODE) {
            return dropped("updateAttribute");
        }
        NodeRef original = selection.ref();
        NodeRef current = original.withStartLine(tracker.getCurrentLine(original.startLine()));
        Optional<ConstructNode> located =
                locate(parser.parseTree(buffer.text(), buffer.path()), current, selection.column());
        if (located.isEmpty()) {
            log.debug("在当前缓冲区中找不到 {}, 属性更新被忽略", current);
            return CommandOutcome.NO_OP;
        }

        String before = buffer.text();
        String after = mutator.updateAttribute(before, located.get().toBounds(), name, value);
        if (after.equals(before)) {
            return CommandOutcome.NO_OP;
        }
        state = SyncState.APPLYING_FROM_VISUAL;
        recordDrift(current.startLine() + 1, before, after);
        buffer = buffer.withText(after);

        Map<String, AttributeValue> attributes =
                locate(parser.parseTree(after, buffer.path()), current, selection.column())
                        .map(ConstructNode::getAttributes)
                        .orElseGet(Map::of);
        selection = new Selection(original, selection.column(), selection.bounds(), attributes);
        var event = SyncEvent.attributeUpdated(current, name, value);
        record(event);

        SourceBuffer published = buffer;
        publish(l -> l.onCodeChanged(published));
        publish(l -> l.onAttributesChanged(attributes));
        publish(l -> l.onSyncEvent(event));
        scheduleReparse(options.attributeDebounce());
        return CommandOutcome.APPLIED;
    }

    public CommandOutcome insertNode(String newNodeText, InsertPosition position) {
        return insertNode(selectedRef(), newNodeText, position);
    }

    public CommandOutcome insertNode(NodeRef anchorRef, String newNodeText, InsertPosition position) {
        return structural("insertNode", anchorRef, anchor -> {
            int driftLine = switch (position) {
                case BEFORE -> anchor.getStartLine();
                case AFTER -> anchor.getEndLine() + 1;
                case AS_CHILD -> anchor.getStartLine() + 1;
            };
            return new StructuralEdit(
                    SyncEvent.forNode(SyncEventType.NODE_INSERTED, SyncSource.WIDGET_TREE, anchor.toRef()),
                    (before, after) -> recordDrift(driftLine, before, after),
                    text -> mutator.insertNode(text, anchor.toBounds(), newNodeText, position));
        });
    }

    public CommandOutcome deleteNode() {
        return deleteNode(selectedRef());
    }

    public CommandOutcome deleteNode(NodeRef ref) {
        return structural("deleteNode", ref, node -> new StructuralEdit(
                SyncEvent.forNode(SyncEventType.NODE_DELETED, SyncSource.WIDGET_TREE, node.toRef()),
                (before, after) -> recordDrift(node.getStartLine(), before, after),
                text -> mutator.deleteNode(text, node.toBounds())));
    }

    public CommandOutcome wrapNode(String wrapperName, Map<String, ?> wrapperAttrs) {
        return wrapNode(selectedRef(), wrapperName, wrapperAttrs);
    }

    public CommandOutcome wrapNode(NodeRef ref, String wrapperName, Map<String, ?> wrapperAttrs) {
        return structural("wrapNode", ref, node -> new StructuralEdit(
                SyncEvent.wrapped(node.toRef(), wrapperName),
                (before, after) -> recordWrapDrift(node, before, after),
                text -> mutator.wrapNode(text, node.toBounds(), wrapperName, wrapperAttrs)));
    }

    public CommandOutcome reorderNodes(NodeRef first, NodeRef second) {
        return reorderNodes(first, columnHint(first), second, columnHint(second));
    }

    /** 交换两个节点；列号用于区分同一行上的同名节点，为 0 时取第一个匹配。 */
    public CommandOutcome reorderNodes(NodeRef first, int firstColumn, NodeRef second, int secondColumn) {
        if (buffer == null || first == null || second == null) {
            return CommandOutcome.NO_OP;
        }
        if (state == SyncState.APPLYING_FROM_CODE) {
            return dropped("reorderNodes");
        }
        flushPendingReparse();
        Optional<ConstructNode> a = locate(tree, first, firstColumn);
        Optional<ConstructNode> b = locate(tree, second, secondColumn);
        if (a.isEmpty() || b.isEmpty()) {
            return CommandOutcome.NO_OP;
        }
        NodeBounds boundsA = a.get().toBounds();
        NodeBounds boundsB = b.get().toBounds();
        var event = SyncEvent.forNode(SyncEventType.NODES_REORDERED, SyncSource.WIDGET_TREE, first);
        return applyStructural(
                event,
                (before, after) -> followSwappedSelection(a.get(), b.get(), after),
                text -> mutator.reorderNodes(text, boundsA, boundsB),
                false);
    }

    /** 一次结构化编辑：事件、编辑前后文本的行号漂移记录方式以及文本变换。 */
    private record StructuralEdit(SyncEvent event, BiConsumer<String, String> drift, UnaryOperator<String> edit) {}

    private CommandOutcome structural(
            String operation, NodeRef ref, Function<ConstructNode, StructuralEdit> plan) {
        if (buffer == null || ref == null) {
            return CommandOutcome.NO_OP;
        }
        if (state == SyncState.APPLYING_FROM_CODE) {
            return dropped(operation);
        }
        // 离散命令不参与防抖：先让待执行的解析落地，使树与缓冲区一致
        flushPendingReparse();
        Optional<ConstructNode> node = locate(tree, ref, columnHint(ref));
        if (node.isEmpty()) {
            log.debug("{}: 找不到节点 {}", operation, ref);
            return CommandOutcome.NO_OP;
        }
        StructuralEdit edit = plan.apply(node.get());
        boolean deletesSelection = edit.event().type() == SyncEventType.NODE_DELETED
                && selection != null
                && selection.ref().equals(node.get().toRef())
                && selection.column() == node.get().getStartColumn();
        return applyStructural(edit.event(), edit.drift(), edit.edit(), deletesSelection);
    }

    private CommandOutcome applyStructural(
            SyncEvent event, BiConsumer<String, String> drift, UnaryOperator<String> edit, boolean deletesSelection) {
        String before = buffer.text();
        String after = edit.apply(before);
        if (after.equals(before)) {
            return CommandOutcome.NO_OP;
        }
        state = SyncState.APPLYING_FROM_VISUAL;
        drift.accept(before, after);
        buffer = buffer.withText(after);
        record(event);
        SourceBuffer published = buffer;
        publish(l -> l.onCodeChanged(published));
        publish(l -> l.onSyncEvent(event));
        if (deletesSelection) {
            clearSelection();
        }
        reparseNow();
        return CommandOutcome.APPLIED;
    }

    // ---------------------------------------------------------------
    // 代码方向的编辑
    // ---------------------------------------------------------------

    /** 代码编辑器提交的整段文本。与当前缓冲区相同的文本视为回声，直接忽略。 */
    public CommandOutcome applyRawEdit(String text) {
        if (buffer == null || text == null || text.equals(buffer.text())) {
            return CommandOutcome.NO_OP;
        }
        if (state == SyncState.APPLYING_FROM_VISUAL) {
            return dropped("applyRawEdit");
        }
        state = SyncState.APPLYING_FROM_CODE;
        buffer = buffer.withText(text);
        var event = SyncEvent.of(SyncEventType.CODE_UPDATED, SyncSource.CODE_EDITOR);
        if (coalescingRawEdits) {
            history.replaceCurrent(event, text);
        } else {
            history.append(event, text);
        }
        coalescingRawEdits = true;
        publish(l -> l.onSyncEvent(event));
        scheduleReparse(options.rawEditDebounce());
        return CommandOutcome.APPLIED;
    }

    // ---------------------------------------------------------------
    // 撤销 / 重做
    // ---------------------------------------------------------------

    public CommandOutcome undo() {
        if (buffer == null) {
            return CommandOutcome.NO_OP;
        }
        return history.undo()
                .map(entry -> restore(entry.snapshot(), SyncEventType.UNDO))
                .orElse(CommandOutcome.NO_OP);
    }

    public CommandOutcome redo() {
        if (buffer == null) {
            return CommandOutcome.NO_OP;
        }
        return history.redo()
                .map(entry -> restore(entry.snapshot(), SyncEventType.REDO))
                .orElse(CommandOutcome.NO_OP);
    }

    private CommandOutcome restore(String snapshot, SyncEventType type) {
        cancelPendingReparse();
        buffer = buffer.withText(snapshot);
        var event = SyncEvent.of(type, SyncSource.SYSTEM);
        SourceBuffer published = buffer;
        publish(l -> l.onCodeChanged(published));
        publish(l -> l.onSyncEvent(event));
        reparseNow();
        return CommandOutcome.APPLIED;
    }

    // ---------------------------------------------------------------
    // 重新解析
    // ---------------------------------------------------------------

    /**
     * 立即执行待处理的防抖解析。
     *
     * @return 是否存在待处理的解析。
     */
    public boolean flushPendingReparse() {
        if (pendingReparse == null) {
            return false;
        }
        cancelPendingReparse();
        reparseNow();
        return true;
    }

    public boolean hasPendingReparse() {
        return pendingReparse != null;
    }

    private void scheduleReparse(Duration delay) {
        cancelPendingReparse();
        pendingReparse = scheduler.schedule(this::debouncedReparse, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void debouncedReparse() {
        pendingReparse = null;
        try {
            reparseNow();
        } catch (RuntimeException e) {
            log.error("防抖解析任务执行失败", e);
            state = SyncState.IDLE;
        }
    }

    private void cancelPendingReparse() {
        if (pendingReparse != null) {
            pendingReparse.cancel(false);
            pendingReparse = null;
        }
    }

    private void reparseNow() {
        RootNode root = parser.parseTree(buffer.text(), buffer.path());
        tree = root;
        NodeRef previous = selection == null ? null : selection.ref();
        int column = selection == null ? 0 : selection.column();
        NodeRef remapped =
                previous == null ? null : previous.withStartLine(tracker.getCurrentLine(previous.startLine()));
        tracker.reset();
        state = SyncState.IDLE;
        coalescingRawEdits = false;

        publish(l -> l.onTreeChanged(root));
        if (remapped == null) {
            return;
        }
        Optional<ConstructNode> node = locate(root, remapped, column);
        if (node.isPresent()) {
            selection = snapshot(node.get());
            Selection current = selection;
            publish(l -> l.onSelectionChanged(current));
            publish(l -> l.onAttributesChanged(current.attributes()));
        } else {
            log.debug("重新解析后找不到选中的节点 {}, 清除选区", remapped);
            clearSelection();
        }
    }

    // ---------------------------------------------------------------
    // 辅助方法
    // ---------------------------------------------------------------

    private void record(SyncEvent event) {
        history.append(event, buffer.text());
        coalescingRawEdits = false;
    }

    private void recordDrift(int atLine, String before, String after) {
        if (selection != null) {
            // 跟踪是惰性的，选中行必须在漂移之前登记
            tracker.getCurrentLine(selection.ref().startLine());
        }
        int delta = TreeAssembler.countLines(after) - TreeAssembler.countLines(before);
        if (delta > 0) {
            tracker.recordInsertion(atLine, delta);
        } else if (delta < 0) {
            tracker.recordDeletion(atLine, -delta);
        }
    }

    /**
     * 多行节点被包裹时，包装头 (构造体名与属性各占一行) 插在节点之前，闭合括号单独一行插在节点之后。
     * 单行节点原地包裹，行数不变。
     */
    private void recordWrapDrift(ConstructNode node, String before, String after) {
        if (selection != null) {
            tracker.getCurrentLine(selection.ref().startLine());
        }
        int delta = TreeAssembler.countLines(after) - TreeAssembler.countLines(before);
        if (delta <= 0) {
            return;
        }
        tracker.recordInsertion(node.getEndLine() + 1, 1);
        tracker.recordInsertion(node.getStartLine(), delta - 1);
    }

    /** 选中的节点参与了交换时，选区跟随节点移动到交换后的位置。 */
    private void followSwappedSelection(ConstructNode a, ConstructNode b, String after) {
        if (selection == null) {
            return;
        }
        ConstructNode first = a.getStartOffset() < b.getStartOffset() ? a : b;
        ConstructNode second = first == a ? b : a;
        int firstLength = first.getEndOffset() - first.getStartOffset();
        int secondLength = second.getEndOffset() - second.getStartOffset();
        int movedTo;
        if (isSelected(first)) {
            movedTo = second.getStartOffset() + secondLength - firstLength;
        } else if (isSelected(second)) {
            movedTo = first.getStartOffset();
        } else {
            return;
        }
        if (movedTo < 0 || movedTo > after.length()) {
            return;
        }
        int line = TreeAssembler.countLines(after.substring(0, movedTo));
        int column = movedTo - after.lastIndexOf('\n', movedTo - 1);
        tracker.reset();
        selection = new Selection(
                selection.ref().withStartLine(line), column, selection.bounds(), selection.attributes());
    }

    private boolean isSelected(ConstructNode node) {
        return selection.ref().equals(node.toRef()) && selection.column() == node.getStartColumn();
    }

    /** 按名称与行号定位节点，同一行有多个同名节点时以起始列区分。 */
    private Optional<ConstructNode> locate(RootNode root, NodeRef ref, int column) {
        List<ConstructNode> matches = parser.findNodes(root, ref);
        return matches.stream()
                .filter(node -> node.getStartColumn() == column)
                .findFirst()
                .or(() -> matches.stream().findFirst());
    }

    /** 命令目标恰好是当前选区时，沿用选区的起始列。 */
    private int columnHint(NodeRef ref) {
        return selection != null && selection.ref().equals(ref) ? selection.column() : 0;
    }

    private NodeRef selectedRef() {
        return selection == null ? null : selection.ref();
    }

    private static Selection snapshot(ConstructNode node) {
        return new Selection(node.toRef(), node.getStartColumn(), node.toBounds(), node.getAttributes());
    }

    private CommandOutcome dropped(String operation) {
        log.debug("{} 在 {} 状态下被丢弃", operation, state);
        return CommandOutcome.DROPPED;
    }

    private void publish(Consumer<SyncListener> notification) {
        for (SyncListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                log.warn("同步监听器 {} 处理通知时出错", listener.getClass().getSimpleName(), e);
            }
        }
    }

    // ---------------------------------------------------------------
    // 只读访问
    // ---------------------------------------------------------------

    public SourceBuffer getBuffer() {
        return buffer;
    }

    public RootNode getTree() {
        return tree;
    }

    public Selection getSelection() {
        return selection;
    }

    public SyncState getState() {
        return state;
    }

    public boolean canUndo() {
        return history.canUndo();
    }

    public boolean canRedo() {
        return history.canRedo();
    }

    public List<SyncHistory.Entry> getHistory() {
        return history.entries();
    }

    public LineOffsetTracker getTracker() {
        return tracker;
    }
}
