package club.ppmc.visualsync.engine.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import club.ppmc.visualsync.engine.mutation.SourceFormatter;
import club.ppmc.visualsync.model.CommandOutcome;
import club.ppmc.visualsync.model.InsertPosition;
import club.ppmc.visualsync.model.NodeRef;
import club.ppmc.visualsync.model.Selection;
import club.ppmc.visualsync.model.SourceBuffer;
import club.ppmc.visualsync.model.SyncEvent;
import club.ppmc.visualsync.model.SyncEventType;
import club.ppmc.visualsync.model.SyncSource;
import club.ppmc.visualsync.model.SyncState;
import club.ppmc.visualsync.model.tree.RootNode;
import club.ppmc.visualsync.model.value.AttributeValue;
import club.ppmc.visualsync.model.value.StringValue;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SyncOrchestratorTest {

    private static final String GROUP = "Group(items:[Leaf(text:'A'),Leaf(text:'B')])";

    private static final String TWO_TEXTS = String.join("\n",
            "Column(",
            "  children: [",
            "    Text('One'),",
            "    Text('Two'),",
            "  ],",
            ")",
            "");

    private static final String MULTI_LINE_FIRST = String.join("\n",
            "Column(",
            "  children: [",
            "    Text(",
            "      'One',",
            "    ),",
            "    Text('Two'),",
            "  ],",
            ")",
            "");

    /** 足够长，测试期间防抖任务不会自行触发。 */
    private static final Duration NEVER = Duration.ofMinutes(10);

    private ScheduledExecutorService scheduler;
    private SyncOrchestrator orchestrator;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        orchestrator = new SyncOrchestrator(
                SourceFormatter.identity(), scheduler, new SyncOptions(NEVER, NEVER, 100, 200));
        listener = new RecordingListener();
        orchestrator.addListener(listener);
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
        scheduler.shutdownNow();
    }

    private void open(String text) {
        orchestrator.open(SourceBuffer.open("lib/main.dart", text));
    }

    @Test
    void openParsesAndPublishes() {
        open(GROUP);

        assertEquals(1, orchestrator.getTree().getChildren().size());
        assertEquals(SyncState.IDLE, orchestrator.getState());
        assertFalse(orchestrator.canUndo());
        assertFalse(orchestrator.getBuffer().dirty());
        assertEquals(1, listener.trees.size());
        assertEquals(GROUP, listener.codes.get(0).text());
        assertEquals(SyncEventType.DOCUMENT_OPENED, listener.events.get(0).type());
    }

    @Test
    void commandsWithoutDocumentAreNoOps() {
        assertEquals(CommandOutcome.NO_OP, orchestrator.selectNodeAtLine(1));
        assertEquals(CommandOutcome.NO_OP, orchestrator.applyRawEdit("x"));
        assertEquals(CommandOutcome.NO_OP, orchestrator.undo());
    }

    @Test
    void selectingSameLineNodesUsesColumn() {
        open(GROUP);

        var outcome = orchestrator.selectNode(new NodeRef("Leaf", 1), 29, SyncSource.WIDGET_TREE);

        assertEquals(CommandOutcome.APPLIED, outcome);
        assertEquals(29, orchestrator.getSelection().column());
        assertEquals(new StringValue("B"), listener.attributes.get(listener.attributes.size() - 1).get("text"));
        assertEquals(SyncEventType.NODE_SELECTED, listener.lastEvent().type());
    }

    @Test
    void selectNodeAtLinePicksNodeStartingThere() {
        open(TWO_TEXTS);

        assertEquals(CommandOutcome.APPLIED, orchestrator.selectNodeAtLine(4));
        assertEquals(new NodeRef("Text", 4), orchestrator.getSelection().ref());
        assertEquals(CommandOutcome.NO_OP, orchestrator.selectNodeAtLine(40));
    }

    @Test
    void attributeUpdateRewritesSourceAndSuppressesCodeDirection() {
        open(GROUP);
        orchestrator.selectNode(new NodeRef("Leaf", 1), 14, SyncSource.WIDGET_TREE);

        var outcome = orchestrator.updateAttribute("text", "Hello");

        assertEquals(CommandOutcome.APPLIED, outcome);
        assertEquals("Group(items:[Leaf(text: 'Hello'),Leaf(text:'B')])", orchestrator.getBuffer().text());
        assertTrue(orchestrator.getBuffer().dirty());
        assertEquals(SyncState.APPLYING_FROM_VISUAL, orchestrator.getState());
        assertTrue(orchestrator.hasPendingReparse());
        assertEquals(CommandOutcome.DROPPED, orchestrator.applyRawEdit("Group()"));
        assertEquals(CommandOutcome.DROPPED, orchestrator.selectNodeAtLine(1));

        assertTrue(orchestrator.flushPendingReparse());

        assertEquals(SyncState.IDLE, orchestrator.getState());
        Selection selection = orchestrator.getSelection();
        assertEquals(14, selection.column());
        assertEquals(new StringValue("Hello"), selection.attributes().get("text"));
        assertTrue(orchestrator.canUndo());
    }

    @Test
    void attributeUpdateWithoutSelectionIsNoOp() {
        open(GROUP);

        assertEquals(CommandOutcome.NO_OP, orchestrator.updateAttribute("text", "x"));
        assertEquals(GROUP, orchestrator.getBuffer().text());
    }

    @Test
    void rawEditsCoalesceIntoOneHistoryEntry() {
        open(TWO_TEXTS);

        orchestrator.applyRawEdit(TWO_TEXTS.replace("One", "On"));
        orchestrator.applyRawEdit(TWO_TEXTS.replace("One", "O"));

        assertEquals(SyncState.APPLYING_FROM_CODE, orchestrator.getState());
        assertEquals(CommandOutcome.DROPPED,
                orchestrator.selectNode(new NodeRef("Text", 3), SyncSource.WIDGET_TREE));
        assertEquals(2, orchestrator.getHistory().size());

        orchestrator.flushPendingReparse();
        assertEquals(CommandOutcome.APPLIED, orchestrator.undo());
        assertEquals(TWO_TEXTS, orchestrator.getBuffer().text());
        assertEquals(CommandOutcome.APPLIED, orchestrator.redo());
        assertEquals(TWO_TEXTS.replace("One", "O"), orchestrator.getBuffer().text());
        assertEquals(SyncEventType.REDO, listener.lastEvent().type());
    }

    @Test
    void echoedRawEditIsIgnored() {
        open(GROUP);

        assertEquals(CommandOutcome.NO_OP, orchestrator.applyRawEdit(GROUP));
        assertFalse(orchestrator.hasPendingReparse());
        assertEquals(1, orchestrator.getHistory().size());
    }

    @Test
    void deletingSelectedNodeClearsSelection() {
        open(TWO_TEXTS);
        orchestrator.selectNodeAtLine(3);

        assertEquals(CommandOutcome.APPLIED, orchestrator.deleteNode());

        assertNull(orchestrator.getSelection());
        assertNull(listener.selections.get(listener.selections.size() - 1));
        assertEquals(1, orchestrator.getTree().getChildren().get(0).getChildren().size());
        assertFalse(orchestrator.getBuffer().text().contains("Text('One')"));

        orchestrator.undo();
        assertEquals(TWO_TEXTS, orchestrator.getBuffer().text());
    }

    @Test
    void selectionFollowsInsertedLines() {
        open(TWO_TEXTS);
        orchestrator.selectNodeAtLine(4);

        var outcome = orchestrator.insertNode(new NodeRef("Text", 3), "Text('Zero')", InsertPosition.BEFORE);

        assertEquals(CommandOutcome.APPLIED, outcome);
        assertEquals(new NodeRef("Text", 5), orchestrator.getSelection().ref());
        assertEquals("    Text('Two'),", orchestrator.getBuffer().text().split("\n")[4]);
        assertEquals(5, orchestrator.getSelection().bounds().startLine());
    }

    @Test
    void wrapAndReorderApplyImmediately() {
        open(TWO_TEXTS);

        assertEquals(CommandOutcome.APPLIED,
                orchestrator.reorderNodes(new NodeRef("Text", 3), new NodeRef("Text", 4)));
        assertTrue(orchestrator.getBuffer().text().indexOf("Two") < orchestrator.getBuffer().text().indexOf("One"));
        assertEquals(SyncState.IDLE, orchestrator.getState());

        assertEquals(CommandOutcome.APPLIED,
                orchestrator.wrapNode(new NodeRef("Text", 3), "Center", Map.of()));
        assertTrue(orchestrator.getBuffer().text().contains("Center(child: Text('Two'))"));
        assertEquals(SyncEventType.NODE_WRAPPED, listener.lastEvent().type());
        assertEquals("Center", listener.lastEvent().wrapperName());
    }

    @Test
    void selectionFollowsWrappedMultiLineNode() {
        open(MULTI_LINE_FIRST);
        orchestrator.selectNodeAtLine(3);

        var outcome = orchestrator.wrapNode("Padding", Map.of("padding", "8"));

        assertEquals(CommandOutcome.APPLIED, outcome);
        String[] lines = orchestrator.getBuffer().text().split("\n");
        assertEquals("    Padding(", lines[2]);
        assertEquals("      child: Text(", lines[4]);
        assertEquals(new NodeRef("Text", 5), orchestrator.getSelection().ref());
    }

    @Test
    void siblingAfterWrappedNodeKeepsSelection() {
        open(MULTI_LINE_FIRST);
        orchestrator.selectNodeAtLine(6);

        orchestrator.wrapNode(new NodeRef("Text", 3), "Padding", Map.of("padding", "8"));

        assertEquals(new NodeRef("Text", 9), orchestrator.getSelection().ref());
        assertEquals("    Text('Two'),", orchestrator.getBuffer().text().split("\n")[8]);
    }

    @Test
    void selectionMovesWithReorderedNode() {
        open(TWO_TEXTS);
        orchestrator.selectNodeAtLine(3);

        assertEquals(CommandOutcome.APPLIED,
                orchestrator.reorderNodes(new NodeRef("Text", 3), new NodeRef("Text", 4)));

        assertEquals(new NodeRef("Text", 4), orchestrator.getSelection().ref());
        assertEquals(5, orchestrator.getSelection().column());
        assertEquals("    Text('One'),", orchestrator.getBuffer().text().split("\n")[3]);
    }

    @Test
    void selectionMovesWithReorderedNodesOfDifferentHeight() {
        open(MULTI_LINE_FIRST);
        orchestrator.selectNodeAtLine(3);

        orchestrator.reorderNodes(new NodeRef("Text", 3), new NodeRef("Text", 6));

        assertEquals("    Text('Two'),", orchestrator.getBuffer().text().split("\n")[2]);
        assertEquals(new NodeRef("Text", 4), orchestrator.getSelection().ref());

        orchestrator.selectNodeAtLine(3);
        orchestrator.reorderNodes(new NodeRef("Text", 3), new NodeRef("Text", 4));

        assertEquals(MULTI_LINE_FIRST, orchestrator.getBuffer().text());
        assertEquals(new NodeRef("Text", 6), orchestrator.getSelection().ref());
    }

    @Test
    void unresolvableTargetsAreNoOps() {
        open(TWO_TEXTS);

        assertEquals(CommandOutcome.NO_OP, orchestrator.deleteNode(new NodeRef("Text", 1)));
        assertEquals(CommandOutcome.NO_OP,
                orchestrator.reorderNodes(new NodeRef("Column", 1), new NodeRef("Text", 3)));
        assertEquals(TWO_TEXTS, orchestrator.getBuffer().text());
    }

    @Test
    void openingAnotherDocumentResetsState() {
        open(TWO_TEXTS);
        orchestrator.selectNodeAtLine(3);
        orchestrator.deleteNode(new NodeRef("Text", 4));

        open(GROUP);

        assertNull(orchestrator.getSelection());
        assertFalse(orchestrator.canUndo());
        assertFalse(orchestrator.canRedo());
        assertEquals(0, orchestrator.getTracker().trackedLineCount());
    }

    @Test
    void failingListenerDoesNotBreakOthers() {
        var failing = new SyncListener() {
            @Override
            public void onCodeChanged(SourceBuffer buffer) {
                throw new IllegalStateException("boom");
            }
        };
        orchestrator.removeListener(listener);
        orchestrator.addListener(failing);
        orchestrator.addListener(listener);

        open(GROUP);

        assertEquals(1, listener.codes.size());
    }

    @Test
    void debouncedReparseRunsOnScheduler() throws Exception {
        var fast = new SyncOrchestrator(
                SourceFormatter.identity(), scheduler, new SyncOptions(Duration.ofMillis(20), NEVER, 10, 200));
        var recorder = new RecordingListener();
        fast.addListener(recorder);
        onScheduler(() -> {
            fast.open(SourceBuffer.open("a.dart", "Text('a')"));
            return fast.applyRawEdit("Text('a')\nText('b')");
        });

        long deadline = System.currentTimeMillis() + 5000;
        while (onScheduler(fast::hasPendingReparse) && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertEquals(SyncState.IDLE, onScheduler(fast::getState));
        assertEquals(2, onScheduler(() -> fast.getTree().getChildren().size()));
        assertEquals(2, recorder.trees.size());
    }

    private <T> T onScheduler(Callable<T> task) throws Exception {
        return scheduler.submit(task).get();
    }

    private static class RecordingListener implements SyncListener {

        final List<Selection> selections = new ArrayList<>();
        final List<Map<String, AttributeValue>> attributes = new ArrayList<>();
        final List<SourceBuffer> codes = new ArrayList<>();
        final List<SyncEvent> events = new ArrayList<>();
        final List<RootNode> trees = new ArrayList<>();

        @Override
        public void onSelectionChanged(Selection selection) {
            selections.add(selection);
        }

        @Override
        public void onAttributesChanged(Map<String, AttributeValue> attrs) {
            attributes.add(attrs);
        }

        @Override
        public void onCodeChanged(SourceBuffer buffer) {
            codes.add(buffer);
        }

        @Override
        public void onSyncEvent(SyncEvent event) {
            events.add(event);
        }

        @Override
        public void onTreeChanged(RootNode root) {
            trees.add(root);
        }

        SyncEvent lastEvent() {
            return events.get(events.size() - 1);
        }
    }
}
