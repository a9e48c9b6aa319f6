package club.ppmc.visualsync.engine.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import club.ppmc.visualsync.model.SyncEvent;
import club.ppmc.visualsync.model.SyncEventType;
import club.ppmc.visualsync.model.SyncSource;
import org.junit.jupiter.api.Test;

class SyncHistoryTest {

    private static SyncEvent edit() {
        return SyncEvent.of(SyncEventType.CODE_UPDATED, SyncSource.CODE_EDITOR);
    }

    @Test
    void undoAndRedoWalkSnapshots() {
        var history = new SyncHistory(10);
        history.append(SyncEvent.of(SyncEventType.DOCUMENT_OPENED, SyncSource.SYSTEM), "v0");
        history.append(edit(), "v1");
        history.append(edit(), "v2");

        assertEquals("v1", history.undo().orElseThrow().snapshot());
        assertEquals("v0", history.undo().orElseThrow().snapshot());
        assertFalse(history.canUndo());
        assertTrue(history.undo().isEmpty());

        assertEquals("v1", history.redo().orElseThrow().snapshot());
        assertEquals("v2", history.redo().orElseThrow().snapshot());
        assertTrue(history.redo().isEmpty());
    }

    @Test
    void appendAfterUndoTruncatesRedo() {
        var history = new SyncHistory(10);
        history.append(edit(), "a");
        history.append(edit(), "b");
        history.append(edit(), "c");
        history.undo();
        history.undo();

        history.append(edit(), "d");

        assertFalse(history.canRedo());
        assertEquals(2, history.size());
        assertEquals("a", history.undo().orElseThrow().snapshot());
    }

    @Test
    void oldestEntriesAreDroppedOverLimit() {
        var history = new SyncHistory(3);
        for (int i = 0; i < 5; i++) {
            history.append(edit(), "s" + i);
        }

        assertEquals(3, history.size());
        assertEquals(2, history.index());
        assertEquals("s2", history.entries().get(0).snapshot());
        history.undo();
        history.undo();
        assertFalse(history.canUndo());
    }

    @Test
    void replaceCurrentCoalescesEdits() {
        var history = new SyncHistory(10);
        history.append(edit(), "base");
        history.append(edit(), "typing-1");

        history.replaceCurrent(edit(), "typing-2");

        assertEquals(2, history.size());
        assertEquals("typing-2", history.entries().get(1).snapshot());
        assertEquals("base", history.undo().orElseThrow().snapshot());
    }

    @Test
    void replaceCurrentOnEmptyHistoryAppends() {
        var history = new SyncHistory(5);

        history.replaceCurrent(edit(), "first");

        assertEquals(1, history.size());
        assertEquals(0, history.index());
    }

    @Test
    void clearResetsPointer() {
        var history = new SyncHistory(5);
        history.append(edit(), "x");
        history.clear();

        assertEquals(-1, history.index());
        assertFalse(history.canRedo());
    }

    @Test
    void limitMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new SyncHistory(0));
    }
}
