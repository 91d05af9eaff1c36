package org.refactor.codeblock.graph;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestUndoLog {

    private final Connector connector = new Connector("cb", 0, new PortRef("n1", 2));

    @Test
    public void testGroup() {
        UndoLog log = new UndoLog();
        try (ActionGroup group = log.beginActionGroup()) {
            assertTrue(log.isGroupOpen());
            log.recordDeletion(connector);
            log.recordModification("cb");
            log.recordCreation(connector);
        }
        assertFalse(log.isGroupOpen());
        assertEquals(1, log.getGroups().size());
        assertEquals(List.of(UndoLog.Kind.DELETION, UndoLog.Kind.MODIFICATION, UndoLog.Kind.CREATION),
                log.lastGroup().stream().map(UndoLog.Action::kind).toList());
        assertEquals("cb[0] -> n1[2]", log.lastGroup().get(0).subject());
    }

    @Test
    public void testNestedGroupsMerge() {
        UndoLog log = new UndoLog();
        try (ActionGroup outer = log.beginActionGroup()) {
            log.recordModification("a");
            try (ActionGroup inner = log.beginActionGroup()) {
                log.recordModification("b");
            }
            assertTrue(log.isGroupOpen());
        }
        assertEquals(1, log.getGroups().size());
        assertEquals(2, log.lastGroup().size());
    }

    @Test
    public void testGroupClosedOnException() {
        UndoLog log = new UndoLog();
        assertThrows(IllegalStateException.class, () -> {
            try (ActionGroup group = log.beginActionGroup()) {
                log.recordModification("a");
                throw new IllegalStateException("boom");
            }
        });
        assertFalse(log.isGroupOpen());
        assertEquals(1, log.getGroups().size());
    }

    @Test
    public void testEmptyGroupAndUngroupedActions() {
        UndoLog log = new UndoLog();
        log.beginActionGroup().close();
        assertTrue(log.getGroups().isEmpty());
        log.recordCreation(connector);
        assertEquals(1, log.getGroups().size());
    }
}
