package org.refactor.codeblock.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 内存中的撤销记录：每个分组是一组原子操作。嵌套的 begin 合并到最外层分组中。
 */
public class UndoLog implements UndoRecorder {

    public enum Kind {MODIFICATION, DELETION, CREATION}

    public record Action(Kind kind, String subject) {
    }

    private final List<List<Action>> groups = new ArrayList<>();
    private List<Action> current;
    private int depth;

    @Override
    public ActionGroup beginActionGroup() {
        if (depth++ == 0) {
            current = new ArrayList<>();
        }
        return new ActionGroup() {
            private boolean closed;

            @Override
            public void close() {
                if (closed) return;
                closed = true;
                endActionGroup();
            }
        };
    }

    private void endActionGroup() {
        if (--depth == 0) {
            if (!current.isEmpty()) {
                groups.add(List.copyOf(current));
            }
            current = null;
        }
    }

    private void record(Kind kind, String subject) {
        Action action = new Action(kind, subject);
        if (current != null) {
            current.add(action);
        } else {
            groups.add(List.of(action));
        }
    }

    @Override
    public void recordModification(String blockId) {
        record(Kind.MODIFICATION, blockId);
    }

    @Override
    public void recordDeletion(Connector connector) {
        record(Kind.DELETION, describe(connector));
    }

    @Override
    public void recordCreation(Connector connector) {
        record(Kind.CREATION, describe(connector));
    }

    private static String describe(Connector c) {
        return c.blockId() + "[" + c.outputIndex() + "] -> " + c.end().nodeId() + "[" + c.end().inputIndex() + "]";
    }

    public boolean isGroupOpen() {
        return depth > 0;
    }

    public List<List<Action>> getGroups() {
        return Collections.unmodifiableList(groups);
    }

    public List<Action> lastGroup() {
        return groups.isEmpty() ? List.of() : groups.get(groups.size() - 1);
    }
}
