package org.refactor.codeblock.graph;

public interface UndoRecorder {

    /**
     * 从持久化状态恢复时使用：不产生任何撤销记录
     */
    UndoRecorder NONE = new UndoRecorder() {
        @Override
        public ActionGroup beginActionGroup() {
            return () -> {
            };
        }

        @Override
        public void recordModification(String blockId) {
        }

        @Override
        public void recordDeletion(Connector connector) {
        }

        @Override
        public void recordCreation(Connector connector) {
        }
    };

    ActionGroup beginActionGroup();

    void recordModification(String blockId);

    void recordDeletion(Connector connector);

    void recordCreation(Connector connector);
}
