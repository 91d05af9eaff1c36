package org.refactor.codeblock;

import org.refactor.codeblock.analysis.PortSpec;
import org.refactor.codeblock.graph.Connector;
import org.refactor.codeblock.graph.ConnectorStore;
import org.refactor.codeblock.graph.PortRef;
import org.refactor.codeblock.graph.PortRegistry;
import org.refactor.codeblock.graph.UndoLog;
import org.refactor.codeblock.graph.Workspace;
import org.refactor.codeblock.parser.CodeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 内存中的图：保存代码块、端口、输出连线和撤销记录。命令行工具和测试使用。
 */
public class InMemoryWorkspace implements Workspace {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryWorkspace.class);

    private final CodeParser parser;
    private final CodeBlockConfig config;
    private final Map<String, CodeBlockController> blocks = new LinkedHashMap<>();
    private final Map<String, BlockPorts> ports = new HashMap<>();
    private final Map<String, BlockConnectors> connectors = new HashMap<>();
    private final UndoLog undoLog = new UndoLog();

    public InMemoryWorkspace(CodeParser parser, CodeBlockConfig config) {
        this.parser = parser;
        this.config = config;
    }

    public CodeBlockController addCodeBlock(String blockId) {
        if (blocks.containsKey(blockId)) {
            throw new IllegalArgumentException("Duplicate block id " + blockId);
        }
        CodeBlockController block = new CodeBlockController(blockId, parser, this, config,
                LoggerFactory.getLogger(CodeBlockController.class.getName() + "." + blockId));
        blocks.put(blockId, block);
        return block;
    }

    public CodeBlockController getBlock(String blockId) {
        return blocks.get(blockId);
    }

    @Override
    public Optional<String> findRedefinitionAcrossBlocks(String blockId, List<String> candidateNames) {
        for (String name : candidateNames) {
            for (CodeBlockController other : blocks.values()) {
                if (other.getBlockId().equals(blockId) || other.getState() == BlockState.ERROR) continue;
                if (other.definedVariableNames().contains(name)) {
                    LOGGER.debug("{} of block {} is already defined in block {}", name, blockId, other.getBlockId());
                    return Optional.of(name);
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public BlockPorts portsOf(String blockId) {
        return ports.computeIfAbsent(blockId, id -> new BlockPorts());
    }

    @Override
    public BlockConnectors connectorsOf(String blockId) {
        return connectors.computeIfAbsent(blockId, BlockConnectors::new);
    }

    @Override
    public UndoLog undoRecorder() {
        return undoLog;
    }

    public List<Connector> getConnectors() {
        List<Connector> all = new ArrayList<>();
        connectors.values().forEach(c -> all.addAll(c.all()));
        return all;
    }

    public static class BlockPorts implements PortRegistry {
        private List<PortSpec> stagedInputs = List.of();
        private List<PortSpec> stagedOutputs = List.of();
        private List<PortSpec> inputs = List.of();
        private List<PortSpec> outputs = List.of();
        private int commits;

        @Override
        public List<PortSpec> getInputPorts() {
            return inputs;
        }

        @Override
        public List<PortSpec> getOutputPorts() {
            return outputs;
        }

        @Override
        public void setInputPorts(List<PortSpec> ports) {
            stagedInputs = List.copyOf(ports);
        }

        @Override
        public void setOutputPorts(List<PortSpec> ports) {
            stagedOutputs = List.copyOf(ports);
        }

        @Override
        public void commitPorts() {
            inputs = stagedInputs;
            outputs = stagedOutputs;
            commits++;
        }

        public int getCommits() {
            return commits;
        }
    }

    public static class BlockConnectors implements ConnectorStore {
        private final String blockId;
        private final Map<Integer, List<PortRef>> wires = new TreeMap<>();

        BlockConnectors(String blockId) {
            this.blockId = blockId;
        }

        @Override
        public List<PortRef> connectionsOf(int outputIndex) {
            return List.copyOf(wires.getOrDefault(outputIndex, List.of()));
        }

        @Override
        public void disconnect(int outputIndex) {
            wires.remove(outputIndex);
        }

        @Override
        public void connect(int outputIndex, PortRef end) {
            wires.computeIfAbsent(outputIndex, i -> new ArrayList<>()).add(end);
        }

        public List<Connector> all() {
            List<Connector> result = new ArrayList<>();
            wires.forEach((index, ends) -> ends.forEach(end -> result.add(new Connector(blockId, index, end))));
            return result;
        }
    }
}
