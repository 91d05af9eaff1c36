package org.refactor.codeblock;

import org.refactor.codeblock.analysis.PortPlan;
import org.refactor.codeblock.analysis.PortPlanner;
import org.refactor.codeblock.analysis.PortSpec;
import org.refactor.codeblock.analysis.Statement;
import org.refactor.codeblock.analysis.StatementAnalyzer;
import org.refactor.codeblock.analysis.VariableRef;
import org.refactor.codeblock.ast.Assignment;
import org.refactor.codeblock.ast.AstNode;
import org.refactor.codeblock.ast.Identifier;
import org.refactor.codeblock.graph.ActionGroup;
import org.refactor.codeblock.graph.ConnectionSnapshot;
import org.refactor.codeblock.graph.Connector;
import org.refactor.codeblock.graph.ConnectorReconciler;
import org.refactor.codeblock.graph.ConnectorStore;
import org.refactor.codeblock.graph.PortRef;
import org.refactor.codeblock.graph.PortRegistry;
import org.refactor.codeblock.graph.ReconcileReport;
import org.refactor.codeblock.graph.UndoRecorder;
import org.refactor.codeblock.graph.Workspace;
import org.refactor.codeblock.parser.CodeParser;
import org.refactor.codeblock.parser.ParsedBlock;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 一个代码块节点：每次编辑都在一个撤销分组中完成
 * 规范化 -> 保存连线 -> 解析 -> 分析 -> 重复定义检查 -> 计算端口 -> 提交端口 -> 恢复连线。
 * <p>
 * 任何一步失败（包括意外的运行时异常）都会让节点进入错误状态：两个端口列表都为空，错误信息可见，撤销分组照常关闭。
 * 单线程使用，{@link #setCode(String)} 不可重入，重入的调用抛出 {@link IllegalStateException}。
 */
public class CodeBlockController {

    private final String blockId;
    private final CodeParser parser;
    private final Workspace workspace;
    private final StatementAnalyzer analyzer;
    private final PortPlanner planner;
    private final ConnectorReconciler reconciler;
    private final Logger logger;

    private String rawCode = "";
    private String code = "";
    private String codeToParse = "";
    private final List<Statement> statements = new ArrayList<>();
    private List<String> inputIdentifiers = List.of();
    private String previewVariable;
    private boolean shouldFocus = true;
    private BlockState state = BlockState.ACTIVE;
    private String errorMessage;
    private boolean processing;

    public CodeBlockController(String blockId, CodeParser parser, Workspace workspace,
                               CodeBlockConfig config, Logger logger) {
        this.blockId = Objects.requireNonNull(blockId);
        this.parser = Objects.requireNonNull(parser);
        this.workspace = Objects.requireNonNull(workspace);
        this.analyzer = new StatementAnalyzer(config);
        this.planner = new PortPlanner(config);
        this.reconciler = new ConnectorReconciler(config.placeholderLabel);
        this.logger = Objects.requireNonNull(logger);
    }

    /**
     * 唯一的编辑入口。文本没有变化时什么都不做。
     */
    public void setCode(String value) {
        String text = value == null ? "" : value;
        if (text.equals(rawCode)) {
            return;
        }
        rebuild(text, workspace.undoRecorder());
    }

    /**
     * 从持久化状态恢复：与一次编辑走同样的流程，但不产生撤销记录
     */
    public void restore(CodeBlockState saved) {
        shouldFocus = saved.shouldFocus();
        rebuild(saved.code() == null ? "" : saved.code(), UndoRecorder.NONE);
    }

    public CodeBlockState saveState() {
        return new CodeBlockState(rawCode, shouldFocus);
    }

    private void rebuild(String text, UndoRecorder undo) {
        if (processing) {
            throw new IllegalStateException("Code block " + blockId + " is already being rebuilt");
        }
        processing = true;
        try (ActionGroup ignored = undo.beginActionGroup()) {
            ConnectionSnapshot<PortRef> snapshot = saveAndDeleteConnectors(undo);
            undo.recordModification(blockId);
            rawCode = text;
            processCode();
            loadAndCreateConnectors(snapshot, undo);
        } finally {
            processing = false;
        }
    }

    private void processCode() {
        code = SourceNormalizer.normalize(rawCode);
        statements.clear();
        previewVariable = null;
        errorMessage = null;
        state = BlockState.ACTIVE;

        if (code.isEmpty()) {
            codeToParse = "";
            inputIdentifiers = List.of();
            commitPorts(PortPlan.EMPTY);
            return;
        }

        // 解析失败时生成代码也只能看到这次的文本
        codeToParse = code;
        try {
            ParsedBlock parsed = parser.parse(code);
            if (!parsed.isSuccessful()) {
                throw new CodeSyntaxException(parsed.diagnostics());
            }
            codeToParse = parsed.source();
            statements.addAll(analyzer.analyzeAll(parsed.nodes()));
            logger.debug("Code block {}: {} statement(s), free identifiers {}", blockId, statements.size(),
                    parsed.freeIdentifiers());

            // 变量不能在其它代码块中已经定义过
            Optional<String> redefined = workspace.findRedefinitionAcrossBlocks(blockId, definedVariableNames());
            if (redefined.isPresent()) {
                throw new RedefinitionException(redefined.get());
            }

            previewVariable = lastAssignedVariable(parsed.nodes());
            inputIdentifiers = parsed.freeIdentifiers();
            commitPorts(planner.plan(statements, inputIdentifiers));
        } catch (CodeBlockException e) {
            displayError(e.getMessage());
        } catch (StructuralException e) {
            logger.error("Code block {} produced an unexpected statement shape", blockId, e);
            displayError(e.getMessage());
        } catch (RuntimeException e) {
            // 连线已经删除，不能让半途的异常留下旧端口
            logger.error("Unexpected failure while processing code block {}", blockId, e);
            displayError(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private static String lastAssignedVariable(List<AstNode> nodes) {
        String last = null;
        for (AstNode node : nodes) {
            if (node instanceof Assignment assignment) {
                last = assignment.target().name();
            }
        }
        return last;
    }

    /**
     * 进入错误状态：移除所有端口并显示错误信息
     */
    private void displayError(String message) {
        logger.warn("Error in code block {}: {}", blockId, message);
        state = BlockState.ERROR;
        errorMessage = message;
        previewVariable = null;
        inputIdentifiers = List.of();
        commitPorts(PortPlan.EMPTY);
    }

    private void commitPorts(PortPlan plan) {
        if (state == BlockState.ERROR && !plan.isEmpty()) {
            throw new IllegalStateException("Code block " + blockId + " in error state cannot expose ports");
        }
        PortRegistry ports = workspace.portsOf(blockId);
        ports.setInputPorts(plan.inputs());
        ports.setOutputPorts(plan.outputs());
        ports.commitPorts();
    }

    /**
     * 删除所有输出连线，并按 match key 保存远端端点，以便端口重建后恢复
     */
    private ConnectionSnapshot<PortRef> saveAndDeleteConnectors(UndoRecorder undo) {
        List<PortSpec> outputs = workspace.portsOf(blockId).getOutputPorts();
        ConnectorStore connectors = workspace.connectorsOf(blockId);
        ConnectionSnapshot<PortRef> snapshot = reconciler.capture(
                outputs.stream().map(PortSpec::tooltipKey).toList(), connectors::connectionsOf);

        for (int i = 0; i < outputs.size(); i++) {
            for (PortRef end : connectors.connectionsOf(i)) {
                undo.recordDeletion(new Connector(blockId, i, end));
            }
            connectors.disconnect(i);
        }
        return snapshot;
    }

    private void loadAndCreateConnectors(ConnectionSnapshot<PortRef> snapshot, UndoRecorder undo) {
        if (snapshot.totalEndpoints() == 0) {
            return;
        }
        List<String> tooltips = workspace.portsOf(blockId).getOutputPorts().stream()
                .map(PortSpec::tooltipKey).toList();
        ConnectorStore connectors = workspace.connectorsOf(blockId);
        ReconcileReport report = reconciler.restore(snapshot, tooltips, (index, end) -> {
            connectors.connect(index, end);
            undo.recordCreation(new Connector(blockId, index, end));
        });
        logger.info("Code block {} reconnected {} port(s) ({} by name, {} by position, {} pooled), {} wire(s) dropped",
                blockId, report.restoredPorts(), report.exactMatches(), report.positionalMatches(),
                report.pooledMatches(), report.droppedWires());
    }

    /**
     * 生成代码：输入端口接的变量名与未绑定标识符不同时，在代码前面补上 {@code unbound = input;}
     *
     * @throws MissingInputsException 输入个数与未绑定标识符个数不一致
     */
    public List<AstNode> buildAst(List<AstNode> inputAstNodes) {
        int actual = inputAstNodes == null ? 0 : inputAstNodes.size();
        if (actual != inputIdentifiers.size()) {
            throw new MissingInputsException(inputIdentifiers.size(), actual);
        }

        String finalCode = codeToParse;
        if (!inputIdentifiers.isEmpty()) {
            StringBuilder init = new StringBuilder();
            for (int i = 0; i < inputIdentifiers.size(); i++) {
                String unbound = inputIdentifiers.get(i);
                if (inputAstNodes.get(i) instanceof Identifier input && !unbound.equals(input.name())) {
                    init.append(unbound).append(" = ").append(input.name()).append(";");
                }
            }
            finalCode = init.append(codeToParse).toString();
        }

        ParsedBlock parsed = parser.parse(finalCode);
        if (!parsed.isSuccessful()) {
            logger.error("Failed to build AST for code block {}: {}", blockId,
                    new CodeSyntaxException(parsed.diagnostics()).getMessage());
            return List.of();
        }
        return parsed.nodes();
    }

    /**
     * 输出端口背后的变量名；错误状态或下标越界时为空
     */
    public Optional<String> outputIdentifier(int portIndex) {
        if (state == BlockState.ERROR) {
            return Optional.empty();
        }
        int statementIndex = PortPlanner.statementIndexForOutput(statements, portIndex);
        if (statementIndex < 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(statements.get(statementIndex).getFirstDefinedVariable()).map(VariableRef::getName);
    }

    public List<String> definedVariableNames() {
        List<String> names = new ArrayList<>();
        for (Statement s : statements) {
            names.addAll(s.getDefinedVariableNames(true));
        }
        return names;
    }

    public String getBlockId() {
        return blockId;
    }

    public String getRawCode() {
        return rawCode;
    }

    public String getCode() {
        return code;
    }

    public String getCodeToParse() {
        return codeToParse;
    }

    public List<Statement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public List<String> getInputIdentifiers() {
        return inputIdentifiers;
    }

    public String getPreviewVariable() {
        return state == BlockState.ERROR ? null : previewVariable;
    }

    public boolean isShouldFocus() {
        return shouldFocus;
    }

    public void setShouldFocus(boolean shouldFocus) {
        this.shouldFocus = shouldFocus;
    }

    public BlockState getState() {
        return state;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
