package org.refactor.codeblock.analysis;

import org.refactor.codeblock.CodeBlockConfig;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 根据语句序列和未绑定标识符计算输入/输出端口。
 * <p>
 * 输出端口规则：语句定义了变量，且其定义的变量名都没有在后面的顶层语句中再次定义（遮蔽）。
 * 输出端口按语句起始行对齐。
 */
public class PortPlanner {

    private final CodeBlockConfig config;

    public PortPlanner() {
        this(CodeBlockConfig.defaults());
    }

    public PortPlanner(CodeBlockConfig config) {
        this.config = config;
    }

    public PortPlan plan(List<Statement> statements, List<String> freeIdentifiers) {
        return new PortPlan(inputPorts(freeIdentifiers), outputPorts(statements));
    }

    public List<PortSpec> inputPorts(List<String> freeIdentifiers) {
        List<PortSpec> ports = new ArrayList<>();
        for (String name : new LinkedHashSet<>(freeIdentifiers)) {
            ports.add(PortSpec.input(inputLabel(name), name));
        }
        return ports;
    }

    String inputLabel(String name) {
        if (name.length() > config.maxInputLabelLength) {
            return name.substring(0, config.truncatedInputLabelLength) + config.ellipsis;
        }
        return name;
    }

    public List<PortSpec> outputPorts(List<Statement> statements) {
        boolean[] required = requiredOutputs(statements);
        List<PortSpec> ports = new ArrayList<>();

        int cursor = 1;                                 // 上一个输出端口所在行的下一行
        double initialMargin = config.initialPortMargin;
        for (int i = 0; i < statements.size(); i++) {
            if (!required[i]) continue;
            Statement s = statements.get(i);

            double margin;
            if (s.getStartLine() - cursor >= 0) {
                margin = (s.getStartLine() - cursor) * config.lineHeight;
                cursor = s.getStartLine() + 1;
            } else {
                // 行号乱序或重叠，不应出现，但不能崩溃
                margin = 0;
                cursor += 1;
            }

            String name = s.getFirstDefinedVariable().getName();
            String label = SyntheticNames.isSynthetic(name) ? config.placeholderLabel : name;
            ports.add(PortSpec.output(label, label, margin + initialMargin, name));
            initialMargin = 0;
        }
        return ports;
    }

    /**
     * 从后往前扫描，记录后面语句已经定义过的名字
     */
    public static boolean[] requiredOutputs(List<Statement> statements) {
        boolean[] required = new boolean[statements.size()];
        Set<String> definedLater = new HashSet<>();
        for (int i = statements.size() - 1; i >= 0; i--) {
            List<String> names = statements.get(i).getDefinedVariableNames();
            required[i] = !names.isEmpty() && names.stream().noneMatch(definedLater::contains);
            definedLater.addAll(names);
        }
        return required;
    }

    public static boolean requiresOutputPort(List<Statement> statements, int position) {
        return requiredOutputs(statements)[position];
    }

    /**
     * 输出端口下标 -> 对应语句下标；越界时返回 -1
     */
    public static int statementIndexForOutput(List<Statement> statements, int portIndex) {
        if (portIndex < 0) return -1;
        boolean[] required = requiredOutputs(statements);
        int remaining = portIndex;
        for (int i = 0; i < required.length; i++) {
            if (required[i] && remaining-- == 0) {
                return i;
            }
        }
        return -1;
    }
}
