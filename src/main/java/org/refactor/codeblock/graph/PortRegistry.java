package org.refactor.codeblock.graph;

import org.refactor.codeblock.analysis.PortSpec;

import java.util.List;

/**
 * 节点端口的注册接口。set* 只暂存，{@link #commitPorts()} 才原子地替换可见端口。
 */
public interface PortRegistry {

    List<PortSpec> getInputPorts();

    List<PortSpec> getOutputPorts();

    void setInputPorts(List<PortSpec> ports);

    void setOutputPorts(List<PortSpec> ports);

    void commitPorts();
}
