package org.refactor.codeblock.analysis;

import java.util.List;

public record PortPlan(List<PortSpec> inputs, List<PortSpec> outputs) {

    public static final PortPlan EMPTY = new PortPlan(List.of(), List.of());

    public PortPlan {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    public boolean isEmpty() {
        return inputs.isEmpty() && outputs.isEmpty();
    }
}
