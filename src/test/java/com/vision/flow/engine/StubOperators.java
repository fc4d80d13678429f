package com.vision.flow.engine;

import com.vision.flow.api.OperatorExecutor;
import com.vision.flow.api.ResolvedInputs;
import com.vision.flow.model.Node;
import com.vision.flow.model.PortDataType;
import com.vision.flow.model.PortValue;
import com.vision.flow.operator.AbstractOperatorExecutor;

import java.util.Map;

/** Small operators for scheduler tests. */
final class StubOperators {

    @FunctionalInterface
    interface Body {
        Map<String, PortValue> apply(Node node, ResolvedInputs inputs, CancellationSignal cancellation)
                throws Exception;
    }

    private StubOperators() {
    }

    static OperatorExecutor of(String type, Body body) {
        return new AbstractOperatorExecutor(type) {
            @Override
            protected Map<String, PortValue> process(Node node, ResolvedInputs inputs,
                    CancellationSignal cancellation) throws Exception {
                return body.apply(node, inputs, cancellation);
            }
        };
    }

    /** Emits its "value" parameter on "out". */
    static OperatorExecutor constant() {
        return of("constant", (node, in, c) -> Map.of("out", node.parameter("value")));
    }

    /** Sums every scalar input and adds one. */
    static OperatorExecutor increment() {
        return of("increment", (node, in, c) -> {
            double sum = 1;
            for (PortValue v : in.values().values())
                sum += v.asScalar();
            return Map.of("out", PortValue.scalar(sum));
        });
    }

    static OperatorExecutor failing(String message) {
        return of("failing", (node, in, c) -> {
            throw new IllegalStateException(message);
        });
    }

    static Node constantNode(String id, double value) {
        return Node.builder("constant").id(id)
                .output("out", PortDataType.SCALAR)
                .parameter("value", PortValue.scalar(value))
                .build();
    }

    /** A scalar node with the given required inputs and one output "out". */
    static Node scalarNode(String id, String type, String... inputs) {
        Node.Builder b = Node.builder(type).id(id).name(id);
        for (String in : inputs)
            b.input(in, PortDataType.SCALAR);
        return b.output("out", PortDataType.SCALAR).build();
    }
}
