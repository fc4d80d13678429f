package com.vision.flow.operator;

import com.vision.flow.api.OperatorExecutor;
import com.vision.flow.api.ParameterValidator;
import com.vision.flow.model.Connection;
import com.vision.flow.model.CycleCheck;
import com.vision.flow.model.Flow;
import com.vision.flow.model.Node;
import com.vision.flow.model.Port;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pre-flight check of a flow against a registry, for editors and callers that
 * want diagnostics before running.
 *
 * Errors: a cycle, an empty flow, a node type with no registered executor, a
 * node whose executor rejects its parameters. Warnings: no acquisition node
 * (every node has a connected required input), no terminal node.
 */
public final class FlowValidator {
    private final OperatorRegistry registry;

    public FlowValidator(OperatorRegistry registry) {
        this.registry = registry;
    }

    public FlowValidationReport validate(Flow flow) {
        Flow.Snapshot snapshot = flow.snapshot();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (snapshot.nodes().isEmpty()) {
            errors.add("Flow has no nodes");
            return new FlowValidationReport(errors, warnings);
        }

        CycleCheck cycle = snapshot.validate();
        if (!cycle.isAcyclic())
            errors.add("Flow contains a cycle: " + String.join(" -> ", cycle.cycle()));

        for (Node node : snapshot.nodes()) {
            OperatorExecutor executor = registry.find(node.type());
            if (executor == null) {
                errors.add(node.name() + ": no executor registered for type " + node.type());
                continue;
            }
            for (String error : ParameterValidator.check(executor, node).errors())
                errors.add(node.name() + ": " + error);
        }

        Map<String, Node> byId = new HashMap<>();
        for (Node node : snapshot.nodes())
            byId.put(node.id(), node);
        Set<String> fed = new HashSet<>();
        Set<String> feeding = new HashSet<>();
        for (Connection c : snapshot.connections()) {
            Node target = byId.get(c.targetNodeId());
            Port port = target == null ? null : target.input(c.targetPort());
            if (port != null && port.required())
                fed.add(c.targetNodeId());
            feeding.add(c.sourceNodeId());
        }
        boolean hasAcquisition = snapshot.nodes().stream().anyMatch(n -> !fed.contains(n.id()));
        if (!hasAcquisition)
            warnings.add("Flow has no acquisition node: every node waits on a connected input");
        boolean hasTerminal = snapshot.nodes().stream().anyMatch(n -> !feeding.contains(n.id()));
        if (!hasTerminal)
            warnings.add("Flow has no terminal node producing a result");

        return new FlowValidationReport(errors, warnings);
    }
}
