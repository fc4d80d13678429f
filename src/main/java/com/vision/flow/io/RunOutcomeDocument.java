package com.vision.flow.io;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.vision.flow.engine.NodeStatusEntry;
import com.vision.flow.engine.RunOutcome;
import com.vision.flow.model.ImageFrame;
import com.vision.flow.model.Point;
import com.vision.flow.model.PortValue;

import lombok.Data;

/**
 * JSON form of a {@link RunOutcome}.
 *
 * Output values are rendered for reading, not for replay: images become a
 * {@code "image WxHxC"} summary, point sets a list of {@code {x, y}} objects.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RunOutcomeDocument {
    private String runId, flowId, flowName, status, failure, failedNodeId, errorMessage;
    private Instant startedAt, finishedAt;
    private long durationMs;
    private List<NodeDoc> nodes;
    private Map<String, Object> outputs;

    /** One node row. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class NodeDoc {
        private String nodeId, status, failure, errorMessage;
        private Instant startedAt;
        private long durationMs;
    }

    public static RunOutcomeDocument from(RunOutcome outcome) {
        RunOutcomeDocument doc = new RunOutcomeDocument();
        doc.setRunId(outcome.runId());
        doc.setFlowId(outcome.flowId());
        doc.setFlowName(outcome.flowName());
        doc.setStatus(outcome.status().name());
        doc.setFailure(outcome.failure() == null ? null : outcome.failure().name());
        doc.setFailedNodeId(outcome.failedNodeId());
        doc.setErrorMessage(outcome.errorMessage());
        doc.setStartedAt(outcome.startedAt());
        doc.setFinishedAt(outcome.finishedAt());
        doc.setDurationMs(outcome.durationMs());

        List<NodeDoc> nodes = new ArrayList<>();
        for (NodeStatusEntry e : outcome.nodes().values()) {
            NodeDoc nd = new NodeDoc();
            nd.setNodeId(e.nodeId());
            nd.setStatus(e.status().name());
            nd.setFailure(e.failure() == null ? null : e.failure().name());
            nd.setErrorMessage(e.errorMessage());
            nd.setStartedAt(e.startedAt());
            nd.setDurationMs(e.durationMs());
            nodes.add(nd);
        }
        doc.setNodes(nodes);

        Map<String, Object> outputs = new LinkedHashMap<>();
        for (Map.Entry<String, PortValue> e : outcome.outputs().entrySet())
            outputs.put(e.getKey(), render(e.getValue()));
        doc.setOutputs(outputs);
        return doc;
    }

    static Object render(PortValue value) {
        return switch (value.type()) {
            case IMAGE -> {
                ImageFrame f = value.asImage();
                yield "image " + f.width() + "x" + f.height() + "x" + f.channels();
            }
            case SCALAR -> value.asScalar();
            case POINT_SET -> {
                List<Map<String, Double>> points = new ArrayList<>();
                for (Point p : value.asPoints())
                    points.add(Map.of("x", p.x(), "y", p.y()));
                yield points;
            }
            case TEXT -> value.asText();
            case BOOLEAN -> value.asBoolean();
            case ANY -> String.valueOf(value.payload());
        };
    }
}
