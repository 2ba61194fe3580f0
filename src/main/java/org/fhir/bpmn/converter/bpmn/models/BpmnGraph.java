package org.fhir.bpmn.converter.bpmn.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A finished process graph. Both maps keep creation order.
 */
public record BpmnGraph(
        Map<String, FlowNode> nodesById,
        Map<String, SequenceFlow> flowsById
) {
    public BpmnGraph {
        nodesById = Collections.unmodifiableMap(new LinkedHashMap<>(nodesById));
        flowsById = Collections.unmodifiableMap(new LinkedHashMap<>(flowsById));
    }

    public List<FlowNode> nodes() {
        return new ArrayList<>(nodesById.values());
    }

    public List<SequenceFlow> flows() {
        return new ArrayList<>(flowsById.values());
    }

    public List<FlowNode> nodesOfType(FlowNodeType type) {
        return nodesById.values().stream()
                .filter(node -> node.type() == type)
                .toList();
    }

    public FlowNode node(String id) {
        return nodesById.get(id);
    }

    public SequenceFlow flow(String id) {
        return flowsById.get(id);
    }
}
