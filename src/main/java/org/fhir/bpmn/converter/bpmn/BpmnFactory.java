package org.fhir.bpmn.converter.bpmn;

import org.fhir.bpmn.converter.bpmn.models.BpmnGraph;
import org.fhir.bpmn.converter.bpmn.models.FlowNode;
import org.fhir.bpmn.converter.bpmn.models.FlowNodeType;
import org.fhir.bpmn.converter.bpmn.models.SequenceFlow;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the logical BPMN graph of one conversion.
 * Nodes and flows are only ever appended; a flow links itself into the outgoing list of its
 * source and the incoming list of its target. Not thread-safe, use one instance per conversion.
 */
public class BpmnFactory {
    private final Map<String, FlowNode> nodesById = new LinkedHashMap<>();
    private final Map<String, SequenceFlow> flowsById = new LinkedHashMap<>();
    private int elementCounter = 0;
    private int flowCounter = 0;

    /**
     * Generates a unique ID for flow nodes
     */
    private String generateId(FlowNodeType type) {
        return type.idPrefix() + "_" + (++elementCounter);
    }

    /**
     * Generates a unique ID for sequence flows
     */
    private String generateFlowId() {
        return "Flow_" + (++flowCounter);
    }

    private String addNode(FlowNodeType type, String name, String documentation) {
        String id = generateId(type);
        String doc = documentation == null || documentation.isEmpty() ? null : documentation;
        nodesById.put(id, new FlowNode(id, type, name, doc));
        return id;
    }

    public String createStartEvent() {
        return addNode(FlowNodeType.START_EVENT, "Start", null);
    }

    public String createEndEvent() {
        return addNode(FlowNodeType.END_EVENT, "End", null);
    }

    public String createTask(String name) {
        return createTask(name, null);
    }

    public String createTask(String name, String documentation) {
        return addNode(FlowNodeType.TASK, name, documentation);
    }

    /**
     * Creates an exclusive gateway (decision point)
     */
    public String createExclusiveGateway(String name) {
        return addNode(FlowNodeType.EXCLUSIVE_GATEWAY, name, null);
    }

    /**
     * Creates an intermediate catch event
     */
    public String createIntermediateEvent(String name, String documentation) {
        return addNode(FlowNodeType.INTERMEDIATE_CATCH_EVENT, name, documentation);
    }

    public String createSequenceFlow(String sourceId, String targetId) {
        return createSequenceFlow(sourceId, targetId, null, null);
    }

    /**
     * Creates a sequence flow between two existing nodes and links it into both of them.
     *
     * @param sourceId            id of a node created by this factory
     * @param targetId            id of a node created by this factory
     * @param conditionExpression condition guarding the flow, may be null
     * @param name                label of the flow, may be null
     * @return the id of the new flow
     * @throws IllegalArgumentException if either id was not issued by this factory
     * @throws IllegalStateException    if the flow would leave an end event or enter a start event
     */
    public String createSequenceFlow(String sourceId, String targetId, String conditionExpression, String name) {
        FlowNode source = requireNode(sourceId, "source");
        FlowNode target = requireNode(targetId, "target");

        if (source.type() == FlowNodeType.END_EVENT) {
            throw new IllegalStateException("End event '" + sourceId + "' cannot have outgoing flows");
        }
        if (target.type() == FlowNodeType.START_EVENT) {
            throw new IllegalStateException("Start event '" + targetId + "' cannot have incoming flows");
        }

        String id = generateFlowId();
        flowsById.put(id, new SequenceFlow(id, sourceId, targetId, emptyToNull(name),
                emptyToNull(conditionExpression)));

        source.outgoing().add(id);
        target.incoming().add(id);

        return id;
    }

    private FlowNode requireNode(String id, String role) {
        FlowNode node = id == null ? null : nodesById.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown " + role + " node '" + id + "' for sequence flow");
        }
        return node;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * Finds a node by ID, null if this factory never created it.
     * The returned node is a snapshot; flows are only linked through {@link #createSequenceFlow}.
     */
    public FlowNode getElementById(String id) {
        FlowNode node = id == null ? null : nodesById.get(id);
        return node == null ? null : node.frozen();
    }

    public int nodeCount() {
        return nodesById.size();
    }

    public int flowCount() {
        return flowsById.size();
    }

    /**
     * Snapshot of the graph built so far, with frozen flow reference lists.
     */
    public BpmnGraph build() {
        Map<String, FlowNode> frozen = new LinkedHashMap<>();
        nodesById.forEach((id, node) -> frozen.put(id, node.frozen()));
        return new BpmnGraph(frozen, flowsById);
    }
}
