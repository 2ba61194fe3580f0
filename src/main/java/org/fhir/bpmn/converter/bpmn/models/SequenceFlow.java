package org.fhir.bpmn.converter.bpmn.models;

/**
 * Represents a BPMN SequenceFlow connecting two nodes of the process.
 *
 * @param id                  the unique identifier of the sequence flow
 * @param sourceRef           id of the node the flow leaves
 * @param targetRef           id of the node the flow enters
 * @param name                the label of the flow, null when unlabeled
 * @param conditionExpression the condition guarding the flow, null for unconditional flows
 */
public record SequenceFlow(
        String id,
        String sourceRef,
        String targetRef,
        String name,
        String conditionExpression
) {
    // Constructor for unconditional, unlabeled flows
    public SequenceFlow(String id, String sourceRef, String targetRef) {
        this(id, sourceRef, targetRef, null, null);
    }

    public boolean hasName() {
        return name != null && !name.isEmpty();
    }

    public boolean hasCondition() {
        return conditionExpression != null && !conditionExpression.isEmpty();
    }
}
