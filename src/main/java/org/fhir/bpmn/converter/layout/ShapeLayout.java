package org.fhir.bpmn.converter.layout;

/**
 * Diagram shape of one flow node.
 *
 * @param id          the DI id, {@code {bpmnElement}_di}
 * @param bpmnElement id of the flow node
 * @param bounds      position and size of the shape
 */
public record ShapeLayout(String id, String bpmnElement, Bounds bounds) {

    public ShapeLayout(String bpmnElement, Bounds bounds) {
        this(bpmnElement + "_di", bpmnElement, bounds);
    }
}
