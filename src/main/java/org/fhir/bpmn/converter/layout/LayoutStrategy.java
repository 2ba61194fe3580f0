package org.fhir.bpmn.converter.layout;

import org.fhir.bpmn.converter.bpmn.models.BpmnGraph;

/**
 * Assigns diagram geometry to a finished graph.
 * Implementations must give every node a shape and every flow an edge.
 */
public interface LayoutStrategy {

    DiagramLayout layout(BpmnGraph graph);
}
