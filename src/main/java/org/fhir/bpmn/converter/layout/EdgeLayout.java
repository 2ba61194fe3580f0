package org.fhir.bpmn.converter.layout;

import java.util.List;

/**
 * Diagram edge of one sequence flow, waypoints in drawing order.
 */
public record EdgeLayout(String id, String bpmnElement, List<Waypoint> waypoints) {

    public EdgeLayout {
        waypoints = List.copyOf(waypoints);
    }

    public EdgeLayout(String bpmnElement, List<Waypoint> waypoints) {
        this(bpmnElement + "_di", bpmnElement, waypoints);
    }
}
