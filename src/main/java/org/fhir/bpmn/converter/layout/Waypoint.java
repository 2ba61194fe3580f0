package org.fhir.bpmn.converter.layout;

public record Waypoint(int x, int y) {
}
