package org.fhir.bpmn.converter.layout;

public record Bounds(int x, int y, int width, int height) {

    public Waypoint rightCenter() {
        return new Waypoint(x + width, y + height / 2);
    }

    public Waypoint leftCenter() {
        return new Waypoint(x, y + height / 2);
    }
}
