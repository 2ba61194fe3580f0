package org.fhir.bpmn.converter.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagram Interchange geometry of a graph, shapes keyed by node id and edges keyed by flow id.
 */
public record DiagramLayout(
        Map<String, ShapeLayout> shapesByElement,
        Map<String, EdgeLayout> edgesByElement
) {
    public DiagramLayout {
        shapesByElement = Collections.unmodifiableMap(new LinkedHashMap<>(shapesByElement));
        edgesByElement = Collections.unmodifiableMap(new LinkedHashMap<>(edgesByElement));
    }

    public ShapeLayout shapeFor(String nodeId) {
        return shapesByElement.get(nodeId);
    }

    public EdgeLayout edgeFor(String flowId) {
        return edgesByElement.get(flowId);
    }

    public List<ShapeLayout> shapes() {
        return new ArrayList<>(shapesByElement.values());
    }

    public List<EdgeLayout> edges() {
        return new ArrayList<>(edgesByElement.values());
    }
}
