package org.fhir.bpmn.converter.layout;

import org.fhir.bpmn.converter.bpmn.models.BpmnGraph;
import org.fhir.bpmn.converter.bpmn.models.FlowNode;
import org.fhir.bpmn.converter.bpmn.models.SequenceFlow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Places all nodes in a single lane, left to right in creation order, vertically centred on
 * {@link LayoutSettings#centerY}. Edges run from the right-edge centre of the source shape to the
 * left-edge centre of the target shape.
 */
public class HorizontalLayout implements LayoutStrategy {
    private final LayoutSettings settings;

    public HorizontalLayout() {
        this(new LayoutSettings());
    }

    public HorizontalLayout(LayoutSettings settings) {
        settings.validate();
        this.settings = settings;
    }

    @Override
    public DiagramLayout layout(BpmnGraph graph) {
        Map<String, ShapeLayout> shapes = new LinkedHashMap<>();
        int currentX = settings.startX;

        for (FlowNode node : graph.nodesById().values()) {
            int width = settings.widthOf(node.type());
            int height = settings.heightOf(node.type());
            Bounds bounds = new Bounds(currentX, settings.centerY - height / 2, width, height);
            shapes.put(node.id(), new ShapeLayout(node.id(), bounds));

            currentX += width + settings.horizontalSpacing;
        }

        Map<String, EdgeLayout> edges = new LinkedHashMap<>();
        for (SequenceFlow flow : graph.flowsById().values()) {
            Bounds source = requireShape(shapes, flow.sourceRef(), flow).bounds();
            Bounds target = requireShape(shapes, flow.targetRef(), flow).bounds();
            edges.put(flow.id(), new EdgeLayout(flow.id(), List.of(source.rightCenter(), target.leftCenter())));
        }

        return new DiagramLayout(shapes, edges);
    }

    private static ShapeLayout requireShape(Map<String, ShapeLayout> shapes, String nodeId, SequenceFlow flow) {
        ShapeLayout shape = shapes.get(nodeId);
        if (shape == null) {
            throw new IllegalStateException("Sequence flow '" + flow.id() + "' references node '" + nodeId
                    + "' which is not part of the graph");
        }
        return shape;
    }
}
