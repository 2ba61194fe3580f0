package org.fhir.bpmn.converter.bpmn;

import org.fhir.bpmn.converter.bpmn.models.BpmnGraph;
import org.fhir.bpmn.converter.bpmn.models.FlowNode;
import org.fhir.bpmn.converter.bpmn.models.SequenceFlow;
import org.fhir.bpmn.converter.layout.Bounds;
import org.fhir.bpmn.converter.layout.DiagramLayout;
import org.fhir.bpmn.converter.layout.EdgeLayout;
import org.fhir.bpmn.converter.layout.ShapeLayout;
import org.fhir.bpmn.converter.layout.Waypoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a finished graph and its layout as BPMN 2.0 XML text.
 */
public class BpmnXmlGenerator {
    public static final String BPMN_NS = "http://www.omg.org/spec/BPMN/20100524/MODEL";
    public static final String BPMNDI_NS = "http://www.omg.org/spec/BPMN/20100524/DI";
    public static final String DC_NS = "http://www.omg.org/spec/DD/20100524/DC";
    public static final String DI_NS = "http://www.omg.org/spec/DD/20100524/DI";
    public static final String XSI_NS = "http://www.w3.org/2001/XMLSchema-instance";
    public static final String TARGET_NS = "http://bpmn.io/schema/bpmn";

    private static final String XML_HEADER = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";
    private static final String DEFINITIONS_OPEN = "<bpmn:definitions " +
            "xmlns:bpmn=\"" + BPMN_NS + "\" " +
            "xmlns:bpmndi=\"" + BPMNDI_NS + "\" " +
            "xmlns:dc=\"" + DC_NS + "\" " +
            "xmlns:di=\"" + DI_NS + "\" " +
            "id=\"Definitions_1\" " +
            "targetNamespace=\"" + TARGET_NS + "\">";

    /**
     * Generates the BPMN document for one process.
     *
     * @param processId          id of the process element, also referenced by the diagram plane
     * @param processName        name of the process
     * @param processDescription process documentation, omitted when null or empty
     * @param graph              nodes and flows, emitted in creation order
     * @param layout             geometry for every node and flow of the graph
     * @return the XML text
     * @throws IllegalStateException if the layout misses a node or flow of the graph
     */
    public static String generate(String processId, String processName, String processDescription,
                                  BpmnGraph graph, DiagramLayout layout) {
        List<String> xml = new ArrayList<>();

        xml.add(XML_HEADER);
        xml.add(DEFINITIONS_OPEN);

        xml.add("  <bpmn:process id=\"" + escapeXml(processId) + "\" name=\"" + escapeXml(processName)
                + "\" isExecutable=\"true\">");
        if (processDescription != null && !processDescription.isEmpty()) {
            xml.add("    <bpmn:documentation>" + escapeXml(processDescription) + "</bpmn:documentation>");
        }
        for (FlowNode node : graph.nodesById().values()) {
            appendFlowNode(xml, node, "    ");
        }
        for (SequenceFlow flow : graph.flowsById().values()) {
            appendSequenceFlow(xml, flow, "    ");
        }
        xml.add("  </bpmn:process>");

        xml.add("  <bpmndi:BPMNDiagram id=\"BPMNDiagram_1\">");
        xml.add("    <bpmndi:BPMNPlane id=\"BPMNPlane_1\" bpmnElement=\"" + escapeXml(processId) + "\">");
        for (FlowNode node : graph.nodesById().values()) {
            ShapeLayout shape = layout.shapeFor(node.id());
            if (shape == null) {
                throw new IllegalStateException("No diagram shape for node '" + node.id() + "'");
            }
            appendShape(xml, shape, "      ");
        }
        for (SequenceFlow flow : graph.flowsById().values()) {
            EdgeLayout edge = layout.edgeFor(flow.id());
            if (edge == null) {
                throw new IllegalStateException("No diagram edge for sequence flow '" + flow.id() + "'");
            }
            appendEdge(xml, edge, "      ");
        }
        xml.add("    </bpmndi:BPMNPlane>");
        xml.add("  </bpmndi:BPMNDiagram>");
        xml.add("</bpmn:definitions>");

        return String.join("\n", xml);
    }

    /**
     * Minimal document with one empty, non executable process.
     * Shown in place of a diagram when a conversion fails.
     */
    public static String emptyDefinitions() {
        return XML_HEADER + "\n"
                + DEFINITIONS_OPEN + "\n"
                + "  <bpmn:process id=\"Process_1\" isExecutable=\"false\" />\n"
                + "</bpmn:definitions>";
    }

    private static void appendFlowNode(List<String> xml, FlowNode node, String indent) {
        String tag = "bpmn:" + node.type().xmlTag();

        xml.add(indent + "<" + tag + " id=\"" + escapeXml(node.id()) + "\" name=\"" + escapeXml(node.name()) + "\">");
        if (node.hasDocumentation()) {
            xml.add(indent + "  <bpmn:documentation>" + escapeXml(node.documentation()) + "</bpmn:documentation>");
        }
        for (String incoming : node.incoming()) {
            xml.add(indent + "  <bpmn:incoming>" + escapeXml(incoming) + "</bpmn:incoming>");
        }
        for (String outgoing : node.outgoing()) {
            xml.add(indent + "  <bpmn:outgoing>" + escapeXml(outgoing) + "</bpmn:outgoing>");
        }
        xml.add(indent + "</" + tag + ">");
    }

    private static void appendSequenceFlow(List<String> xml, SequenceFlow flow, String indent) {
        StringBuilder attrs = new StringBuilder()
                .append("id=\"").append(escapeXml(flow.id())).append("\" ")
                .append("sourceRef=\"").append(escapeXml(flow.sourceRef())).append("\" ")
                .append("targetRef=\"").append(escapeXml(flow.targetRef())).append("\"");
        if (flow.hasName()) {
            attrs.append(" name=\"").append(escapeXml(flow.name())).append("\"");
        }

        if (flow.hasCondition()) {
            xml.add(indent + "<bpmn:sequenceFlow " + attrs + ">");
            xml.add(indent + "  <bpmn:conditionExpression xsi:type=\"bpmn:tFormalExpression\" xmlns:xsi=\""
                    + XSI_NS + "\">" + escapeXml(flow.conditionExpression()) + "</bpmn:conditionExpression>");
            xml.add(indent + "</bpmn:sequenceFlow>");
        } else {
            xml.add(indent + "<bpmn:sequenceFlow " + attrs + " />");
        }
    }

    private static void appendShape(List<String> xml, ShapeLayout shape, String indent) {
        Bounds bounds = shape.bounds();
        xml.add(indent + "<bpmndi:BPMNShape id=\"" + escapeXml(shape.id()) + "\" bpmnElement=\""
                + escapeXml(shape.bpmnElement()) + "\">");
        xml.add(indent + "  <dc:Bounds x=\"" + bounds.x() + "\" y=\"" + bounds.y() + "\" width=\""
                + bounds.width() + "\" height=\"" + bounds.height() + "\" />");
        xml.add(indent + "</bpmndi:BPMNShape>");
    }

    private static void appendEdge(List<String> xml, EdgeLayout edge, String indent) {
        xml.add(indent + "<bpmndi:BPMNEdge id=\"" + escapeXml(edge.id()) + "\" bpmnElement=\""
                + escapeXml(edge.bpmnElement()) + "\">");
        for (Waypoint waypoint : edge.waypoints()) {
            xml.add(indent + "  <di:waypoint x=\"" + waypoint.x() + "\" y=\"" + waypoint.y() + "\" />");
        }
        xml.add(indent + "</bpmndi:BPMNEdge>");
    }

    /**
     * Escapes the five XML reserved characters. Null becomes the empty string.
     */
    public static String escapeXml(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&apos;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
