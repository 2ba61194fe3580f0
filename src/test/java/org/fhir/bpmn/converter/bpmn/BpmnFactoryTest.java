package org.fhir.bpmn.converter.bpmn;

import org.fhir.bpmn.converter.bpmn.models.BpmnGraph;
import org.fhir.bpmn.converter.bpmn.models.FlowNode;
import org.fhir.bpmn.converter.bpmn.models.FlowNodeType;
import org.fhir.bpmn.converter.bpmn.models.SequenceFlow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BpmnFactoryTest {

    @Test
    void shouldGeneratePrefixedIdsFromSharedCounter() {
        BpmnFactory factory = new BpmnFactory();

        assertEquals("StartEvent_1", factory.createStartEvent());
        assertEquals("IntermediateEvent_2", factory.createIntermediateEvent("Trigger: admitted", null));
        assertEquals("Gateway_3", factory.createExclusiveGateway("Decision: x"));
        assertEquals("Task_4", factory.createTask("Assess"));
        assertEquals("EndEvent_5", factory.createEndEvent());
    }

    @Test
    void shouldGenerateFlowIdsFromSeparateCounter() {
        BpmnFactory factory = new BpmnFactory();
        String start = factory.createStartEvent();
        String task = factory.createTask("Assess");
        String end = factory.createEndEvent();

        assertEquals("Flow_1", factory.createSequenceFlow(start, task));
        assertEquals("Flow_2", factory.createSequenceFlow(task, end));
    }

    @Test
    void shouldCreateNodesWithEmptyFlowLists() {
        BpmnFactory factory = new BpmnFactory();
        String task = factory.createTask("Assess", "Description: first look");

        FlowNode node = factory.getElementById(task);
        assertEquals(FlowNodeType.TASK, node.type());
        assertEquals("Assess", node.name());
        assertEquals("Description: first look", node.documentation());
        assertTrue(node.incoming().isEmpty());
        assertTrue(node.outgoing().isEmpty());
    }

    @Test
    void shouldTreatEmptyDocumentationAsAbsent() {
        BpmnFactory factory = new BpmnFactory();
        String task = factory.createTask("Assess", "");

        FlowNode node = factory.getElementById(task);
        assertNull(node.documentation());
        assertFalse(node.hasDocumentation());
    }

    @Test
    void shouldLinkFlowIntoSourceAndTarget() {
        BpmnFactory factory = new BpmnFactory();
        String start = factory.createStartEvent();
        String gateway = factory.createExclusiveGateway("Decision: ok");
        String task = factory.createTask("Treat");

        String toGateway = factory.createSequenceFlow(start, gateway);
        String toTask = factory.createSequenceFlow(gateway, task, "ok == true", "Yes");

        assertEquals(List.of(toGateway), factory.getElementById(start).outgoing());
        assertEquals(List.of(toGateway), factory.getElementById(gateway).incoming());
        assertEquals(List.of(toTask), factory.getElementById(gateway).outgoing());
        assertEquals(List.of(toTask), factory.getElementById(task).incoming());
    }

    @Test
    void shouldKeepConditionAndNameOnFlow() {
        BpmnFactory factory = new BpmnFactory();
        String gateway = factory.createExclusiveGateway("Decision: ok");
        String task = factory.createTask("Treat");
        String flowId = factory.createSequenceFlow(gateway, task, "ok == true", "Yes");

        SequenceFlow flow = factory.build().flow(flowId);
        assertEquals(gateway, flow.sourceRef());
        assertEquals(task, flow.targetRef());
        assertEquals("Yes", flow.name());
        assertEquals("ok == true", flow.conditionExpression());
        assertTrue(flow.hasCondition());
    }

    @Test
    void shouldDropEmptyConditionAndName() {
        BpmnFactory factory = new BpmnFactory();
        String start = factory.createStartEvent();
        String task = factory.createTask("Treat");
        String flowId = factory.createSequenceFlow(start, task, "", "");

        SequenceFlow flow = factory.build().flow(flowId);
        assertFalse(flow.hasCondition());
        assertFalse(flow.hasName());
    }

    @Test
    void shouldRejectFlowToUnknownNode() {
        BpmnFactory factory = new BpmnFactory();
        String start = factory.createStartEvent();

        assertThrows(IllegalArgumentException.class, () -> factory.createSequenceFlow(start, "Task_99"));
        assertThrows(IllegalArgumentException.class, () -> factory.createSequenceFlow(null, start));
        assertEquals(0, factory.flowCount());
    }

    @Test
    void shouldRejectFlowIntoStartEventOrOutOfEndEvent() {
        BpmnFactory factory = new BpmnFactory();
        String start = factory.createStartEvent();
        String task = factory.createTask("Treat");
        String end = factory.createEndEvent();

        assertThrows(IllegalStateException.class, () -> factory.createSequenceFlow(task, start));
        assertThrows(IllegalStateException.class, () -> factory.createSequenceFlow(end, task));
        assertTrue(factory.getElementById(start).incoming().isEmpty());
        assertTrue(factory.getElementById(end).outgoing().isEmpty());
    }

    @Test
    void shouldNotExposeLiveFlowLists() {
        BpmnFactory factory = new BpmnFactory();
        String start = factory.createStartEvent();
        String task = factory.createTask("Treat");
        String flow = factory.createSequenceFlow(start, task);

        FlowNode looked = factory.getElementById(start);
        assertThrows(UnsupportedOperationException.class, () -> looked.outgoing().add("Flow_9"));
        assertThrows(UnsupportedOperationException.class, () -> factory.getElementById(task).incoming().clear());

        assertEquals(List.of(flow), factory.build().node(start).outgoing());
        assertEquals(List.of(flow), factory.build().node(task).incoming());
        assertNull(factory.getElementById("Task_99"));
        assertNull(factory.getElementById(null));
    }

    @Test
    void shouldBuildFrozenSnapshotInCreationOrder() {
        BpmnFactory factory = new BpmnFactory();
        String start = factory.createStartEvent();
        String task = factory.createTask("Treat");
        factory.createSequenceFlow(start, task);

        BpmnGraph graph = factory.build();

        assertEquals(List.of(start, task), graph.nodes().stream().map(FlowNode::id).toList());
        assertThrows(UnsupportedOperationException.class, () -> graph.node(start).outgoing().add("Flow_9"));

        // later factory changes do not leak into the snapshot
        String end = factory.createEndEvent();
        factory.createSequenceFlow(task, end);
        assertEquals(2, graph.nodes().size());
        assertEquals(1, graph.flows().size());
        assertEquals(1, graph.node(task).outgoing().size() + graph.node(task).incoming().size());
    }
}
