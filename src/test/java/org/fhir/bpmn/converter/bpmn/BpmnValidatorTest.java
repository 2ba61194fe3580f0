package org.fhir.bpmn.converter.bpmn;

import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.bpmn.instance.ExclusiveGateway;
import org.camunda.bpm.model.bpmn.instance.SequenceFlow;
import org.camunda.bpm.model.bpmn.instance.Task;
import org.fhir.bpmn.converter.bpmn.models.BpmnGraph;
import org.fhir.bpmn.converter.layout.HorizontalLayout;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BpmnValidatorTest {

    private static String generatedXml() {
        BpmnFactory factory = new BpmnFactory();
        String start = factory.createStartEvent();
        String event = factory.createIntermediateEvent("Trigger: admitted", "Triggers: named-event: admitted");
        String gateway = factory.createExclusiveGateway("Decision: patient.age >= 18");
        String task = factory.createTask("A & B <test>", "Description: it's \"quoted\"");
        String end = factory.createEndEvent();
        factory.createSequenceFlow(start, event);
        factory.createSequenceFlow(event, gateway);
        factory.createSequenceFlow(gateway, task, "patient.age >= 18", "Yes");
        factory.createSequenceFlow(task, end);
        BpmnGraph graph = factory.build();
        return BpmnXmlGenerator.generate("Process_1", "Care", "Adult pathway", graph,
                new HorizontalLayout().layout(graph));
    }

    @Test
    void shouldValidateWhenValid() {
        String xml = generatedXml();
        assertDoesNotThrow(() -> BpmnValidator.validate(xml));
        assertTrue(BpmnValidator.isValid(xml));
    }

    @Test
    void shouldThrowWhenInvalid() {
        assertThrows(Exception.class, () -> BpmnValidator.validate("<bpmn:definitions"));
        assertFalse(BpmnValidator.isValid("not xml at all"));
    }

    @Test
    void shouldRejectEmptyInput() {
        assertThrows(IllegalArgumentException.class, () -> BpmnValidator.validate(""));
    }

    @Test
    void shouldAcceptFallbackDocument() {
        assertTrue(BpmnValidator.isValid(BpmnXmlGenerator.emptyDefinitions()));
    }

    @Test
    void shouldReadBackUnescapedValues() {
        BpmnModelInstance model = BpmnValidator.validate(generatedXml());

        Task task = model.getModelElementById("Task_4");
        assertEquals("A & B <test>", task.getName());

        ExclusiveGateway gateway = model.getModelElementById("Gateway_3");
        assertEquals(1, gateway.getOutgoing().size());

        SequenceFlow yes = model.getModelElementById("Flow_3");
        assertEquals("Yes", yes.getName());
        assertEquals("patient.age >= 18", yes.getConditionExpression().getTextContent());
        assertEquals("Task_4", yes.getTarget().getId());
    }
}
