package org.fhir.bpmn.converter.bpmn;

import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

public class BpmnValidator {

    /**
     * Validates generated BPMN XML against the BPMN 2.0 schema.
     * Throws an exception if invalid.
     */
    public static BpmnModelInstance validate(String bpmnXml) {
        if (bpmnXml == null || bpmnXml.isEmpty()) {
            throw new IllegalArgumentException("BPMN XML must not be empty");
        }

        BpmnModelInstance modelInstance = Bpmn.readModelFromStream(
                new ByteArrayInputStream(bpmnXml.getBytes(StandardCharsets.UTF_8)));
        Bpmn.validateModel(modelInstance);  // throws exception if invalid
        return modelInstance;
    }

    /**
     * Boolean-style validation.
     */
    public static boolean isValid(String bpmnXml) {
        try {
            validate(bpmnXml);
            return true;
        } catch (Exception e) {
            return false;
        }
    }
}
