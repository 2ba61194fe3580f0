package org.fhir.bpmn.converter.bpmn.models;

/**
 * The BPMN flow node kinds the converter emits.
 * Each kind carries the XML tag used in the process section and the prefix of its generated ids.
 */
public enum FlowNodeType {
    START_EVENT("startEvent", "StartEvent"),
    END_EVENT("endEvent", "EndEvent"),
    INTERMEDIATE_CATCH_EVENT("intermediateCatchEvent", "IntermediateEvent"),
    TASK("task", "Task"),
    EXCLUSIVE_GATEWAY("exclusiveGateway", "Gateway");

    private final String xmlTag;
    private final String idPrefix;

    FlowNodeType(String xmlTag, String idPrefix) {
        this.xmlTag = xmlTag;
        this.idPrefix = idPrefix;
    }

    public String xmlTag() {
        return xmlTag;
    }

    public String idPrefix() {
        return idPrefix;
    }

    public boolean isEvent() {
        return this == START_EVENT || this == END_EVENT || this == INTERMEDIATE_CATCH_EVENT;
    }
}
