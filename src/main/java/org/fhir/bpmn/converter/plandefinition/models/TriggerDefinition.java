package org.fhir.bpmn.converter.plandefinition.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Event that starts an action.
 * Example: {"type": "named-event", "name": "patient-admitted"}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TriggerDefinition {
    public String type;
    public String name;
}
