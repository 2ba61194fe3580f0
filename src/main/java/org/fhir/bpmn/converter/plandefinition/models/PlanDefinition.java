package org.fhir.bpmn.converter.plandefinition.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Root of a FHIR PlanDefinition resource, reduced to the fields the converter reads.
 * <p>
 * Example:
 * {
 * "resourceType": "PlanDefinition",
 * "id": "example-plan",
 * "title": "Patient Care Pathway",
 * "action": [...]
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlanDefinition {
    public static final String RESOURCE_TYPE = "PlanDefinition";

    /**
     * Must be "PlanDefinition".
     */
    public String resourceType;

    /**
     * Becomes the BPMN process id. Defaults to "Process_1".
     */
    public String id;

    /**
     * Becomes the BPMN process name. Defaults to "PlanDefinition Process".
     */
    public String title;

    /**
     * Becomes the process documentation.
     */
    public String description;

    /**
     * Top-level actions, executed one after another.
     */
    public List<Action> action;
}
