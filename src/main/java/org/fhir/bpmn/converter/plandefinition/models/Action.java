package org.fhir.bpmn.converter.plandefinition.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One node of the PlanDefinition action tree.
 * Every field is optional; nested actions are held in {@link #action}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Action {
    public String id;
    public String title;
    public String description;

    /**
     * Human readable rendering of the action.
     * Example: "Schedule a follow-up visit in two weeks"
     */
    public String textEquivalent;

    public List<RelatedArtifact> documentation;
    public List<TriggerDefinition> trigger;
    public List<ActionCondition> condition;

    /**
     * Parsed but not interpreted; sibling order alone drives sequencing.
     */
    public List<RelatedAction> relatedAction;

    public CodeableConcept type;
    public List<DynamicValue> dynamicValue;
    public List<Action> action;
}
