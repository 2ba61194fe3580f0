package org.fhir.bpmn.converter.plandefinition.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Applicability condition of an action.
 * Example: {"kind": "applicability", "expression": {"language": "text/cql", "expression": "patient.age >= 18"}}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActionCondition {
    public String kind;
    public Expression expression;
}
