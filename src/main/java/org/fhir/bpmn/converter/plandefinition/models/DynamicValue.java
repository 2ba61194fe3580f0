package org.fhir.bpmn.converter.plandefinition.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Value computed when the action is applied.
 * Example: {"path": "dosage.text", "expression": {"language": "text/fhirpath", "expression": "'500 mg'"}}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DynamicValue {
    public String path;
    public Expression expression;
}
