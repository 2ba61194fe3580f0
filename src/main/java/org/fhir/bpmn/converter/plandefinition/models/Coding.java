package org.fhir.bpmn.converter.plandefinition.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Example: {"system": "http://terminology.hl7.org/CodeSystem/action-type", "code": "create", "display": "Create"}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Coding {
    public String system;
    public String code;
    public String display;
}
