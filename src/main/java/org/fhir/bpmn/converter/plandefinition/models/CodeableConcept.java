package org.fhir.bpmn.converter.plandefinition.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CodeableConcept {
    public List<Coding> coding;
}
