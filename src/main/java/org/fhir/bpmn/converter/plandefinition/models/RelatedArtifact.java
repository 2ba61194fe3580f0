package org.fhir.bpmn.converter.plandefinition.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Documentation entry of an action.
 * Example: {"type": "documentation", "display": "Local adult care guideline"}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RelatedArtifact {
    public String type;
    public String display;
}
