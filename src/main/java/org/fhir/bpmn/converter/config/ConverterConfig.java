package org.fhir.bpmn.converter.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.fhir.bpmn.converter.layout.LayoutSettings;

/**
 * Root configuration file structure.
 * <p>
 * Example from converter-config.json:
 * {
 * "layout": {"startX": 100, "centerY": 150, "horizontalSpacing": 180},
 * "validateOutput": false,
 * "writeFallbackOnError": false
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConverterConfig {
    /**
     * Geometry of the generated diagram.
     */
    public LayoutSettings layout = new LayoutSettings();

    /**
     * Run BPMN model validation on every generated document.
     */
    public boolean validateOutput;

    /**
     * Command line only: write an empty diagram when the conversion fails.
     */
    public boolean writeFallbackOnError;
}
