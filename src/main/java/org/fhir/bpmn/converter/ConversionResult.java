package org.fhir.bpmn.converter;

import org.fhir.bpmn.converter.bpmn.models.BpmnGraph;
import org.fhir.bpmn.converter.layout.DiagramLayout;

import java.util.List;

/**
 * Output of one conversion.
 *
 * @param processId id of the generated process
 * @param xml       the BPMN 2.0 document
 * @param graph     the process graph the document was rendered from
 * @param layout    diagram geometry of the graph
 * @param warnings  non fatal findings, e.g. a PlanDefinition without actions
 */
public record ConversionResult(
        String processId,
        String xml,
        BpmnGraph graph,
        DiagramLayout layout,
        List<String> warnings
) {
    public ConversionResult {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
