package org.fhir.bpmn.converter;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.fhir.bpmn.converter.bpmn.BpmnFactory;
import org.fhir.bpmn.converter.bpmn.BpmnValidator;
import org.fhir.bpmn.converter.bpmn.BpmnXmlGenerator;
import org.fhir.bpmn.converter.bpmn.models.BpmnGraph;
import org.fhir.bpmn.converter.config.ConverterConfig;
import org.fhir.bpmn.converter.layout.DiagramLayout;
import org.fhir.bpmn.converter.layout.HorizontalLayout;
import org.fhir.bpmn.converter.layout.LayoutStrategy;
import org.fhir.bpmn.converter.plandefinition.ActionWalker;
import org.fhir.bpmn.converter.plandefinition.PlanDefinitionHelper;
import org.fhir.bpmn.converter.plandefinition.models.PlanDefinition;

/**
 * Converts FHIR PlanDefinition documents to BPMN 2.0 XML.
 * <p>
 * Every call builds its graph in a fresh {@link BpmnFactory}, so one converter can be shared
 * between threads. The same input always yields the same XML.
 */
@Slf4j
public class PlanDefinitionToBpmnConverter {
    public static final String DEFAULT_PROCESS_ID = "Process_1";
    public static final String DEFAULT_PROCESS_NAME = "PlanDefinition Process";

    private final LayoutStrategy layoutStrategy;
    private final boolean validateOutput;

    public PlanDefinitionToBpmnConverter() {
        this(new ConverterConfig());
    }

    public PlanDefinitionToBpmnConverter(ConverterConfig config) {
        this(new HorizontalLayout(config.layout), config.validateOutput);
    }

    public PlanDefinitionToBpmnConverter(LayoutStrategy layoutStrategy, boolean validateOutput) {
        this.layoutStrategy = layoutStrategy;
        this.validateOutput = validateOutput;
    }

    /**
     * Converts PlanDefinition JSON text.
     *
     * @throws ConversionException if the text is not a valid PlanDefinition
     */
    public ConversionResult convert(String planDefinitionJson) {
        return convert(PlanDefinitionHelper.parse(planDefinitionJson));
    }

    /**
     * Converts an already parsed PlanDefinition document.
     *
     * @throws ConversionException if the document is not a valid PlanDefinition
     */
    public ConversionResult convert(JsonNode document) {
        PlanDefinitionHelper.validate(document);
        return convert(PlanDefinitionHelper.toPlanDefinition(document));
    }

    /**
     * Converts a bound PlanDefinition.
     *
     * @throws ConversionException if the resourceType is not "PlanDefinition", or output
     *                             validation is enabled and rejects the generated XML
     */
    public ConversionResult convert(PlanDefinition planDefinition) {
        if (planDefinition == null || !PlanDefinition.RESOURCE_TYPE.equals(planDefinition.resourceType)) {
            throw new ConversionException(ConversionException.Reason.INVALID_ROOT,
                    "Invalid PlanDefinition: resourceType must be \"PlanDefinition\"");
        }

        String processId = hasText(planDefinition.id) ? planDefinition.id : DEFAULT_PROCESS_ID;
        String processName = hasText(planDefinition.title) ? planDefinition.title : DEFAULT_PROCESS_NAME;

        BpmnFactory factory = new BpmnFactory();
        ActionWalker walker = new ActionWalker(factory);
        walker.walkProcess(planDefinition.action);
        BpmnGraph graph = factory.build();

        DiagramLayout layout = layoutStrategy.layout(graph);
        String xml = BpmnXmlGenerator.generate(processId, processName, planDefinition.description, graph, layout);
        log.debug("Converted PlanDefinition '{}' into {} nodes and {} sequence flows",
                processId, graph.nodesById().size(), graph.flowsById().size());

        if (validateOutput) {
            try {
                BpmnValidator.validate(xml);
            } catch (RuntimeException e) {
                throw new ConversionException(ConversionException.Reason.INVALID_OUTPUT,
                        "Generated BPMN for process '" + processId + "' is invalid: " + e.getMessage(), e);
            }
        }

        return new ConversionResult(processId, xml, graph, layout, walker.getWarnings());
    }

    /**
     * Shorthand returning only the XML text.
     */
    public String convertToXml(String planDefinitionJson) {
        return convert(planDefinitionJson).xml();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
