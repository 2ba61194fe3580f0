package org.fhir.bpmn.converter.plandefinition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;
import org.fhir.bpmn.converter.ConversionException;
import org.fhir.bpmn.converter.plandefinition.models.PlanDefinition;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads PlanDefinition JSON and checks it once at the boundary, before any graph is built.
 */
@Slf4j
public class PlanDefinitionHelper {
    public static final String SCHEMA_RESOURCE_PATH = "schema/plandefinition_schema.json";

    // a second value or stray text after the document is malformed input
    private static final ObjectMapper mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static JsonSchema schema;

    /**
     * Parses JSON text holding exactly one value into a tree.
     *
     * @throws ConversionException with reason MALFORMED_INPUT if the text is not JSON
     */
    public static JsonNode parse(String json) {
        if (json == null || json.trim().isEmpty()) {
            throw new ConversionException(ConversionException.Reason.MALFORMED_INPUT, "PlanDefinition JSON is empty");
        }
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConversionException(ConversionException.Reason.MALFORMED_INPUT,
                    "Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static String readFile(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /**
     * Checks the root first, then the whole document against the bundled schema.
     *
     * @throws ConversionException INVALID_ROOT for a non-object document or a wrong resourceType,
     *                             MALFORMED_INPUT for any schema violation
     */
    public static void validate(JsonNode document) {
        validateRoot(document);

        Set<ValidationMessage> result = getSchema().validate(document);
        if (!result.isEmpty()) {
            String details = result.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ConversionException(ConversionException.Reason.MALFORMED_INPUT,
                    "PlanDefinition JSON is invalid: " + details);
        }
    }

    /**
     * Checks only that the document is an object whose resourceType is "PlanDefinition".
     */
    public static void validateRoot(JsonNode document) {
        if (document == null || document.isNull() || document.isMissingNode() || !document.isObject()) {
            throw new ConversionException(ConversionException.Reason.INVALID_ROOT,
                    "Invalid PlanDefinition: document must be a JSON object");
        }
        JsonNode resourceType = document.get("resourceType");
        if (resourceType == null || !resourceType.isTextual()
                || !PlanDefinition.RESOURCE_TYPE.equals(resourceType.asText())) {
            throw new ConversionException(ConversionException.Reason.INVALID_ROOT,
                    "Invalid PlanDefinition: resourceType must be \"PlanDefinition\"");
        }
    }

    /**
     * Binds a validated document to the typed model.
     */
    public static PlanDefinition toPlanDefinition(JsonNode document) {
        try {
            return mapper.treeToValue(document, PlanDefinition.class);
        } catch (JsonProcessingException e) {
            throw new ConversionException(ConversionException.Reason.MALFORMED_INPUT,
                    "Cannot read PlanDefinition: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses, validates and binds in one step.
     */
    public static PlanDefinition load(String json) {
        JsonNode document = parse(json);
        validate(document);
        return toPlanDefinition(document);
    }

    private static synchronized JsonSchema getSchema() {
        if (schema == null) {
            ClassLoader cl = PlanDefinitionHelper.class.getClassLoader();
            try (InputStream schemaStream = cl.getResourceAsStream(SCHEMA_RESOURCE_PATH)) {
                if (schemaStream == null) {
                    throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE_PATH);
                }
                schema = factory.getSchema(mapper.readTree(schemaStream));
                log.debug("Loaded PlanDefinition schema from {}", SCHEMA_RESOURCE_PATH);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load schema resource: " + SCHEMA_RESOURCE_PATH, e);
            }
        }
        return schema;
    }
}
