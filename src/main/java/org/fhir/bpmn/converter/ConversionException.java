package org.fhir.bpmn.converter;

/**
 * Aborts a PlanDefinition conversion. No partial output exists when this is thrown.
 */
public class ConversionException extends RuntimeException {

    public enum Reason {
        /**
         * The document is not a JSON object or its resourceType is not "PlanDefinition".
         */
        INVALID_ROOT,
        /**
         * The JSON could not be parsed or does not match the PlanDefinition schema.
         */
        MALFORMED_INPUT,
        /**
         * The generated BPMN was rejected by model validation.
         */
        INVALID_OUTPUT
    }

    private final Reason reason;

    public ConversionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ConversionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
