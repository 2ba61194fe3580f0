package org.fhir.bpmn.converter.layout;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.fhir.bpmn.converter.bpmn.models.FlowNodeType;

/**
 * Geometry of the horizontal layout.
 * <p>
 * Example from converter-config.json:
 * {
 * "startX": 100,
 * "centerY": 150,
 * "horizontalSpacing": 180
 * }
 * Values missing from the file keep the defaults below.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LayoutSettings {

    /**
     * X coordinate of the first shape.
     */
    public int startX = 100;

    /**
     * Y coordinate of the line every shape is centred on.
     */
    public int centerY = 150;

    /**
     * Gap between the right edge of one shape and the left edge of the next.
     */
    public int horizontalSpacing = 180;

    public int taskWidth = 120;
    public int taskHeight = 80;
    public int gatewaySize = 50;
    public int eventSize = 36;

    public int widthOf(FlowNodeType type) {
        return switch (type) {
            case TASK -> taskWidth;
            case EXCLUSIVE_GATEWAY -> gatewaySize;
            case START_EVENT, END_EVENT, INTERMEDIATE_CATCH_EVENT -> eventSize;
        };
    }

    public int heightOf(FlowNodeType type) {
        return switch (type) {
            case TASK -> taskHeight;
            case EXCLUSIVE_GATEWAY -> gatewaySize;
            case START_EVENT, END_EVENT, INTERMEDIATE_CATCH_EVENT -> eventSize;
        };
    }

    /**
     * Throws if any dimension could not produce a drawable diagram.
     */
    public void validate() {
        if (taskWidth <= 0 || taskHeight <= 0 || gatewaySize <= 0 || eventSize <= 0) {
            throw new IllegalStateException("Layout shape sizes must be positive");
        }
        // heights are halved to centre shapes and waypoints on whole coordinates
        if (taskHeight % 2 != 0 || gatewaySize % 2 != 0 || eventSize % 2 != 0) {
            throw new IllegalStateException("Layout taskHeight, gatewaySize and eventSize must be even, was "
                    + taskHeight + ", " + gatewaySize + " and " + eventSize);
        }
        if (horizontalSpacing < 0) {
            throw new IllegalStateException("Layout horizontalSpacing must not be negative, was " + horizontalSpacing);
        }
    }
}
