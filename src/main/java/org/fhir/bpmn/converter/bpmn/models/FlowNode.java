package org.fhir.bpmn.converter.bpmn.models;

import lombok.Builder;

import java.util.ArrayList;
import java.util.List;

@Builder
public record FlowNode(
        String id,
        FlowNodeType type,
        String name,
        String documentation,  // null when the node has no annotation
        List<String> incoming, // sequence flow ids, filled only by flow linking
        List<String> outgoing
) {
    public FlowNode {
        if (incoming == null) {
            incoming = new ArrayList<>();
        }
        if (outgoing == null) {
            outgoing = new ArrayList<>();
        }
    }

    public FlowNode(String id, FlowNodeType type, String name, String documentation) {
        this(id, type, name, documentation, new ArrayList<>(), new ArrayList<>());
    }

    public boolean hasDocumentation() {
        return documentation != null && !documentation.isEmpty();
    }

    /**
     * Copy of this node whose flow reference lists can no longer change.
     */
    public FlowNode frozen() {
        return FlowNode.builder()
                .id(id)
                .type(type)
                .name(name)
                .documentation(documentation)
                .incoming(List.copyOf(incoming))
                .outgoing(List.copyOf(outgoing))
                .build();
    }
}
