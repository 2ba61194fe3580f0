package org.fhir.bpmn.converter.plandefinition;

import lombok.extern.slf4j.Slf4j;
import org.fhir.bpmn.converter.bpmn.BpmnFactory;
import org.fhir.bpmn.converter.plandefinition.models.Action;
import org.fhir.bpmn.converter.plandefinition.models.ActionCondition;
import org.fhir.bpmn.converter.plandefinition.models.TriggerDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static org.fhir.bpmn.converter.plandefinition.ActionDocumentationBuilder.firstWithText;
import static org.fhir.bpmn.converter.plandefinition.ActionDocumentationBuilder.hasText;
import static org.fhir.bpmn.converter.plandefinition.ActionDocumentationBuilder.isPresent;

/**
 * Turns a PlanDefinition action tree into a sequential chain of BPMN nodes.
 * <p>
 * Siblings are chained one after another and nested actions continue the chain from their
 * parent. A trigger becomes an intermediate catch event before the action, the first condition
 * becomes an exclusive gateway whose "Yes" flow leads to the action's task.
 * <p>
 * The factory is the only mutable state; the frontier node id is passed in and returned explicitly.
 */
@Slf4j
public class ActionWalker {
    public static final String NO_ACTIONS_WARNING = "PlanDefinition has no actions";

    private final BpmnFactory factory;
    private final List<String> warnings = new ArrayList<>();

    public ActionWalker(BpmnFactory factory) {
        this.factory = factory;
    }

    /**
     * Builds the whole process: start event, the top-level actions, end event.
     *
     * @param actions top-level actions, may be null
     * @return the id of the end event
     */
    public String walkProcess(List<Action> actions) {
        String startEventId = factory.createStartEvent();
        String lastElementId = startEventId;

        if (isPresent(actions)) {
            lastElementId = walk(actions, startEventId);
        } else {
            warn(NO_ACTIONS_WARNING);
        }

        String endEventId = factory.createEndEvent();
        factory.createSequenceFlow(lastElementId, endEventId);
        return endEventId;
    }

    /**
     * Chains the given actions after {@code predecessorId}.
     *
     * @param actions       sibling actions in execution order
     * @param predecessorId the current frontier node
     * @return the frontier node after the last action
     */
    public String walk(List<Action> actions, String predecessorId) {
        String lastElementId = predecessorId;

        for (int i = 0; i < actions.size(); i++) {
            Action action = actions.get(i);
            if (action == null) {
                action = new Action();
            }
            lastElementId = walkAction(action, i + 1, lastElementId);
        }

        return lastElementId;
    }

    private String walkAction(Action action, int position, String predecessorId) {
        String actionName = firstWithText(action.title, action.description);
        if (actionName == null) {
            actionName = "Action " + position;
        }
        String documentation = ActionDocumentationBuilder.compose(action);
        String lastElementId = predecessorId;

        if (isPresent(action.trigger)) {
            String eventId = factory.createIntermediateEvent("Trigger: " + triggerNames(action.trigger), documentation);
            factory.createSequenceFlow(lastElementId, eventId);
            lastElementId = eventId;
        }

        if (isPresent(action.condition)) {
            ActionCondition condition = action.condition.get(0);
            String expression = condition != null && condition.expression != null
                    ? condition.expression.expression
                    : null;

            String gatewayId = factory.createExclusiveGateway(
                    "Decision: " + (hasText(expression) ? expression : "Check Condition"));
            factory.createSequenceFlow(lastElementId, gatewayId);

            // only the branch taken when the condition holds is modelled
            String taskId = factory.createTask(actionName, documentation);
            factory.createSequenceFlow(gatewayId, taskId, expression, "Yes");
            lastElementId = taskId;

            if (isPresent(action.action)) {
                warn("Action '" + actionName + "' has a condition and nested actions; "
                        + "the nested actions are only modelled on the 'Yes' branch of " + gatewayId);
            }
        } else {
            String taskId = factory.createTask(actionName, documentation);
            factory.createSequenceFlow(lastElementId, taskId);
            lastElementId = taskId;
        }

        if (isPresent(action.action)) {
            lastElementId = walk(action.action, lastElementId);
        }

        return lastElementId;
    }

    private static String triggerNames(List<TriggerDefinition> triggers) {
        return triggers.stream()
                .filter(Objects::nonNull)
                .map(trigger -> firstWithText(trigger.name, trigger.type))
                .filter(Objects::nonNull)
                .collect(Collectors.joining(", "));
    }

    private void warn(String message) {
        log.warn(message);
        warnings.add(message);
    }

    /**
     * Warnings recorded so far, in the order they occurred.
     */
    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
