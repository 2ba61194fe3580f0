package org.fhir.bpmn.converter.plandefinition;

import org.fhir.bpmn.converter.plandefinition.models.Action;
import org.fhir.bpmn.converter.plandefinition.models.ActionCondition;
import org.fhir.bpmn.converter.plandefinition.models.Coding;
import org.fhir.bpmn.converter.plandefinition.models.DynamicValue;
import org.fhir.bpmn.converter.plandefinition.models.Expression;
import org.fhir.bpmn.converter.plandefinition.models.RelatedArtifact;
import org.fhir.bpmn.converter.plandefinition.models.TriggerDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public class ActionDocumentationBuilder {

    /**
     * Builds the annotation text of one action from its descriptive fields.
     * One "Label: value" line per present field, in the order description, text equivalent, type,
     * triggers, conditions, dynamic values, documentation entries.
     *
     * @param action the action to describe
     * @return newline separated lines, empty when the action has nothing to describe
     */
    public static String compose(Action action) {
        List<String> docParts = new ArrayList<>();

        if (hasText(action.description)) {
            docParts.add("Description: " + action.description);
        }

        if (hasText(action.textEquivalent)) {
            docParts.add("Text: " + action.textEquivalent);
        }

        if (action.type != null && isPresent(action.type.coding)) {
            String types = action.type.coding.stream()
                    .filter(Objects::nonNull)
                    .map(coding -> firstWithText(coding.display, coding.code))
                    .filter(ActionDocumentationBuilder::hasText)
                    .collect(Collectors.joining(", "));
            if (!types.isEmpty()) {
                docParts.add("Type: " + types);
            }
        }

        if (isPresent(action.trigger)) {
            String triggers = action.trigger.stream()
                    .filter(Objects::nonNull)
                    .map(ActionDocumentationBuilder::describeTrigger)
                    .collect(Collectors.joining("; "));
            if (!triggers.isEmpty()) {
                docParts.add("Triggers: " + triggers);
            }
        }

        if (isPresent(action.condition)) {
            for (int i = 0; i < action.condition.size(); i++) {
                ActionCondition condition = action.condition.get(i);
                Expression expression = condition == null ? null : condition.expression;
                docParts.add("Condition " + (i + 1) + ": "
                        + orDefault(expressionText(expression), "condition")
                        + languageSuffix(expression));
            }
        }

        if (isPresent(action.dynamicValue)) {
            for (int i = 0; i < action.dynamicValue.size(); i++) {
                DynamicValue dynamicValue = action.dynamicValue.get(i);
                String path = dynamicValue == null ? null : dynamicValue.path;
                Expression expression = dynamicValue == null ? null : dynamicValue.expression;
                docParts.add("Dynamic Value " + (i + 1) + ": " + orDefault(path, "path") + " = "
                        + orDefault(expressionText(expression), "expression")
                        + languageSuffix(expression));
            }
        }

        if (isPresent(action.documentation)) {
            for (int i = 0; i < action.documentation.size(); i++) {
                RelatedArtifact doc = action.documentation.get(i);
                // numbering follows the entry's position, skipped entries leave gaps
                if (doc != null && hasText(doc.display)) {
                    docParts.add("Documentation " + (i + 1) + ": " + doc.display);
                }
            }
        }

        return String.join("\n", docParts);
    }

    private static String describeTrigger(TriggerDefinition trigger) {
        return orDefault(trigger.type, "event") + ": " + orDefault(trigger.name, "unnamed");
    }

    private static String expressionText(Expression expression) {
        return expression == null ? null : expression.expression;
    }

    private static String languageSuffix(Expression expression) {
        if (expression == null || !hasText(expression.language)) {
            return "";
        }
        return " (" + expression.language + ")";
    }

    static String firstWithText(String... values) {
        for (String value : values) {
            if (hasText(value)) {
                return value;
            }
        }
        return null;
    }

    static String orDefault(String value, String fallback) {
        return hasText(value) ? value : fallback;
    }

    static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    static boolean isPresent(List<?> values) {
        return values != null && !values.isEmpty();
    }
}
