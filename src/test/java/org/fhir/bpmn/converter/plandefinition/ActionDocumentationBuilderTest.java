package org.fhir.bpmn.converter.plandefinition;

import org.fhir.bpmn.converter.plandefinition.models.Action;
import org.fhir.bpmn.converter.plandefinition.models.ActionCondition;
import org.fhir.bpmn.converter.plandefinition.models.CodeableConcept;
import org.fhir.bpmn.converter.plandefinition.models.Coding;
import org.fhir.bpmn.converter.plandefinition.models.DynamicValue;
import org.fhir.bpmn.converter.plandefinition.models.Expression;
import org.fhir.bpmn.converter.plandefinition.models.RelatedArtifact;
import org.fhir.bpmn.converter.plandefinition.models.TriggerDefinition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActionDocumentationBuilderTest {

    private static Expression expression(String language, String text) {
        Expression expression = new Expression();
        expression.language = language;
        expression.expression = text;
        return expression;
    }

    private static ActionCondition condition(Expression expression) {
        ActionCondition condition = new ActionCondition();
        condition.kind = "applicability";
        condition.expression = expression;
        return condition;
    }

    private static TriggerDefinition trigger(String type, String name) {
        TriggerDefinition trigger = new TriggerDefinition();
        trigger.type = type;
        trigger.name = name;
        return trigger;
    }

    private static Coding coding(String code, String display) {
        Coding coding = new Coding();
        coding.code = code;
        coding.display = display;
        return coding;
    }

    private static RelatedArtifact artifact(String display) {
        RelatedArtifact artifact = new RelatedArtifact();
        artifact.type = "documentation";
        artifact.display = display;
        return artifact;
    }

    @Test
    void shouldReturnEmptyForBareAction() {
        assertEquals("", ActionDocumentationBuilder.compose(new Action()));
    }

    @Test
    void shouldListAllFieldsInFixedOrder() {
        Action action = new Action();
        action.description = "Perform initial patient assessment";
        action.textEquivalent = "Assess the patient";
        action.type = new CodeableConcept();
        action.type.coding = List.of(coding("create", "Create"), coding("update", null));
        action.trigger = List.of(trigger("named-event", "patient-admitted"));
        action.condition = List.of(condition(expression("text/cql", "patient.age >= 18")));
        DynamicValue dynamicValue = new DynamicValue();
        dynamicValue.path = "dosage.text";
        dynamicValue.expression = expression("text/fhirpath", "'500 mg'");
        action.dynamicValue = List.of(dynamicValue);
        action.documentation = List.of(artifact("Adult care guideline"));

        assertEquals(String.join("\n",
                        "Description: Perform initial patient assessment",
                        "Text: Assess the patient",
                        "Type: Create, update",
                        "Triggers: named-event: patient-admitted",
                        "Condition 1: patient.age >= 18 (text/cql)",
                        "Dynamic Value 1: dosage.text = '500 mg' (text/fhirpath)",
                        "Documentation 1: Adult care guideline"),
                ActionDocumentationBuilder.compose(action));
    }

    @Test
    void shouldUseTriggerDefaults() {
        Action action = new Action();
        action.trigger = List.of(trigger(null, null), trigger("periodic", "daily"));

        assertEquals("Triggers: event: unnamed; periodic: daily", ActionDocumentationBuilder.compose(action));
    }

    @Test
    void shouldNumberEveryConditionAndUseDefaults() {
        Action action = new Action();
        action.condition = List.of(
                condition(expression(null, "a > 1")),
                condition(null),
                condition(expression("text/cql", null)));

        assertEquals(String.join("\n",
                        "Condition 1: a > 1",
                        "Condition 2: condition",
                        "Condition 3: condition (text/cql)"),
                ActionDocumentationBuilder.compose(action));
    }

    @Test
    void shouldUseDynamicValueDefaults() {
        Action action = new Action();
        action.dynamicValue = List.of(new DynamicValue());

        assertEquals("Dynamic Value 1: path = expression", ActionDocumentationBuilder.compose(action));
    }

    @Test
    void shouldSkipDocumentationWithoutDisplayButKeepPositions() {
        Action action = new Action();
        List<RelatedArtifact> documentation = new ArrayList<>();
        documentation.add(artifact(null));
        documentation.add(artifact("Second entry"));
        action.documentation = documentation;

        assertEquals("Documentation 2: Second entry", ActionDocumentationBuilder.compose(action));
    }

    @Test
    void shouldOmitTypeWhenNoCodingHasText() {
        Action action = new Action();
        action.type = new CodeableConcept();
        action.type.coding = List.of(coding(null, null));
        action.description = "";

        assertEquals("", ActionDocumentationBuilder.compose(action));
    }
}
