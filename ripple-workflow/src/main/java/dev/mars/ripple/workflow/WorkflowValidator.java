/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.ripple.workflow;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Semantic checks applied to every definition before it may become active.
 *
 * <p>Errors: blank id, a trigger type other than {@code event}, a blank trigger event,
 * a condition that does not parse, a timeout that is not positive or too large to
 * schedule, blank or duplicate action ids within a chain, a blank action type.
 * Warnings: a malformed placeholder (it fails the action when it is dispatched), an
 * error action reusing a main-chain action id, and an action type with no registered
 * handler, when an {@link ActionRegistry} is supplied.</p>
 */
public class WorkflowValidator {

    private final ConditionEvaluator conditionEvaluator;
    private final TemplateResolver templateResolver;
    private final ActionRegistry actionRegistry;

    public WorkflowValidator() {
        this(new ConditionEvaluator(), new TemplateResolver(), null);
    }

    public WorkflowValidator(ConditionEvaluator conditionEvaluator, TemplateResolver templateResolver,
                             ActionRegistry actionRegistry) {
        this.conditionEvaluator = Objects.requireNonNull(conditionEvaluator, "Condition evaluator cannot be null");
        this.templateResolver = Objects.requireNonNull(templateResolver, "Template resolver cannot be null");
        this.actionRegistry = actionRegistry;
    }

    public ValidationResult validate(WorkflowDefinition definition) {
        ValidationResult result = new ValidationResult();
        if (definition == null) {
            result.addError("Workflow definition is null");
            return result;
        }

        if (definition.getId().isBlank()) {
            result.addError("id", "Workflow id is required");
        }

        WorkflowDefinition.Trigger trigger = definition.getTrigger();
        if (!WorkflowDefinition.Trigger.EVENT_TRIGGER.equals(trigger.getType())) {
            result.addError("trigger.type", "Unsupported trigger type '" + trigger.getType() + "'");
        }
        if (trigger.getEvent().isBlank()) {
            result.addError("trigger.event", "Trigger event is required");
        }
        trigger.getCondition()
                .flatMap(conditionEvaluator::validate)
                .ifPresent(problem -> result.addError("trigger.condition", problem));

        definition.getTimeout().ifPresent(timeout -> validateTimeout(timeout, result));

        validateChain("actions", definition.getActions(), result);
        definition.getErrorHandler().ifPresent(handler -> {
            validateChain("error_handler.actions", handler.getActions(), result);
            checkShadowedResults(definition.getActions(), handler.getActions(), result);
        });
        return result;
    }

    private static void validateTimeout(Duration timeout, ValidationResult result) {
        if (timeout.isNegative() || timeout.isZero()) {
            result.addError("timeout", "Timeout must be positive");
            return;
        }
        try {
            timeout.toNanos();
        } catch (ArithmeticException e) {
            result.addError("timeout", "Timeout " + timeout + " is too large");
        }
    }

    /**
     * Error actions record into the same {@code results} map as the main chain, so reusing a
     * main-chain id hides that action's result from later error actions.
     */
    private static void checkShadowedResults(List<ActionSpec> mainActions, List<ActionSpec> errorActions,
                                             ValidationResult result) {
        Set<String> mainIds = new HashSet<>();
        for (ActionSpec action : mainActions) {
            mainIds.add(action.getId());
        }
        for (int i = 0; i < errorActions.size(); i++) {
            String id = errorActions.get(i).getId();
            if (!id.isBlank() && mainIds.contains(id)) {
                result.addWarning("error_handler.actions[" + i + "].id",
                        "Action id '" + id + "' is also used in actions; its error-chain result replaces results." + id);
            }
        }
    }

    private void validateChain(String chainPath, List<ActionSpec> actions, ValidationResult result) {
        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < actions.size(); i++) {
            ActionSpec action = actions.get(i);
            String path = chainPath + "[" + i + "]";

            if (action.getId().isBlank()) {
                result.addError(path + ".id", "Action id is required");
            } else if (!seenIds.add(action.getId())) {
                result.addError(path + ".id", "Duplicate action id '" + action.getId() + "'");
            }

            if (action.getType().isBlank()) {
                result.addError(path + ".type", "Action type is required");
            } else if (actionRegistry != null && !actionRegistry.isRegistered(action.getType())) {
                result.addWarning(path + ".type", "No handler registered for action type '" + action.getType() + "'");
            }

            checkTemplate(path + ".target", action.getTarget().orElse(null), result);
            checkTemplate(path + ".template", action.getTemplate().orElse(null), result);
            checkTemplate(path + ".channel", action.getChannel().orElse(null), result);
            for (Map.Entry<String, Object> entry : action.getData().entrySet()) {
                checkTemplateValue(path + ".data." + entry.getKey(), entry.getValue(), result);
            }
        }
    }

    private void checkTemplateValue(String path, Object value, ValidationResult result) {
        if (value instanceof String text) {
            checkTemplate(path, text, result);
        } else if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                checkTemplateValue(path + "." + entry.getKey(), entry.getValue(), result);
            }
        } else if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                checkTemplateValue(path + "[" + i + "]", list.get(i), result);
            }
        }
    }

    private void checkTemplate(String path, String template, ValidationResult result) {
        try {
            templateResolver.getPlaceholderPaths(template);
        } catch (TemplateException e) {
            result.addWarning(path, e.getMessage());
        }
    }
}
