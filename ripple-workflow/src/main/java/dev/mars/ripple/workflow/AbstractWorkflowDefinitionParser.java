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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Shared mapping from a generic document tree (maps, lists, scalars) to a
 * {@link WorkflowDefinition}. Subclasses only provide {@link #readTree(String)} for
 * their format.
 *
 * <p>Document shape:</p>
 * <pre>
 * id            required
 * name, description, version, timeout
 * trigger       required: {type: "event", event: required, condition}
 * actions       required list of {id, type, target, template, channel, data}
 * error_handler optional: {actions: [...]}
 * </pre>
 * Unknown fields are ignored.
 */
public abstract class AbstractWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private final WorkflowValidator validator;

    protected AbstractWorkflowDefinitionParser(WorkflowValidator validator) {
        this.validator = Objects.requireNonNull(validator, "Validator cannot be null");
    }

    /**
     * Reads the document into a tree; the root must be a mapping.
     */
    protected abstract Map<String, Object> readTree(String content) throws WorkflowParseException;

    @Override
    public WorkflowDefinition parse(Path file) throws WorkflowParseException {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read workflow file: " + file, e);
        }
        return parseFromString(content);
    }

    @Override
    public WorkflowDefinition parseFromString(String content) throws WorkflowParseException {
        if (content == null || content.isBlank()) {
            throw new WorkflowParseException("Workflow document is empty");
        }
        return toDefinition(readTree(content));
    }

    @Override
    public ValidationResult validate(WorkflowDefinition definition) {
        return validator.validate(definition);
    }

    @Override
    public ValidationResult validateSchema(String content) {
        ValidationResult result = new ValidationResult();
        Map<String, Object> tree;
        try {
            if (content == null || content.isBlank()) {
                result.addError("Workflow document is empty");
                return result;
            }
            tree = readTree(content);
        } catch (WorkflowParseException e) {
            result.addError(e.getMessage());
            return result;
        }

        if (isBlank(tree.get("id"))) {
            result.addError("id", "Required field 'id' is missing");
        }
        Object trigger = tree.get("trigger");
        if (!(trigger instanceof Map)) {
            result.addError("trigger", "Required field 'trigger' is missing or not an object");
        } else if (isBlank(((Map<?, ?>) trigger).get("event"))) {
            result.addError("trigger.event", "Required field 'trigger.event' is missing");
        }
        if (!(tree.get("actions") instanceof List)) {
            result.addError("actions", "Required field 'actions' is missing or not a list");
        }
        Object errorHandler = tree.get("error_handler");
        if (errorHandler != null && !(errorHandler instanceof Map)) {
            result.addError("error_handler", "Field 'error_handler' must be an object");
        }
        return result;
    }

    WorkflowDefinition toDefinition(Map<String, Object> tree) throws WorkflowParseException {
        String id = requiredString(tree, "id", null, "id");

        Map<String, Object> triggerMap = requiredMap(tree, "trigger", id, "trigger");
        WorkflowDefinition.Trigger trigger = new WorkflowDefinition.Trigger(
                optionalString(triggerMap, "type"),
                requiredString(triggerMap, "event", id, "trigger.event"),
                optionalString(triggerMap, "condition"));

        if (!(tree.get("actions") instanceof List)) {
            throw new WorkflowParseException(id, "actions", "Required list is missing");
        }
        List<ActionSpec> actions = parseActions(tree.get("actions"), id, "actions");

        WorkflowDefinition.ErrorHandler errorHandler = null;
        Object errorHandlerNode = tree.get("error_handler");
        if (errorHandlerNode != null) {
            if (!(errorHandlerNode instanceof Map)) {
                throw new WorkflowParseException(id, "error_handler", "Expected an object");
            }
            errorHandler = new WorkflowDefinition.ErrorHandler(
                    parseActions(((Map<?, ?>) errorHandlerNode).get("actions"), id, "error_handler.actions"));
        }

        return new WorkflowDefinition(
                id,
                optionalString(tree, "name"),
                optionalString(tree, "description"),
                optionalString(tree, "version"),
                trigger,
                actions,
                errorHandler,
                parseTimeout(tree.get("timeout"), id));
    }

    private List<ActionSpec> parseActions(Object node, String workflowId, String path) throws WorkflowParseException {
        if (node == null) {
            return List.of();
        }
        if (!(node instanceof List<?> list)) {
            throw new WorkflowParseException(workflowId, path, "Expected a list of actions");
        }
        List<ActionSpec> actions = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            String actionPath = path + "[" + i + "]";
            if (!(list.get(i) instanceof Map)) {
                throw new WorkflowParseException(workflowId, actionPath, "Expected an action object");
            }
            actions.add(parseAction(asMap(list.get(i)), workflowId, actionPath));
        }
        return actions;
    }

    private ActionSpec parseAction(Map<String, Object> node, String workflowId, String path) throws WorkflowParseException {
        Object data = node.get("data");
        if (data != null && !(data instanceof Map)) {
            throw new WorkflowParseException(workflowId, path + ".data", "Expected an object");
        }
        return new ActionSpec(
                requiredString(node, "id", workflowId, path + ".id"),
                requiredString(node, "type", workflowId, path + ".type"),
                optionalString(node, "target"),
                optionalString(node, "template"),
                optionalString(node, "channel"),
                data != null ? asMap(data) : Map.of());
    }

    /**
     * Accepts {@code "30s"}, {@code "5m"}, {@code "2h"}, {@code "1500ms"} or a plain number of seconds.
     */
    static Duration parseTimeout(Object value, String workflowId) throws WorkflowParseException {
        if (value == null) {
            return null;
        }
        Duration timeout;
        if (value instanceof Number number) {
            timeout = Duration.ofMillis(Math.round(number.doubleValue() * 1000));
        } else {
            timeout = parseTimeoutText(value.toString(), workflowId);
        }
        try {
            timeout.toNanos();
        } catch (ArithmeticException e) {
            throw new WorkflowParseException(workflowId, "timeout", "Duration '" + value + "' is too large", e);
        }
        return timeout;
    }

    private static Duration parseTimeoutText(String value, String workflowId) throws WorkflowParseException {
        String text = value.trim().toLowerCase(Locale.ROOT);
        try {
            if (text.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2).trim()));
            } else if (text.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(text.substring(0, text.length() - 1).trim()));
            } else if (text.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(text.substring(0, text.length() - 1).trim()));
            } else if (text.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(text.substring(0, text.length() - 1).trim()));
            }
            return Duration.ofSeconds(Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(workflowId, "timeout", "Invalid duration '" + value + "'", e);
        } catch (ArithmeticException e) {
            throw new WorkflowParseException(workflowId, "timeout", "Duration '" + value + "' is too large", e);
        }
    }

    private static String requiredString(Map<String, Object> node, String key, String workflowId, String path)
            throws WorkflowParseException {
        Object value = node.get(key);
        if (isBlank(value)) {
            throw new WorkflowParseException(workflowId, path, "Required field is missing");
        }
        if (value instanceof Map || value instanceof List) {
            throw new WorkflowParseException(workflowId, path, "Expected a string");
        }
        return value.toString();
    }

    private static Map<String, Object> requiredMap(Map<String, Object> node, String key, String workflowId, String path)
            throws WorkflowParseException {
        Object value = node.get(key);
        if (!(value instanceof Map)) {
            throw new WorkflowParseException(workflowId, path, "Required object is missing");
        }
        return asMap(value);
    }

    private static String optionalString(Map<String, Object> node, String key) {
        Object value = node.get(key);
        return value != null ? value.toString() : null;
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }
}
