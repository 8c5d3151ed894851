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

import dev.mars.ripple.core.Event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-invocation scratch space: the triggering event, results of the actions run so far
 * (in execution order) and, once error handling starts, the error that caused it.
 *
 * <p>A context belongs to exactly one invocation and is never shared. The engine thread
 * is its only writer; the methods are synchronized so a handler thread that outlives a
 * timeout can still take a consistent snapshot.</p>
 */
public class ExecutionContext {

    private final String invocationId;
    private final Event event;
    private final Map<String, ActionResult> results = new LinkedHashMap<>();
    private ErrorInfo error;

    public ExecutionContext(String invocationId, Event event) {
        this.invocationId = Objects.requireNonNull(invocationId, "Invocation id cannot be null");
        this.event = Objects.requireNonNull(event, "Event cannot be null");
    }

    public static ExecutionContext forEvent(Event event) {
        return new ExecutionContext(UUID.randomUUID().toString(), event);
    }

    public String getInvocationId() {
        return invocationId;
    }

    public Event getEvent() {
        return event;
    }

    public synchronized void recordResult(ActionResult result) {
        Objects.requireNonNull(result, "Result cannot be null");
        results.put(result.getActionId(), result);
    }

    /**
     * Snapshot of recorded results keyed by action id, in execution order.
     */
    public synchronized Map<String, ActionResult> getResults() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public synchronized Optional<ActionResult> getResult(String actionId) {
        return Optional.ofNullable(results.get(actionId));
    }

    public synchronized Optional<ErrorInfo> getError() {
        return Optional.ofNullable(error);
    }

    public synchronized void setError(ErrorInfo error) {
        this.error = error;
    }

    /**
     * Projects the context into the tree that placeholders and conditions walk:
     * <pre>
     * event   -> payload fields, plus type, timestamp, id and the raw payload
     * error   -> message, type, action_id (empty until error handling starts)
     * results -> action_id -> {action_id, status, output, error, error_type}
     * </pre>
     */
    public synchronized Map<String, Object> toTemplateScope() {
        Map<String, Object> eventView = new LinkedHashMap<>(event.getPayload());
        eventView.put("type", event.getType());
        eventView.put("timestamp", event.getTimestamp());
        eventView.put("id", event.getId());
        eventView.put("payload", event.getPayload());

        Map<String, Object> resultsView = new LinkedHashMap<>();
        for (Map.Entry<String, ActionResult> entry : results.entrySet()) {
            resultsView.put(entry.getKey(), entry.getValue().toTemplateView());
        }

        Map<String, Object> scope = new LinkedHashMap<>();
        scope.put("event", eventView);
        scope.put("results", resultsView);
        scope.put("error", error != null ? error.toTemplateView() : Map.of());
        return scope;
    }

    @Override
    public String toString() {
        return "ExecutionContext{" +
               "invocationId='" + invocationId + '\'' +
               ", eventType='" + event.getType() + '\'' +
               ", results=" + results.keySet() +
               (error != null ? ", error=" + error : "") +
               '}';
    }
}
