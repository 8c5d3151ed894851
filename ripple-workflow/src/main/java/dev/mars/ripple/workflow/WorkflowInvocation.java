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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Audit record of one finished invocation: which definition ran for which event, the
 * terminal state, every action outcome and the total duration.
 */
public class WorkflowInvocation {

    private final String invocationId;
    private final String definitionId;
    private final String definitionVersion;
    private final Event event;
    private final InvocationState state;
    private final Instant startTime;
    private final Instant endTime;
    private final List<ActionResult> actionResults;
    private final List<ActionResult> errorHandlerResults;
    private final ErrorInfo error;

    public WorkflowInvocation(String invocationId, WorkflowDefinition definition, Event event,
                              InvocationState state, Instant startTime, Instant endTime,
                              List<ActionResult> actionResults, List<ActionResult> errorHandlerResults,
                              ErrorInfo error) {
        this.invocationId = Objects.requireNonNull(invocationId, "Invocation id cannot be null");
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        this.definitionId = definition.getId();
        this.definitionVersion = definition.getVersion();
        this.event = Objects.requireNonNull(event, "Event cannot be null");
        this.state = Objects.requireNonNull(state, "State cannot be null");
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
        this.endTime = Objects.requireNonNull(endTime, "End time cannot be null");
        this.actionResults = actionResults != null ? List.copyOf(actionResults) : List.of();
        this.errorHandlerResults = errorHandlerResults != null ? List.copyOf(errorHandlerResults) : List.of();
        this.error = error;
    }

    public String getInvocationId() {
        return invocationId;
    }

    public String getDefinitionId() {
        return definitionId;
    }

    public String getDefinitionVersion() {
        return definitionVersion;
    }

    public Event getEvent() {
        return event;
    }

    public InvocationState getState() {
        return state;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    /**
     * Outcomes of the main chain, in execution order. Skipped actions are absent.
     */
    public List<ActionResult> getActionResults() {
        return actionResults;
    }

    /**
     * Outcomes of the error chain, in execution order.
     */
    public List<ActionResult> getErrorHandlerResults() {
        return errorHandlerResults;
    }

    /**
     * Main and error chain outcomes together, in execution order.
     */
    public List<ActionResult> getAllResults() {
        List<ActionResult> all = new ArrayList<>(actionResults);
        all.addAll(errorHandlerResults);
        return all;
    }

    public Optional<ErrorInfo> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccessful() {
        return state.isSuccessful();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return invocationId.equals(((WorkflowInvocation) o).invocationId);
    }

    @Override
    public int hashCode() {
        return invocationId.hashCode();
    }

    @Override
    public String toString() {
        return "WorkflowInvocation{" +
               "invocationId='" + invocationId + '\'' +
               ", workflow='" + definitionId + '\'' +
               ", state=" + state +
               ", actions=" + actionResults.size() +
               ", errorActions=" + errorHandlerResults.size() +
               ", duration=" + getDuration().toMillis() + "ms" +
               '}';
    }
}
