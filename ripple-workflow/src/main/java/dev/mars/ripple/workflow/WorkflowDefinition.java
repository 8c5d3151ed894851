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
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed, immutable form of a workflow document.
 *
 * <p>A definition binds a {@link Trigger} (event type plus optional condition) to an
 * ordered main action chain and an optional error chain. Definitions are never edited
 * in place: replacing a workflow means registering a new instance under the same id,
 * and invocations already running keep the instance they started with.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowDefinition {

    private final String id;
    private final String name;
    private final String description;
    private final String version;
    private final Trigger trigger;
    private final List<ActionSpec> actions;
    private final ErrorHandler errorHandler;
    private final Duration timeout;

    public WorkflowDefinition(String id, String name, String description, String version,
                              Trigger trigger, List<ActionSpec> actions, ErrorHandler errorHandler,
                              Duration timeout) {
        this.id = Objects.requireNonNull(id, "Workflow id cannot be null");
        this.name = name != null ? name : id;
        this.description = description;
        this.version = version != null ? version : "1.0.0";
        this.trigger = Objects.requireNonNull(trigger, "Trigger cannot be null");
        this.actions = actions != null ? List.copyOf(actions) : List.of();
        this.errorHandler = errorHandler;
        this.timeout = timeout;
    }

    public WorkflowDefinition(String id, Trigger trigger, List<ActionSpec> actions, ErrorHandler errorHandler) {
        this(id, null, null, null, trigger, actions, errorHandler, null);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getVersion() {
        return version;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public List<ActionSpec> getActions() {
        return actions;
    }

    public Optional<ErrorHandler> getErrorHandler() {
        return Optional.ofNullable(errorHandler);
    }

    /**
     * Per-workflow timeout overriding the engine default, if the document declares one.
     */
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return id.equals(that.id) &&
               version.equals(that.version) &&
               trigger.equals(that.trigger) &&
               actions.equals(that.actions) &&
               Objects.equals(errorHandler, that.errorHandler) &&
               Objects.equals(timeout, that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version, trigger, actions, errorHandler, timeout);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "id='" + id + '\'' +
               ", version='" + version + '\'' +
               ", trigger=" + trigger +
               ", actions=" + actions.size() +
               ", errorActions=" + (errorHandler != null ? errorHandler.getActions().size() : 0) +
               '}';
    }

    /**
     * Decides whether a definition activates for an event.
     */
    public static class Trigger {

        public static final String EVENT_TRIGGER = "event";

        private final String type;
        private final String event;
        private final String condition;

        public Trigger(String type, String event, String condition) {
            this.type = type != null ? type : EVENT_TRIGGER;
            this.event = Objects.requireNonNull(event, "Trigger event cannot be null");
            this.condition = condition != null && !condition.isBlank() ? condition : null;
        }

        public static Trigger onEvent(String event) {
            return new Trigger(EVENT_TRIGGER, event, null);
        }

        public static Trigger onEvent(String event, String condition) {
            return new Trigger(EVENT_TRIGGER, event, condition);
        }

        public String getType() {
            return type;
        }

        public String getEvent() {
            return event;
        }

        /**
         * The boolean expression over the event context; absent means always true.
         */
        public Optional<String> getCondition() {
            return Optional.ofNullable(condition);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Trigger trigger = (Trigger) o;
            return type.equals(trigger.type) && event.equals(trigger.event) &&
                   Objects.equals(condition, trigger.condition);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, event, condition);
        }

        @Override
        public String toString() {
            return "Trigger{event='" + event + '\'' +
                   (condition != null ? ", condition='" + condition + '\'' : "") + '}';
        }
    }

    /**
     * The chain run once when the main chain fails.
     */
    public static class ErrorHandler {

        private final List<ActionSpec> actions;

        public ErrorHandler(List<ActionSpec> actions) {
            this.actions = actions != null ? List.copyOf(actions) : List.of();
        }

        public List<ActionSpec> getActions() {
            return actions;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return actions.equals(((ErrorHandler) o).actions);
        }

        @Override
        public int hashCode() {
            return actions.hashCode();
        }
    }
}
