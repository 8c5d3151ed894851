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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Registered workflow definitions, keyed by id and indexed by trigger event type.
 *
 * <p>The registry holds an immutable snapshot behind an {@link AtomicReference}.
 * Readers ({@link #findByEventType}) never lock and always see a complete snapshot;
 * writers build a new snapshot and swap it in. Re-registering an id replaces the old
 * definition in one swap, so no event is matched against a half-updated registry.
 * Definitions are validated before the swap and a rejected definition never becomes
 * visible.</p>
 */
public class WorkflowRegistry {

    private static final Logger logger = Logger.getLogger(WorkflowRegistry.class.getName());

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);
    private final WorkflowValidator validator;

    public WorkflowRegistry() {
        this(new WorkflowValidator());
    }

    public WorkflowRegistry(WorkflowValidator validator) {
        this.validator = Objects.requireNonNull(validator, "Validator cannot be null");
    }

    /**
     * Validates and registers a definition, replacing any definition with the same id.
     *
     * @return the definition that was replaced, if any
     * @throws WorkflowRegistrationException if validation reports an error
     */
    public Optional<WorkflowDefinition> register(WorkflowDefinition definition) throws WorkflowRegistrationException {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        ValidationResult validation = validator.validate(definition);
        if (!validation.isValid()) {
            logger.warning("Rejected workflow '" + definition.getId() + "': " + validation.getErrorSummary());
            throw new WorkflowRegistrationException(definition.getId(), validation);
        }
        for (ValidationResult.ValidationIssue warning : validation.getWarnings()) {
            logger.warning("Workflow '" + definition.getId() + "' " + warning);
        }

        Snapshot before = snapshot.getAndUpdate(current -> current.with(definition));
        WorkflowDefinition previous = before.byId.get(definition.getId());
        if (previous != null) {
            logger.info("Replaced workflow '" + definition.getId() + "' (version " + previous.getVersion() +
                    " -> " + definition.getVersion() + ")");
        } else {
            logger.info("Registered workflow '" + definition.getId() + "' on event '" +
                    definition.getTrigger().getEvent() + "'");
        }
        return Optional.ofNullable(previous);
    }

    public Optional<WorkflowDefinition> remove(String workflowId) {
        Snapshot before = snapshot.getAndUpdate(current -> current.without(workflowId));
        WorkflowDefinition removed = before.byId.get(workflowId);
        if (removed != null) {
            logger.info("Removed workflow '" + workflowId + "'");
        }
        return Optional.ofNullable(removed);
    }

    public Optional<WorkflowDefinition> get(String workflowId) {
        return Optional.ofNullable(snapshot.get().byId.get(workflowId));
    }

    /**
     * Definitions whose trigger event equals the given type, in registration order.
     */
    public List<WorkflowDefinition> findByEventType(String eventType) {
        return snapshot.get().byEvent.getOrDefault(eventType, List.of());
    }

    public Collection<WorkflowDefinition> getAll() {
        return snapshot.get().byId.values();
    }

    public Set<String> getWorkflowIds() {
        return snapshot.get().byId.keySet();
    }

    /**
     * Every event type some registered workflow listens for.
     */
    public Set<String> getTriggerEventTypes() {
        return snapshot.get().byEvent.keySet();
    }

    public int size() {
        return snapshot.get().byId.size();
    }

    private static final class Snapshot {

        static final Snapshot EMPTY = new Snapshot(Map.of());

        final Map<String, WorkflowDefinition> byId;
        final Map<String, List<WorkflowDefinition>> byEvent;

        private Snapshot(Map<String, WorkflowDefinition> definitions) {
            this.byId = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
            Map<String, List<WorkflowDefinition>> index = new LinkedHashMap<>();
            for (WorkflowDefinition definition : definitions.values()) {
                index.computeIfAbsent(definition.getTrigger().getEvent(), k -> new ArrayList<>()).add(definition);
            }
            index.replaceAll((event, list) -> List.copyOf(list));
            this.byEvent = Collections.unmodifiableMap(index);
        }

        Snapshot with(WorkflowDefinition definition) {
            Map<String, WorkflowDefinition> next = new LinkedHashMap<>(byId);
            next.put(definition.getId(), definition);
            return new Snapshot(next);
        }

        Snapshot without(String workflowId) {
            if (!byId.containsKey(workflowId)) {
                return this;
            }
            Map<String, WorkflowDefinition> next = new LinkedHashMap<>(byId);
            next.remove(workflowId);
            return new Snapshot(next);
        }
    }
}
