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
import dev.mars.ripple.event.EventBus;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Matches events to registered workflows and runs them.
 */
public interface WorkflowEngine {

    /**
     * Runs every registered workflow whose trigger matches the event. Each match runs
     * independently with its own context.
     *
     * @param event the triggering event
     * @return future completing once every matched invocation reaches a terminal state;
     *         an empty list if nothing matched
     */
    CompletableFuture<List<WorkflowInvocation>> handle(Event event);

    /**
     * Runs one definition for an event, bypassing trigger matching.
     */
    CompletableFuture<WorkflowInvocation> execute(WorkflowDefinition definition, Event event);

    void addInvocationListener(InvocationListener listener);

    boolean removeInvocationListener(InvocationListener listener);

    /**
     * Number of invocations currently between start and terminal state.
     */
    int getActiveInvocationCount();

    /**
     * Subscribes the engine to every event on the bus and routes outcome events back to it.
     */
    void connect(EventBus eventBus);

    /**
     * Stops accepting events and waits for running invocations to finish.
     */
    void shutdown();
}
