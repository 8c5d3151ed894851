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

/**
 * Observes invocations. This is how outcome records reach logging and metrics.
 * Callbacks run on the invocation's worker thread and must not block; an exception
 * thrown by a listener is logged and ignored.
 */
public interface InvocationListener {

    default void onInvocationStarted(WorkflowDefinition definition, ExecutionContext context) {
    }

    /**
     * @param errorChain {@code true} when the action belongs to the error handler
     */
    default void onActionCompleted(WorkflowDefinition definition, ExecutionContext context,
                                   ActionResult result, boolean errorChain) {
    }

    void onInvocationCompleted(WorkflowInvocation invocation);
}
