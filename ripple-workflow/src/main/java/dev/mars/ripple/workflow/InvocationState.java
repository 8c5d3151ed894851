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

import dev.mars.ripple.core.exceptions.InvalidTransitionException;

import java.util.Arrays;

/**
 * Lifecycle of one workflow invocation.
 * <pre>
 *   MATCHING → RUNNING → COMPLETED
 *                      ↘ ERROR_HANDLING → ERROR_COMPLETED
 *   MATCHING → ERROR_HANDLING            (condition could not be evaluated)
 * </pre>
 * A failed invocation always passes through {@link #ERROR_HANDLING}, even when the
 * workflow declares no error handler. No state is retried.
 */
public enum InvocationState {

    /**
     * Trigger condition is being evaluated against a fresh context.
     */
    MATCHING,

    /**
     * Main action chain is executing.
     */
    RUNNING,

    /**
     * Main chain failed or timed out; the error chain (if any) is executing.
     */
    ERROR_HANDLING,

    /**
     * Every main action succeeded. Terminal.
     */
    COMPLETED,

    /**
     * The invocation failed and error handling has finished. Terminal.
     */
    ERROR_COMPLETED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR_COMPLETED;
    }

    public boolean isSuccessful() {
        return this == COMPLETED;
    }

    /**
     * @param target the state to move to
     * @return {@code true} if the transition is valid
     */
    public boolean canTransitionTo(InvocationState target) {
        return switch (this) {
            case MATCHING -> target == RUNNING || target == ERROR_HANDLING;
            case RUNNING -> target == COMPLETED || target == ERROR_HANDLING;
            case ERROR_HANDLING -> target == ERROR_COMPLETED;
            case COMPLETED, ERROR_COMPLETED -> false;
        };
    }

    public InvocationState[] getValidTransitions() {
        return switch (this) {
            case MATCHING -> new InvocationState[]{RUNNING, ERROR_HANDLING};
            case RUNNING -> new InvocationState[]{COMPLETED, ERROR_HANDLING};
            case ERROR_HANDLING -> new InvocationState[]{ERROR_COMPLETED};
            case COMPLETED, ERROR_COMPLETED -> new InvocationState[0];
        };
    }

    /**
     * Returns {@code target} if the move is allowed.
     *
     * @throws InvalidTransitionException otherwise
     */
    public InvocationState transitionTo(InvocationState target, String invocationId) throws InvalidTransitionException {
        if (!canTransitionTo(target)) {
            throw new InvalidTransitionException(invocationId, this, target, Arrays.asList(getValidTransitions()));
        }
        return target;
    }
}
