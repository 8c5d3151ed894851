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

package dev.mars.ripple.core.exceptions;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a state machine is asked to move along an edge it does not have.
 *
 * <p>The message names the entity, the current state, the requested state and
 * every state that would have been accepted.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InvalidTransitionException extends RippleException {

    private final String entityId;
    private final Enum<?> currentState;
    private final Enum<?> requestedState;
    private final List<Enum<?>> validTargets;

    public InvalidTransitionException(String entityId, Enum<?> currentState,
                                      Enum<?> requestedState, Collection<? extends Enum<?>> validTargets) {
        super(String.format("Invalid transition for '%s': %s -> %s (allowed: %s)",
                entityId, currentState, requestedState, describe(validTargets)));
        this.entityId = entityId;
        this.currentState = currentState;
        this.requestedState = requestedState;
        this.validTargets = validTargets != null ? List.copyOf(validTargets) : List.of();
    }

    public String getEntityId() {
        return entityId;
    }

    public Enum<?> getCurrentState() {
        return currentState;
    }

    public Enum<?> getRequestedState() {
        return requestedState;
    }

    public List<Enum<?>> getValidTargets() {
        return validTargets;
    }

    private static String describe(Collection<? extends Enum<?>> targets) {
        if (targets == null || targets.isEmpty()) {
            return "none, state is terminal";
        }
        return targets.stream().map(Enum::name).collect(Collectors.joining(", "));
    }
}
