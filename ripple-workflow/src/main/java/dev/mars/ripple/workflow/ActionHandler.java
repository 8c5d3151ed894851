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

import java.util.Map;

/**
 * Implements the effect of one action type, e.g. sending a notification or calling a
 * service. Handlers are supplied by the host application and registered with an
 * {@link ActionRegistry} before events are processed.
 *
 * <p>The action passed in has its {@code target}, {@code template} and {@code channel}
 * already resolved; {@code resolvedData} is the resolved {@code data} map. A handler
 * reports failure either by returning {@link ActionResult#failure} or by throwing;
 * both are recorded as a failed result. The returned result's action id is replaced
 * with the action's id.</p>
 *
 * <p>Handlers may be called concurrently from different invocations and must be
 * thread-safe. A handler that blocks should respond to interruption, which is how an
 * invocation timeout cancels it.</p>
 */
@FunctionalInterface
public interface ActionHandler {

    ActionResult handle(ActionSpec resolvedSpec, Map<String, Object> resolvedData) throws Exception;
}
