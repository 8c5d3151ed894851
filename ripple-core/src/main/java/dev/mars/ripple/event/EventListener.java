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

package dev.mars.ripple.event;

import dev.mars.ripple.core.Event;

/**
 * Callback invoked by the {@link EventBus} for every event on a subscribed topic.
 *
 * <p>Listeners run on the bus dispatcher thread and should hand long-running
 * work off to their own executor.</p>
 */
@FunctionalInterface
public interface EventListener {

    void onEvent(Event event) throws Exception;
}
