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

package dev.mars.ripple.examples;

import java.util.Map;

/**
 * A named service that {@link ServiceActionHandler} forwards operations to.
 */
@FunctionalInterface
public interface ServiceInvoker {

    /**
     * @param operation the operation requested by the action's {@code data.action}
     * @param arguments the remaining resolved action data
     * @return the service response, exposed to later actions as the result's output
     */
    Map<String, Object> invoke(String operation, Map<String, Object> arguments) throws Exception;
}
