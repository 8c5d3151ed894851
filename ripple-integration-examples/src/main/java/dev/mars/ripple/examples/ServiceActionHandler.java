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

import dev.mars.ripple.workflow.ActionHandler;
import dev.mars.ripple.workflow.ActionResult;
import dev.mars.ripple.workflow.ActionSpec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Handles {@code service} actions by forwarding {@code data.action} to the
 * {@link ServiceInvoker} registered under the action's {@code target}.
 */
public class ServiceActionHandler implements ActionHandler {

    private static final Logger logger = Logger.getLogger(ServiceActionHandler.class.getName());

    public static final String ACTION_TYPE = "service";

    private final Map<String, ServiceInvoker> services = new ConcurrentHashMap<>();

    public void registerService(String name, ServiceInvoker invoker) {
        services.put(Objects.requireNonNull(name, "Service name cannot be null"),
                Objects.requireNonNull(invoker, "Service invoker cannot be null"));
        logger.fine("Registered service '" + name + "'");
    }

    public Set<String> getServiceNames() {
        return Set.copyOf(services.keySet());
    }

    @Override
    public ActionResult handle(ActionSpec spec, Map<String, Object> data) throws Exception {
        String serviceName = spec.getTarget()
                .orElseThrow(() -> new IllegalArgumentException("Service action '" + spec.getId() + "' has no target"));
        ServiceInvoker invoker = services.get(serviceName);
        if (invoker == null) {
            throw new IllegalArgumentException("No service named '" + serviceName + "'");
        }
        Object operation = data.get("action");
        if (operation == null || operation.toString().isEmpty()) {
            throw new IllegalArgumentException("Service action '" + spec.getId() + "' has no data.action");
        }

        Map<String, Object> arguments = new LinkedHashMap<>(data);
        arguments.remove("action");
        logger.fine("Invoking " + serviceName + "." + operation + " for action '" + spec.getId() + "'");
        Map<String, Object> response = invoker.invoke(operation.toString(), arguments);
        return ActionResult.success(spec.getId(), response != null ? response : Map.of());
    }

    /**
     * In-memory counter service: {@code increment} and {@code get} on {@code data.name}
     * ({@code "default"} when absent).
     */
    public static class CounterService implements ServiceInvoker {

        private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

        @Override
        public Map<String, Object> invoke(String operation, Map<String, Object> arguments) {
            String name = String.valueOf(arguments.getOrDefault("name", "default"));
            AtomicLong counter = counters.computeIfAbsent(name, key -> new AtomicLong());
            switch (operation) {
                case "increment":
                    return Map.of("name", name, "value", counter.incrementAndGet());
                case "get":
                    return Map.of("name", name, "value", counter.get());
                default:
                    throw new UnsupportedOperationException("Unknown counter operation: " + operation);
            }
        }

        public long get(String name) {
            AtomicLong counter = counters.get(name);
            return counter != null ? counter.get() : 0;
        }
    }
}
