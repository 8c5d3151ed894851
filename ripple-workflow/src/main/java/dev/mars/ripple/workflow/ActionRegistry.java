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
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dispatch table from action type to {@link ActionHandler}.
 *
 * <p>{@link #dispatch} resolves the action's templates, invokes the handler and always
 * returns an {@link ActionResult}: a missing handler, a malformed template, a thrown
 * exception or a failed result all come back as failure data with a
 * {@link FailureType}. Nothing is thrown to the caller.</p>
 */
public class ActionRegistry {

    private static final Logger logger = Logger.getLogger(ActionRegistry.class.getName());

    private final Map<String, ActionHandler> handlers = new ConcurrentHashMap<>();
    private final TemplateResolver templateResolver;

    public ActionRegistry() {
        this(new TemplateResolver());
    }

    public ActionRegistry(TemplateResolver templateResolver) {
        this.templateResolver = Objects.requireNonNull(templateResolver, "Template resolver cannot be null");
    }

    /**
     * Registers a handler for an action type, replacing any previous one.
     */
    public void register(String actionType, ActionHandler handler) {
        if (actionType == null || actionType.isBlank()) {
            throw new IllegalArgumentException("Action type cannot be null or blank");
        }
        Objects.requireNonNull(handler, "Handler cannot be null");
        ActionHandler previous = handlers.put(actionType, handler);
        if (previous != null) {
            logger.info("Replaced handler for action type '" + actionType + "'");
        } else {
            logger.info("Registered handler for action type '" + actionType + "'");
        }
    }

    public boolean unregister(String actionType) {
        boolean removed = handlers.remove(actionType) != null;
        if (removed) {
            logger.info("Unregistered handler for action type '" + actionType + "'");
        }
        return removed;
    }

    public boolean isRegistered(String actionType) {
        return actionType != null && handlers.containsKey(actionType);
    }

    public Optional<ActionHandler> getHandler(String actionType) {
        return actionType == null ? Optional.empty() : Optional.ofNullable(handlers.get(actionType));
    }

    public Set<String> getRegisteredTypes() {
        return Set.copyOf(new TreeSet<>(handlers.keySet()));
    }

    /**
     * Resolves and runs one action. The result is not recorded into the context; that
     * is the caller's job.
     */
    public ActionResult dispatch(ActionSpec spec, ExecutionContext context) {
        Objects.requireNonNull(spec, "Action spec cannot be null");
        Objects.requireNonNull(context, "Execution context cannot be null");
        Instant start = Instant.now();

        ActionHandler handler = handlers.get(spec.getType());
        if (handler == null) {
            logger.warning("No handler registered for action type '" + spec.getType() +
                    "' (action '" + spec.getId() + "')");
            return finish(spec, ActionResult.failure(spec.getId(), FailureType.UNKNOWN_ACTION_TYPE,
                    "Unknown action type: " + spec.getType()), start);
        }

        ActionSpec resolvedSpec;
        Map<String, Object> resolvedData;
        try {
            Map<String, Object> scope = context.toTemplateScope();
            resolvedData = templateResolver.resolveMap(spec.getData(), scope);
            resolvedSpec = spec.withResolvedValues(
                    templateResolver.resolveString(spec.getTarget().orElse(null), scope),
                    templateResolver.resolveString(spec.getTemplate().orElse(null), scope),
                    templateResolver.resolveString(spec.getChannel().orElse(null), scope),
                    resolvedData);
        } catch (TemplateException e) {
            logger.warning("Template error in action '" + spec.getId() + "': " + e.getMessage());
            return finish(spec, ActionResult.failure(spec.getId(), FailureType.TEMPLATE_ERROR, e.getMessage()), start);
        }

        logger.fine("Dispatching action '" + spec.getId() + "' of type '" + spec.getType() +
                "' for invocation " + context.getInvocationId());
        try {
            ActionResult result = handler.handle(resolvedSpec, resolvedData);
            if (result == null) {
                return finish(spec, ActionResult.failure(spec.getId(),
                        "Handler for '" + spec.getType() + "' returned no result"), start);
            }
            if (!result.isSuccessful()) {
                logger.warning("Action '" + spec.getId() + "' failed: " + result.getError().orElse("(no message)"));
            }
            return finish(spec, result, start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return finish(spec, ActionResult.failure(spec.getId(), FailureType.TIMEOUT,
                    "Action '" + spec.getId() + "' was interrupted"), start);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            logger.warning("Action '" + spec.getId() + "' threw " + e.getClass().getSimpleName() +
                    ": " + e.getMessage());
            logger.log(Level.FINE, "Handler failure detail for action '" + spec.getId() + "'", e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            return finish(spec, ActionResult.failure(spec.getId(), FailureType.HANDLER_FAILURE, message), start);
        }
    }

    private static ActionResult finish(ActionSpec spec, ActionResult result, Instant start) {
        return result.withActionIdAndDuration(spec.getId(), Duration.between(start, Instant.now()));
    }
}
