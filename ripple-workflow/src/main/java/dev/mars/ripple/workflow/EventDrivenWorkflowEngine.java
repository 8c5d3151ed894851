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

import dev.mars.ripple.config.RippleConfiguration;
import dev.mars.ripple.core.Event;
import dev.mars.ripple.core.exceptions.InvalidTransitionException;
import dev.mars.ripple.event.EventBus;
import dev.mars.ripple.event.EventListener;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * {@link WorkflowEngine} that runs matched workflows on a bounded worker pool.
 *
 * <p>Each matched definition becomes one invocation with its own
 * {@link ExecutionContext}. Invocations run concurrently on up to
 * {@code ripple.engine.max.concurrent} workers; beyond that up to
 * {@code ripple.engine.queue.capacity} wait in a queue, and once the queue is full the
 * submitting thread waits for a slot. When the engine is connected to a bus that thread
 * is the bus dispatcher, so a burst slows delivery instead of growing memory without
 * bound. Publishers are never blocked. Workers never run more than
 * {@code ripple.engine.max.concurrent} invocations at once, so a handler must not call
 * {@link #handle} or {@link #execute} and wait on the result.</p>
 *
 * <p>Within an invocation actions run strictly in order. The first failed action halts
 * the main chain, the error chain runs once against the same context, and the
 * invocation ends in {@link InvocationState#ERROR_COMPLETED}. Failures inside the error
 * chain are logged and the next error action still runs.</p>
 *
 * <p>When an invocation timeout applies (per workflow, else
 * {@code ripple.engine.timeout.ms}), each handler call runs on a separate thread and
 * is cancelled once the deadline passes; its late result is discarded. The error chain
 * gets a fresh budget of the same length.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class EventDrivenWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = Logger.getLogger(EventDrivenWorkflowEngine.class.getName());

    public static final String WORKFLOW_COMPLETED_EVENT = "workflow.completed";
    public static final String WORKFLOW_FAILED_EVENT = "workflow.failed";

    // deadlines are compared by subtraction, which holds while they stay within half the long range
    private static final long MAX_TIMEOUT_NANOS = Long.MAX_VALUE / 2;

    private final WorkflowRegistry workflowRegistry;
    private final ActionRegistry actionRegistry;
    private final ConditionEvaluator conditionEvaluator;
    private final RippleConfiguration configuration;
    private final ThreadPoolExecutor invocationExecutor;
    private final Semaphore invocationSlots;
    private final ExecutorService handlerExecutor;
    private final List<InvocationListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, InvocationState> activeInvocations = new ConcurrentHashMap<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private volatile EventBus eventBus;
    private volatile EventListener busListener;

    public EventDrivenWorkflowEngine(WorkflowRegistry workflowRegistry, ActionRegistry actionRegistry) {
        this(workflowRegistry, actionRegistry, new RippleConfiguration());
    }

    public EventDrivenWorkflowEngine(WorkflowRegistry workflowRegistry, ActionRegistry actionRegistry,
                                     RippleConfiguration configuration) {
        this(workflowRegistry, actionRegistry, new ConditionEvaluator(), configuration);
    }

    public EventDrivenWorkflowEngine(WorkflowRegistry workflowRegistry, ActionRegistry actionRegistry,
                                     ConditionEvaluator conditionEvaluator, RippleConfiguration configuration) {
        this.workflowRegistry = Objects.requireNonNull(workflowRegistry, "Workflow registry cannot be null");
        this.actionRegistry = Objects.requireNonNull(actionRegistry, "Action registry cannot be null");
        this.conditionEvaluator = Objects.requireNonNull(conditionEvaluator, "Condition evaluator cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");

        int maxConcurrent = configuration.getMaxConcurrentInvocations();
        this.invocationExecutor = new ThreadPoolExecutor(
                maxConcurrent,
                maxConcurrent,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                daemonThreads("ripple-workflow-"));
        this.invocationExecutor.allowCoreThreadTimeOut(true);
        // the queue is bounded by these permits: one per worker plus one per queue slot
        this.invocationSlots = new Semaphore(
                (int) Math.min((long) maxConcurrent + configuration.getQueueCapacity(), Integer.MAX_VALUE - 1), true);
        this.handlerExecutor = Executors.newCachedThreadPool(daemonThreads("ripple-action-"));

        logger.info("EventDrivenWorkflowEngine initialized with " + maxConcurrent +
                " max concurrent invocations, queue capacity " + configuration.getQueueCapacity());
    }

    @Override
    public CompletableFuture<List<WorkflowInvocation>> handle(Event event) {
        Objects.requireNonNull(event, "Event cannot be null");
        if (shutdown.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }

        List<WorkflowDefinition> candidates = workflowRegistry.findByEventType(event.getType());
        if (candidates.isEmpty()) {
            logger.fine("No workflow listens for event type '" + event.getType() + "'");
            return CompletableFuture.completedFuture(List.of());
        }

        List<CompletableFuture<WorkflowInvocation>> futures = new ArrayList<>();
        for (WorkflowDefinition definition : candidates) {
            ExecutionContext context = ExecutionContext.forEvent(event);
            ConditionException conditionError = null;
            try {
                String condition = definition.getTrigger().getCondition().orElse(null);
                if (!conditionEvaluator.evaluate(condition, context)) {
                    logger.fine("Workflow '" + definition.getId() + "' condition not met for event " + event.getId());
                    continue;
                }
            } catch (ConditionException e) {
                logger.warning("Workflow '" + definition.getId() + "' condition failed: " + e.getMessage());
                conditionError = e;
            }
            futures.add(submit(definition, context, conditionError));
        }

        if (futures.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> futures.stream()
                        .map(CompletableFuture::join)
                        .collect(Collectors.toList()));
    }

    @Override
    public CompletableFuture<WorkflowInvocation> execute(WorkflowDefinition definition, Event event) {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        Objects.requireNonNull(event, "Event cannot be null");
        if (shutdown.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }
        return submit(definition, ExecutionContext.forEvent(event), null);
    }

    @Override
    public void addInvocationListener(InvocationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    @Override
    public boolean removeInvocationListener(InvocationListener listener) {
        return listeners.remove(listener);
    }

    @Override
    public int getActiveInvocationCount() {
        return activeInvocations.size();
    }

    /**
     * Current state of a running invocation; empty once it has finished.
     */
    public Optional<InvocationState> getInvocationState(String invocationId) {
        return Optional.ofNullable(activeInvocations.get(invocationId));
    }

    @Override
    public synchronized void connect(EventBus bus) {
        Objects.requireNonNull(bus, "Event bus cannot be null");
        disconnect();
        EventListener listener = event -> {
            if (!shutdown.get()) {
                handle(event);
            }
        };
        bus.subscribeAll(listener);
        this.eventBus = bus;
        this.busListener = listener;
        logger.info("Workflow engine connected to event bus");
    }

    private synchronized void disconnect() {
        if (eventBus != null && busListener != null) {
            eventBus.unsubscribeAll(busListener);
        }
        eventBus = null;
        busListener = null;
    }

    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        disconnect();
        invocationExecutor.shutdown();
        // a submitter woken by this permit sees the shutdown and hands the permit on
        invocationSlots.release();
        try {
            long waitMs = configuration.getShutdownTimeout().toMillis();
            if (!invocationExecutor.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                logger.warning("Invocations still running after " + waitMs + "ms, forcing shutdown");
                invocationExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            invocationExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            handlerExecutor.shutdownNow();
        }
        logger.info("EventDrivenWorkflowEngine shutdown complete");
    }

    private CompletableFuture<WorkflowInvocation> submit(WorkflowDefinition definition, ExecutionContext context,
                                                         ConditionException conditionError) {
        try {
            invocationSlots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletableFuture.failedFuture(new IllegalStateException(
                    "Interrupted waiting to submit workflow '" + definition.getId() + "'", e));
        }
        if (shutdown.get()) {
            invocationSlots.release();
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return runInvocation(definition, context, conditionError);
                } finally {
                    invocationSlots.release();
                }
            }, invocationExecutor);
        } catch (RejectedExecutionException e) {
            invocationSlots.release();
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown", e));
        }
    }

    private WorkflowInvocation runInvocation(WorkflowDefinition definition, ExecutionContext context,
                                             ConditionException conditionError) {
        String invocationId = context.getInvocationId();
        Instant startTime = Instant.now();
        List<ActionResult> actionResults = new ArrayList<>();
        List<ActionResult> errorResults = new ArrayList<>();
        InvocationState state = InvocationState.MATCHING;
        ErrorInfo error = null;

        activeInvocations.put(invocationId, state);
        try {
            logger.fine("Starting workflow '" + definition.getId() + "' invocation " + invocationId +
                    " for event " + context.getEvent().getId());
            notifyStarted(definition, context);

            try {
                if (conditionError != null) {
                    error = new ErrorInfo(conditionError.getMessage(), FailureType.CONDITION_ERROR, null);
                } else {
                    state = advance(state, InvocationState.RUNNING, invocationId);
                    error = runMainChain(definition, context, actionResults);
                }

                if (error == null) {
                    state = advance(state, InvocationState.COMPLETED, invocationId);
                } else {
                    state = advance(state, InvocationState.ERROR_HANDLING, invocationId);
                    context.setError(error);
                    runErrorChain(definition, context, errorResults);
                    state = advance(state, InvocationState.ERROR_COMPLETED, invocationId);
                }
            } catch (InvalidTransitionException | RuntimeException e) {
                logger.log(Level.SEVERE, "Workflow '" + definition.getId() + "' invocation " + invocationId +
                        " aborted: " + e.getMessage(), e);
                if (error == null) {
                    error = new ErrorInfo(e.getMessage(), FailureType.HANDLER_FAILURE, null);
                }
                state = InvocationState.ERROR_COMPLETED;
            }

            WorkflowInvocation invocation = new WorkflowInvocation(invocationId, definition, context.getEvent(),
                    state, startTime, Instant.now(), actionResults, errorResults, error);
            logger.info("Workflow '" + definition.getId() + "' invocation " + invocationId + " finished " +
                    state + " in " + invocation.getDuration().toMillis() + "ms");
            notifyCompleted(invocation);
            publishOutcome(invocation);
            return invocation;
        } finally {
            activeInvocations.remove(invocationId);
        }
    }

    private InvocationState advance(InvocationState current, InvocationState target, String invocationId)
            throws InvalidTransitionException {
        InvocationState next = current.transitionTo(target, invocationId);
        activeInvocations.put(invocationId, next);
        return next;
    }

    /**
     * @return the error that halted the chain, or {@code null} if every action succeeded
     */
    private ErrorInfo runMainChain(WorkflowDefinition definition, ExecutionContext context,
                                   List<ActionResult> results) {
        Duration timeout = timeoutFor(definition);
        long deadline = deadline(timeout);
        List<ActionSpec> actions = definition.getActions();

        for (int i = 0; i < actions.size(); i++) {
            ActionSpec spec = actions.get(i);
            if (deadline != 0 && System.nanoTime() - deadline >= 0) {
                logger.warning("Workflow '" + definition.getId() + "' timed out before action '" + spec.getId() + "'");
                return new ErrorInfo("Workflow '" + definition.getId() + "' timed out after " +
                        timeout.toMillis() + "ms", FailureType.TIMEOUT, spec.getId());
            }

            ActionResult result = dispatch(spec, context, deadline, timeout);
            context.recordResult(result);
            results.add(result);
            notifyAction(definition, context, result, false);

            if (!result.isSuccessful()) {
                int skipped = actions.size() - i - 1;
                logger.warning("Workflow '" + definition.getId() + "' action '" + spec.getId() + "' failed (" +
                        result.getErrorCode().orElse("") + ")" +
                        (skipped > 0 ? ", skipping " + skipped + " remaining action(s)" : ""));
                return ErrorInfo.from(result);
            }
        }
        return null;
    }

    private void runErrorChain(WorkflowDefinition definition, ExecutionContext context, List<ActionResult> results) {
        Optional<WorkflowDefinition.ErrorHandler> errorHandler = definition.getErrorHandler();
        if (errorHandler.isEmpty() || errorHandler.get().getActions().isEmpty()) {
            logger.fine("Workflow '" + definition.getId() + "' has no error handler");
            return;
        }

        Duration timeout = timeoutFor(definition);
        long deadline = deadline(timeout);
        for (ActionSpec spec : errorHandler.get().getActions()) {
            if (deadline != 0 && System.nanoTime() - deadline >= 0) {
                logger.warning("Workflow '" + definition.getId() + "' error handler timed out before action '" +
                        spec.getId() + "'");
                return;
            }
            ActionResult result = dispatch(spec, context, deadline, timeout);
            context.recordResult(result);
            results.add(result);
            notifyAction(definition, context, result, true);
            if (!result.isSuccessful()) {
                logger.warning("Workflow '" + definition.getId() + "' error handler action '" + spec.getId() +
                        "' failed: " + result.getError().orElse(""));
            }
        }
    }

    private ActionResult dispatch(ActionSpec spec, ExecutionContext context, long deadline, Duration timeout) {
        if (deadline == 0) {
            return actionRegistry.dispatch(spec, context);
        }

        Instant start = Instant.now();
        Future<ActionResult> future;
        try {
            future = handlerExecutor.submit(() -> actionRegistry.dispatch(spec, context));
        } catch (RejectedExecutionException e) {
            return ActionResult.failure(spec.getId(), FailureType.HANDLER_FAILURE, "Action executor is shut down");
        }

        try {
            return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warning("Action '" + spec.getId() + "' cancelled: invocation exceeded " + timeout.toMillis() + "ms");
            return ActionResult.failure(spec.getId(), FailureType.TIMEOUT,
                            "Action '" + spec.getId() + "' timed out after " + timeout.toMillis() + "ms")
                    .withActionIdAndDuration(spec.getId(), Duration.between(start, Instant.now()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ActionResult.failure(spec.getId(), FailureType.TIMEOUT, "Action '" + spec.getId() + "' was interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.log(Level.FINE, "Action '" + spec.getId() + "' dispatch failed", cause);
            return ActionResult.failure(spec.getId(), FailureType.HANDLER_FAILURE, String.valueOf(cause.getMessage()));
        }
    }

    private Duration timeoutFor(WorkflowDefinition definition) {
        return definition.getTimeout().orElse(configuration.getInvocationTimeout());
    }

    private static long deadline(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return 0;
        }
        long nanos;
        try {
            nanos = Math.min(timeout.toNanos(), MAX_TIMEOUT_NANOS);
        } catch (ArithmeticException e) {
            nanos = MAX_TIMEOUT_NANOS;
        }
        long deadline = System.nanoTime() + nanos;
        return deadline == 0 ? 1 : deadline;
    }

    private void notifyStarted(WorkflowDefinition definition, ExecutionContext context) {
        for (InvocationListener listener : listeners) {
            try {
                listener.onInvocationStarted(definition, context);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Invocation listener failed: " + e.getMessage(), e);
            }
        }
    }

    private void notifyAction(WorkflowDefinition definition, ExecutionContext context, ActionResult result,
                              boolean errorChain) {
        for (InvocationListener listener : listeners) {
            try {
                listener.onActionCompleted(definition, context, result, errorChain);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Invocation listener failed: " + e.getMessage(), e);
            }
        }
    }

    private void notifyCompleted(WorkflowInvocation invocation) {
        for (InvocationListener listener : listeners) {
            try {
                listener.onInvocationCompleted(invocation);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Invocation listener failed: " + e.getMessage(), e);
            }
        }
    }

    /**
     * Outcomes of invocations that were themselves triggered by an outcome event are not
     * published, so a workflow listening on {@code workflow.failed} cannot feed itself.
     */
    private void publishOutcome(WorkflowInvocation invocation) {
        EventBus bus = this.eventBus;
        if (bus == null || !configuration.isOutcomeEventsEnabled() || isOutcomeEvent(invocation.getEvent())) {
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workflow_id", invocation.getDefinitionId());
        payload.put("invocation_id", invocation.getInvocationId());
        payload.put("trigger_event_type", invocation.getEvent().getType());
        payload.put("trigger_event_id", invocation.getEvent().getId());
        payload.put("state", invocation.getState().name().toLowerCase());
        payload.put("duration_ms", invocation.getDuration().toMillis());
        payload.put("failed_action", invocation.getError().map(ErrorInfo::getActionId).orElse(null));

        try {
            bus.publish(invocation.isSuccessful() ? WORKFLOW_COMPLETED_EVENT : WORKFLOW_FAILED_EVENT, payload);
        } catch (IllegalStateException e) {
            logger.fine("Outcome event for invocation " + invocation.getInvocationId() +
                    " not published: " + e.getMessage());
        }
    }

    private static boolean isOutcomeEvent(Event event) {
        return WORKFLOW_COMPLETED_EVENT.equals(event.getType()) || WORKFLOW_FAILED_EVENT.equals(event.getType());
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
