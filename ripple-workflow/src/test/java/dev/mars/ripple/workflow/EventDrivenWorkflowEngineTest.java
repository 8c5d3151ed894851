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
import dev.mars.ripple.event.InMemoryEventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EventDrivenWorkflowEngineTest {

    private static final String TX_COMPLETED = "financial_business.transaction.completed";

    private final List<RecordingActionHandler.Call> journal = new ArrayList<>();
    private RecordingActionHandler notification;
    private RecordingActionHandler system;
    private RecordingActionHandler service;
    private ActionRegistry actionRegistry;
    private WorkflowRegistry workflowRegistry;
    private EventDrivenWorkflowEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        notification = new RecordingActionHandler(journal);
        system = new RecordingActionHandler(journal);
        service = new RecordingActionHandler(journal);
        actionRegistry = new ActionRegistry();
        actionRegistry.register("notification", notification);
        actionRegistry.register("system", system);
        actionRegistry.register("service", service);
        workflowRegistry = new WorkflowRegistry();
        engine = newEngine(config(5000));
        workflowRegistry.register(fundsTransferWorkflow());
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private static RippleConfiguration config(long timeoutMs) {
        return config(8, 16, timeoutMs);
    }

    private static RippleConfiguration config(int maxConcurrent, int queueCapacity, long timeoutMs) {
        Properties properties = new Properties();
        properties.setProperty(RippleConfiguration.ENGINE_MAX_CONCURRENT, String.valueOf(maxConcurrent));
        properties.setProperty(RippleConfiguration.ENGINE_QUEUE_CAPACITY, String.valueOf(queueCapacity));
        properties.setProperty(RippleConfiguration.ENGINE_TIMEOUT_MS, String.valueOf(timeoutMs));
        properties.setProperty(RippleConfiguration.ENGINE_SHUTDOWN_TIMEOUT_MS, "2000");
        return new RippleConfiguration(properties);
    }

    private EventDrivenWorkflowEngine newEngine(RippleConfiguration configuration) {
        return new EventDrivenWorkflowEngine(workflowRegistry, actionRegistry, configuration);
    }

    static WorkflowDefinition fundsTransferWorkflow() {
        return new WorkflowDefinition("funds_transfer_notification",
                WorkflowDefinition.Trigger.onEvent(TX_COMPLETED, "event.transaction_type == 'transfer'"),
                List.of(
                        ActionSpec.builder("notify_admin", "notification")
                                .channel("admin")
                                .data("message", "A funds transfer of {{event.amount}} {{event.currency}} " +
                                        "has been completed. Transaction ID: {{event.transaction_id}}")
                                .build(),
                        ActionSpec.builder("log_transaction", "system")
                                .target("audit_log")
                                .data("message", "Transfer {{event.transaction_id}} notified: " +
                                        "{{results.notify_admin.status}}")
                                .build(),
                        ActionSpec.builder("update_metrics", "service")
                                .target("metrics")
                                .data("action", "increment")
                                .build()),
                new WorkflowDefinition.ErrorHandler(List.of(
                        ActionSpec.builder("notify_error", "notification")
                                .channel("admin")
                                .data("message", "Error in funds transfer workflow: {{error.message}}")
                                .build(),
                        ActionSpec.builder("log_error", "system")
                                .target("error_log")
                                .data("message", "{{error.action_id}} failed ({{error.type}}) for {{event.transaction_id}}")
                                .build())));
    }

    private static Event transfer(String transactionId) {
        return Event.of(TX_COMPLETED, Map.of(
                "transaction_type", "transfer",
                "amount", 250,
                "currency", "USD",
                "transaction_id", transactionId));
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(10, TimeUnit.SECONDS);
    }

    @Test
    void testActionsRunInOrderAndComplete() throws Exception {
        List<WorkflowInvocation> invocations = await(engine.handle(transfer("t1")));

        assertEquals(1, invocations.size());
        WorkflowInvocation invocation = invocations.get(0);
        assertEquals(InvocationState.COMPLETED, invocation.getState());
        assertEquals("funds_transfer_notification", invocation.getDefinitionId());
        assertThat(invocation.getActionResults())
                .extracting(ActionResult::getActionId)
                .containsExactly("notify_admin", "log_transaction", "update_metrics");
        assertTrue(invocation.getActionResults().stream().allMatch(ActionResult::isSuccessful));
        assertTrue(invocation.getErrorHandlerResults().isEmpty());
        assertTrue(invocation.getError().isEmpty());

        assertEquals(List.of("notify_admin", "log_transaction", "update_metrics"),
                RecordingActionHandler.actionIds(journal));
        assertEquals("A funds transfer of 250 USD has been completed. Transaction ID: t1",
                RecordingActionHandler.find(journal, "notify_admin").data.get("message"));
        assertEquals("Transfer t1 notified: success",
                RecordingActionHandler.find(journal, "log_transaction").data.get("message"));
        assertEquals("metrics", RecordingActionHandler.find(journal, "update_metrics").spec.getTarget().orElseThrow());
    }

    @Test
    void testFailureHaltsChainAndRunsErrorHandler() throws Exception {
        system.failOn("log_transaction");

        WorkflowInvocation invocation = await(engine.handle(transfer("t2"))).get(0);

        assertEquals(InvocationState.ERROR_COMPLETED, invocation.getState());
        assertEquals(List.of("notify_admin", "log_transaction", "notify_error", "log_error"),
                RecordingActionHandler.actionIds(journal));
        assertThat(invocation.getActionResults()).extracting(ActionResult::getActionId)
                .containsExactly("notify_admin", "log_transaction");
        assertThat(invocation.getErrorHandlerResults()).extracting(ActionResult::getActionId)
                .containsExactly("notify_error", "log_error");

        ErrorInfo error = invocation.getError().orElseThrow();
        assertEquals("log_transaction", error.getActionId());
        assertEquals(FailureType.HANDLER_FAILURE, error.getType());
        assertEquals("log_transaction sink unavailable", error.getMessage());

        assertEquals("Error in funds transfer workflow: log_transaction sink unavailable",
                RecordingActionHandler.find(journal, "notify_error").data.get("message"));
        assertEquals("log_transaction failed (handler_failure) for t2",
                RecordingActionHandler.find(journal, "log_error").data.get("message"));
    }

    @Test
    void testErrorChainFailureIsNotRedispatched() throws Exception {
        system.failOn("log_transaction");
        notification.failOn("notify_error");

        WorkflowInvocation invocation = await(engine.handle(transfer("t3"))).get(0);

        assertEquals(InvocationState.ERROR_COMPLETED, invocation.getState());
        assertEquals(List.of("notify_admin", "log_transaction", "notify_error", "log_error"),
                RecordingActionHandler.actionIds(journal));
        assertFalse(invocation.getErrorHandlerResults().get(0).isSuccessful());
        assertTrue(invocation.getErrorHandlerResults().get(1).isSuccessful());
        assertEquals("log_transaction", invocation.getError().orElseThrow().getActionId());
    }

    @Test
    void testFailureWithoutErrorHandler() throws Exception {
        workflowRegistry.register(new WorkflowDefinition("bare", WorkflowDefinition.Trigger.onEvent("order.created"),
                List.of(ActionSpec.builder("a", "system").build(), ActionSpec.builder("b", "system").build()), null));
        system.failOn("a");

        WorkflowInvocation invocation = await(engine.handle(Event.of("order.created", Map.of()))).get(0);

        assertEquals(InvocationState.ERROR_COMPLETED, invocation.getState());
        assertEquals(List.of("a"), RecordingActionHandler.actionIds(journal));
        assertTrue(invocation.getErrorHandlerResults().isEmpty());
    }

    @Test
    void testUnknownActionTypeDoesNotAffectOtherInvocations() throws Exception {
        workflowRegistry.register(new WorkflowDefinition("crm_sync", WorkflowDefinition.Trigger.onEvent("customer.updated"),
                List.of(ActionSpec.builder("push_to_crm", "crm").build()), null));

        CompletableFuture<List<WorkflowInvocation>> crm = engine.handle(Event.of("customer.updated", Map.of()));
        CompletableFuture<List<WorkflowInvocation>> funds = engine.handle(transfer("t4"));

        WorkflowInvocation failed = await(crm).get(0);
        assertEquals(InvocationState.ERROR_COMPLETED, failed.getState());
        assertEquals("unknown_action_type", failed.getActionResults().get(0).getErrorCode().orElseThrow());
        assertEquals(FailureType.UNKNOWN_ACTION_TYPE, failed.getError().orElseThrow().getType());

        assertEquals(InvocationState.COMPLETED, await(funds).get(0).getState());
    }

    @Test
    void testEmptyActionsCompleteImmediately() throws Exception {
        workflowRegistry.register(new WorkflowDefinition("noop", WorkflowDefinition.Trigger.onEvent("ping"),
                List.of(), null));

        WorkflowInvocation invocation = await(engine.handle(Event.of("ping", Map.of()))).get(0);

        assertEquals(InvocationState.COMPLETED, invocation.getState());
        assertTrue(invocation.getAllResults().isEmpty());
    }

    @Test
    void testConditionMismatchRunsNothing() throws Exception {
        Event deposit = Event.of(TX_COMPLETED, Map.of("transaction_type", "deposit", "amount", 10));

        assertTrue(await(engine.handle(deposit)).isEmpty());
        assertTrue(await(engine.handle(Event.of("unrelated", Map.of()))).isEmpty());
        assertTrue(journal.isEmpty());
    }

    @Test
    void testEveryMatchingDefinitionRunsWithItsOwnContext() throws Exception {
        workflowRegistry.register(new WorkflowDefinition("audit_all_transactions",
                WorkflowDefinition.Trigger.onEvent(TX_COMPLETED),
                List.of(ActionSpec.builder("notify_admin", "system").target("audit").build()), null));

        List<WorkflowInvocation> invocations = await(engine.handle(transfer("t5")));

        assertThat(invocations).extracting(WorkflowInvocation::getDefinitionId)
                .containsExactlyInAnyOrder("funds_transfer_notification", "audit_all_transactions");
        assertThat(invocations).allMatch(WorkflowInvocation::isSuccessful);
        assertThat(invocations).extracting(WorkflowInvocation::getInvocationId).doesNotHaveDuplicates();
        WorkflowInvocation audit = invocations.stream()
                .filter(i -> i.getDefinitionId().equals("audit_all_transactions")).findFirst().orElseThrow();
        assertEquals(1, audit.getActionResults().size());
    }

    @Test
    void testTimeoutCancelsHandlerAndRunsErrorChain() throws Exception {
        engine.shutdown();
        engine = newEngine(config(200));
        CountDownLatch interrupted = new CountDownLatch(1);
        actionRegistry.register("system", (spec, data) -> {
            if (spec.getId().equals("log_transaction")) {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
            }
            return system.handle(spec, data);
        });

        WorkflowInvocation invocation = await(engine.handle(transfer("t6"))).get(0);

        assertEquals(InvocationState.ERROR_COMPLETED, invocation.getState());
        ActionResult timedOut = invocation.getActionResults().get(1);
        assertEquals(FailureType.TIMEOUT, timedOut.getFailureType().orElseThrow());
        assertEquals(FailureType.TIMEOUT, invocation.getError().orElseThrow().getType());
        assertTrue(interrupted.await(5, TimeUnit.SECONDS));

        assertFalse(RecordingActionHandler.actionIds(journal).contains("update_metrics"));
        assertEquals("log_transaction failed (timeout) for t6",
                RecordingActionHandler.find(journal, "log_error").data.get("message"));
    }

    @Test
    void testPerWorkflowTimeoutOverridesGlobal() throws Exception {
        engine.shutdown();
        engine = newEngine(config(0));
        actionRegistry.register("slow", (spec, data) -> {
            Thread.sleep(5_000);
            return ActionResult.success(spec.getId());
        });
        workflowRegistry.register(new WorkflowDefinition("bounded", null, null, null,
                WorkflowDefinition.Trigger.onEvent("batch.started"),
                List.of(ActionSpec.builder("crunch", "slow").build()), null, Duration.ofMillis(100)));

        WorkflowInvocation invocation = await(engine.handle(Event.of("batch.started", Map.of()))).get(0);

        assertEquals(InvocationState.ERROR_COMPLETED, invocation.getState());
        assertEquals("timeout", invocation.getActionResults().get(0).getErrorCode().orElseThrow());
    }

    @Test
    void testUnboundedInvocationRunsInline() throws Exception {
        engine.shutdown();
        engine = newEngine(config(0));

        WorkflowInvocation invocation = await(engine.handle(transfer("t7"))).get(0);

        assertEquals(InvocationState.COMPLETED, invocation.getState());
        assertEquals(3, invocation.getActionResults().size());
    }

    @Test
    void testConditionErrorRunsErrorChain() throws Exception {
        engine.shutdown();
        ConditionEvaluator brokenEvaluator = mock(ConditionEvaluator.class);
        when(brokenEvaluator.evaluate(any(), any())).thenThrow(new ConditionException("x", "cannot evaluate"));
        engine = new EventDrivenWorkflowEngine(workflowRegistry, actionRegistry, brokenEvaluator, config(5000));

        WorkflowInvocation invocation = await(engine.handle(transfer("t8"))).get(0);

        assertEquals(InvocationState.ERROR_COMPLETED, invocation.getState());
        assertTrue(invocation.getActionResults().isEmpty());
        assertEquals(FailureType.CONDITION_ERROR, invocation.getError().orElseThrow().getType());
        assertEquals(List.of("notify_error", "log_error"), RecordingActionHandler.actionIds(journal));
    }

    @Test
    void testReplacementDoesNotAffectInFlightInvocation() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        actionRegistry.register("gate", (spec, data) -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return ActionResult.success(spec.getId());
        });
        workflowRegistry.register(new WorkflowDefinition("versioned", null, null, "1",
                WorkflowDefinition.Trigger.onEvent("doc.saved"),
                List.of(ActionSpec.builder("wait", "gate").build(), ActionSpec.builder("v1_step", "system").build()),
                null, null));

        CompletableFuture<List<WorkflowInvocation>> inFlight = engine.handle(Event.of("doc.saved", Map.of()));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        workflowRegistry.register(new WorkflowDefinition("versioned", null, null, "2",
                WorkflowDefinition.Trigger.onEvent("doc.saved"),
                List.of(ActionSpec.builder("v2_step", "system").build()), null, null));
        release.countDown();

        WorkflowInvocation old = await(inFlight).get(0);
        assertEquals("1", old.getDefinitionVersion());
        assertThat(old.getActionResults()).extracting(ActionResult::getActionId).containsExactly("wait", "v1_step");

        WorkflowInvocation fresh = await(engine.handle(Event.of("doc.saved", Map.of()))).get(0);
        assertEquals("2", fresh.getDefinitionVersion());
        assertThat(fresh.getActionResults()).extracting(ActionResult::getActionId).containsExactly("v2_step");
    }

    @Test
    void testConcurrentInvocationsDoNotShareContext() throws Exception {
        int count = 100;
        for (int i = 0; i < count; i++) {
            workflowRegistry.register(new WorkflowDefinition("wf_" + i,
                    WorkflowDefinition.Trigger.onEvent("tenant." + i + ".event"),
                    List.of(ActionSpec.builder("first_" + i, "system").data("n", "{{event.n}}").build(),
                            ActionSpec.builder("second_" + i, "service")
                                    .data("seen", "{{results.first_" + i + ".output.n}}").build()),
                    null));
        }

        List<CompletableFuture<List<WorkflowInvocation>>> futures = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            futures.add(engine.handle(Event.of("tenant." + i + ".event", Map.of("n", i))));
        }

        for (int i = 0; i < count; i++) {
            List<WorkflowInvocation> invocations = await(futures.get(i));
            assertEquals(1, invocations.size());
            WorkflowInvocation invocation = invocations.get(0);
            assertEquals(InvocationState.COMPLETED, invocation.getState());
            assertThat(invocation.getActionResults()).extracting(ActionResult::getActionId)
                    .containsExactly("first_" + i, "second_" + i);
            assertEquals(i, invocation.getActionResults().get(0).getOutput().get("n"));
            assertEquals(i, invocation.getActionResults().get(1).getOutput().get("seen"));
        }
        assertEquals(0, engine.getActiveInvocationCount());
    }

    @Test
    void testListenersSeeEveryStepAndFailingListenerIsIsolated() throws Exception {
        List<String> seen = new ArrayList<>();
        engine.addInvocationListener(invocation -> {
            throw new IllegalStateException("listener bug");
        });
        engine.addInvocationListener(new InvocationListener() {
            @Override
            public void onInvocationStarted(WorkflowDefinition definition, ExecutionContext context) {
                synchronized (seen) {
                    seen.add("start:" + definition.getId());
                }
            }

            @Override
            public void onActionCompleted(WorkflowDefinition definition, ExecutionContext context,
                                          ActionResult result, boolean errorChain) {
                synchronized (seen) {
                    seen.add((errorChain ? "error:" : "action:") + result.getActionId());
                }
            }

            @Override
            public void onInvocationCompleted(WorkflowInvocation invocation) {
                synchronized (seen) {
                    seen.add("done:" + invocation.getState());
                }
            }
        });
        system.failOn("log_transaction");

        await(engine.handle(transfer("t9")));

        synchronized (seen) {
            assertEquals(List.of("start:funds_transfer_notification", "action:notify_admin", "action:log_transaction",
                    "error:notify_error", "error:log_error", "done:ERROR_COMPLETED"), seen);
        }
    }

    @Test
    void testBusDeliversEventsAndReceivesOutcomes() throws Exception {
        try (InMemoryEventBus bus = new InMemoryEventBus(10)) {
            BlockingQueue<Event> outcomes = new LinkedBlockingQueue<>();
            bus.subscribe(EventDrivenWorkflowEngine.WORKFLOW_COMPLETED_EVENT, outcomes::add);
            bus.subscribe(EventDrivenWorkflowEngine.WORKFLOW_FAILED_EVENT, outcomes::add);
            engine.connect(bus);

            Event published = bus.publish(TX_COMPLETED, Map.of(
                    "transaction_type", "transfer", "amount", 250, "currency", "USD", "transaction_id", "t10"));

            Event outcome = outcomes.poll(10, TimeUnit.SECONDS);
            assertNotNull(outcome);
            assertEquals(EventDrivenWorkflowEngine.WORKFLOW_COMPLETED_EVENT, outcome.getType());
            assertEquals("funds_transfer_notification", outcome.getPayload().get("workflow_id"));
            assertEquals(TX_COMPLETED, outcome.getPayload().get("trigger_event_type"));
            assertEquals(published.getId(), outcome.getPayload().get("trigger_event_id"));
            assertEquals("completed", outcome.getPayload().get("state"));
            assertNull(outcome.getPayload().get("failed_action"));

            system.failOn("log_transaction");
            bus.publish(TX_COMPLETED, Map.of("transaction_type", "transfer", "transaction_id", "t11"));

            Event failed = outcomes.poll(10, TimeUnit.SECONDS);
            assertNotNull(failed);
            assertEquals(EventDrivenWorkflowEngine.WORKFLOW_FAILED_EVENT, failed.getType());
            assertEquals("log_transaction", failed.getPayload().get("failed_action"));
        }
    }

    @Test
    void testExecuteBypassesTriggerMatching() throws Exception {
        Event deposit = Event.of(TX_COMPLETED, Map.of("transaction_type", "deposit"));

        WorkflowInvocation invocation = await(engine.execute(fundsTransferWorkflow(), deposit));

        assertEquals(InvocationState.COMPLETED, invocation.getState());
        assertEquals(deposit, invocation.getEvent());
    }

    @Test
    void testShutdownRejectsNewEvents() {
        engine.shutdown();

        CompletableFuture<List<WorkflowInvocation>> rejected = engine.handle(transfer("t12"));

        assertTrue(rejected.isCompletedExceptionally());
        assertTrue(engine.execute(fundsTransferWorkflow(), transfer("t13")).isCompletedExceptionally());
    }

    @Test
    void testBurstNeverExceedsMaxConcurrentInvocations() throws Exception {
        engine.shutdown();
        engine = newEngine(config(2, 1, 0));
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        actionRegistry.register("tracked", (spec, data) -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                Thread.sleep(100);
            } finally {
                running.decrementAndGet();
            }
            return ActionResult.success(spec.getId());
        });
        workflowRegistry.register(new WorkflowDefinition("tracked_work",
                WorkflowDefinition.Trigger.onEvent("load.tick"),
                List.of(ActionSpec.builder("work", "tracked").build()), null));

        int publishers = 10;
        ExecutorService submitters = Executors.newFixedThreadPool(publishers);
        List<CompletableFuture<List<WorkflowInvocation>>> futures = new ArrayList<>();
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<CompletableFuture<List<WorkflowInvocation>>>> submitted = new ArrayList<>();
            for (int i = 0; i < publishers; i++) {
                int n = i;
                submitted.add(submitters.submit(() -> {
                    go.await();
                    return engine.handle(Event.of("load.tick", Map.of("n", n)));
                }));
            }
            go.countDown();
            for (Future<CompletableFuture<List<WorkflowInvocation>>> handle : submitted) {
                futures.add(handle.get(10, TimeUnit.SECONDS));
            }
        } finally {
            submitters.shutdownNow();
        }

        for (CompletableFuture<List<WorkflowInvocation>> future : futures) {
            assertEquals(InvocationState.COMPLETED, await(future).get(0).getState());
        }
        assertThat(peak.get()).isBetween(1, 2);
        assertEquals(0, engine.getActiveInvocationCount());
    }

    @Test
    void testHandlerErrorOnInlinePathRunsErrorChain() throws Exception {
        engine.shutdown();
        engine = newEngine(config(0));
        actionRegistry.register("broken", (spec, data) -> {
            throw new AssertionError("balance invariant violated");
        });
        workflowRegistry.register(new WorkflowDefinition("reconcile",
                WorkflowDefinition.Trigger.onEvent("ledger.closed"),
                List.of(ActionSpec.builder("reconcile_ledger", "broken").build()),
                new WorkflowDefinition.ErrorHandler(List.of(
                        ActionSpec.builder("notify_error", "notification").channel("admin").build(),
                        ActionSpec.builder("log_error", "system").target("error_log").build()))));

        WorkflowInvocation invocation = await(engine.handle(Event.of("ledger.closed", Map.of()))).get(0);

        assertEquals(InvocationState.ERROR_COMPLETED, invocation.getState());
        ErrorInfo error = invocation.getError().orElseThrow();
        assertEquals(FailureType.HANDLER_FAILURE, error.getType());
        assertEquals("reconcile_ledger", error.getActionId());
        assertEquals("balance invariant violated", error.getMessage());
        assertEquals(List.of("notify_error", "log_error"), RecordingActionHandler.actionIds(journal));
    }

    @Test
    void testOversizedTimeoutDoesNotAbortInvocation() throws Exception {
        WorkflowDefinition unbounded = new WorkflowDefinition("long_running", null, null, null,
                WorkflowDefinition.Trigger.onEvent(TX_COMPLETED),
                fundsTransferWorkflow().getActions(), null, Duration.ofSeconds(Long.MAX_VALUE));

        WorkflowInvocation invocation = await(engine.execute(unbounded, transfer("t14")));

        assertEquals(InvocationState.COMPLETED, invocation.getState());
        assertEquals(3, invocation.getActionResults().size());
    }
}
