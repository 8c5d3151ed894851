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

import dev.mars.ripple.config.RippleConfiguration;
import dev.mars.ripple.core.Event;
import dev.mars.ripple.examples.util.ExampleLogger;
import dev.mars.ripple.workflow.EventDrivenWorkflowEngine;
import dev.mars.ripple.workflow.JsonWorkflowDefinitionParser;
import dev.mars.ripple.workflow.WorkflowDefinition;
import dev.mars.ripple.workflow.WorkflowParseException;
import dev.mars.ripple.workflow.WorkflowRegistrationException;
import dev.mars.ripple.workflow.WorkflowRuntime;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * End-to-end run of the funds-transfer notification workflow: a transfer is published
 * on the bus, the admin is notified, the transfer is audited and counted. A second
 * transfer is published while the audit log is offline to drive the error handler.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FundsTransferWorkflowExample implements AutoCloseable {

    private static final ExampleLogger log = ExampleLogger.getLogger(FundsTransferWorkflowExample.class);

    public static final String WORKFLOW_RESOURCE = "/workflows/funds_transfer_notification.json";

    private final WorkflowRuntime runtime;
    private final NotificationActionHandler notifications = new NotificationActionHandler();
    private final SystemLogActionHandler systemLog = new SystemLogActionHandler();
    private final ServiceActionHandler services = new ServiceActionHandler();
    private final ServiceActionHandler.CounterService metrics = new ServiceActionHandler.CounterService();
    private final TransactionEventPublisher publisher;
    private final BlockingQueue<Event> outcomes = new LinkedBlockingQueue<>();

    public FundsTransferWorkflowExample(RippleConfiguration configuration) {
        this.runtime = new WorkflowRuntime(configuration);
        runtime.getActionRegistry().register(NotificationActionHandler.ACTION_TYPE, notifications);
        runtime.getActionRegistry().register(SystemLogActionHandler.ACTION_TYPE, systemLog);
        runtime.getActionRegistry().register(ServiceActionHandler.ACTION_TYPE, services);
        services.registerService("metrics", metrics);
        runtime.getEventBus().subscribe(EventDrivenWorkflowEngine.WORKFLOW_COMPLETED_EVENT, outcomes::add);
        runtime.getEventBus().subscribe(EventDrivenWorkflowEngine.WORKFLOW_FAILED_EVENT, outcomes::add);
        this.publisher = new TransactionEventPublisher(runtime.getEventBus());
    }

    public static void main(String[] args) {
        try (FundsTransferWorkflowExample example = new FundsTransferWorkflowExample(new RippleConfiguration())) {
            example.runExample();
            log.exampleComplete("Funds Transfer Workflow Example");
        } catch (Exception e) {
            log.unexpectedError("Funds Transfer Workflow Example", e);
            System.exit(1);
        }
    }

    public void runExample() throws Exception {
        log.header("Funds Transfer Workflow Example");

        log.step(1, "Registering the bundled workflow...");
        WorkflowDefinition definition = registerBundledWorkflow();
        log.keyValue("Workflow", definition.getId() + " v" + definition.getVersion());
        log.keyValue("Trigger", definition.getTrigger().getEvent());
        log.keyValue("Actions", definition.getActions().size());

        log.step(2, "Publishing a completed transfer...");
        publishTransfer("tx-1001", 250, "USD");
        Event completed = awaitOutcome();
        log.keyValue("Outcome", completed.getType() + " in " + completed.getPayload().get("duration_ms") + "ms");
        notifications.getOutbox("admin").forEach(n -> log.bullet(n.getMessage()));
        log.success("Transfers counted: " + metrics.get("transfers_completed"));

        log.step(3, "Publishing a deposit (condition does not match)...");
        publisher.transactionCompleted(Map.of("transaction_id", "tx-1002", "transaction_type", "deposit",
                "amount", 40, "currency", "USD"));
        log.detail("No workflow runs for deposits");

        log.step(4, "Publishing a transfer while the audit log is offline...");
        systemLog.setOffline(SystemLogActionHandler.DEFAULT_SINK, true);
        publishTransfer("tx-1003", 5000, "EUR");
        Event failed = awaitOutcome();
        log.expectedFailure(failed.getType() + " at action " + failed.getPayload().get("failed_action"));
        systemLog.getEntries("error_log").forEach(entry -> log.bullet(String.valueOf(entry.get("message"))));
        systemLog.setOffline(SystemLogActionHandler.DEFAULT_SINK, false);
    }

    public WorkflowDefinition registerBundledWorkflow() throws WorkflowParseException, WorkflowRegistrationException {
        WorkflowDefinition definition = new JsonWorkflowDefinitionParser().parseFromString(readResource(WORKFLOW_RESOURCE));
        runtime.getWorkflowRegistry().register(definition);
        return definition;
    }

    public Event publishTransfer(String transactionId, Number amount, String currency) {
        return publisher.transactionCompleted(Map.of(
                "transaction_id", transactionId,
                "transaction_type", "transfer",
                "amount", amount,
                "currency", currency));
    }

    /**
     * Next {@code workflow.completed} or {@code workflow.failed} event, waiting up to ten seconds.
     */
    public Event awaitOutcome() throws InterruptedException {
        Event outcome = outcomes.poll(10, TimeUnit.SECONDS);
        if (outcome == null) {
            throw new IllegalStateException("No workflow outcome within 10s");
        }
        return outcome;
    }

    public WorkflowRuntime getRuntime() {
        return runtime;
    }

    public NotificationActionHandler getNotifications() {
        return notifications;
    }

    public SystemLogActionHandler getSystemLog() {
        return systemLog;
    }

    public ServiceActionHandler.CounterService getMetrics() {
        return metrics;
    }

    private static String readResource(String name) {
        try (InputStream input = FundsTransferWorkflowExample.class.getResourceAsStream(name)) {
            if (input == null) {
                throw new IllegalStateException("Missing classpath resource " + name);
            }
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + name, e);
        }
    }

    @Override
    public void close() {
        runtime.close();
    }
}
