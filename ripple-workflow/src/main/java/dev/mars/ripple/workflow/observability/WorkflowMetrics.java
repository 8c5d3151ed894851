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

package dev.mars.ripple.workflow.observability;

import dev.mars.ripple.workflow.ActionResult;
import dev.mars.ripple.workflow.ExecutionContext;
import dev.mars.ripple.workflow.InvocationListener;
import dev.mars.ripple.workflow.WorkflowDefinition;
import dev.mars.ripple.workflow.WorkflowInvocation;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for workflow invocations, recorded as an
 * {@link InvocationListener}:
 * <ul>
 *   <li>ripple.workflow.invocations.total (counter) - invocations started</li>
 *   <li>ripple.workflow.invocations.completed (counter) - invocations ending COMPLETED</li>
 *   <li>ripple.workflow.invocations.failed (counter) - invocations ending ERROR_COMPLETED</li>
 *   <li>ripple.workflow.actions.total (counter) - actions dispatched, both chains</li>
 *   <li>ripple.workflow.actions.failed (counter) - failed actions, by failure.type</li>
 *   <li>ripple.workflow.duration.seconds (histogram) - invocation duration</li>
 *   <li>ripple.workflow.active (gauge) - invocations in flight</li>
 * </ul>
 * Without a configured SDK the global instance is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowMetrics implements InvocationListener {

    private static final Logger logger = Logger.getLogger(WorkflowMetrics.class.getName());
    private static final String METER_NAME = "ripple-workflow";

    private static final AttributeKey<String> WORKFLOW_ID_KEY = AttributeKey.stringKey("workflow.id");
    private static final AttributeKey<String> FAILURE_TYPE_KEY = AttributeKey.stringKey("failure.type");
    private static final AttributeKey<String> CHAIN_KEY = AttributeKey.stringKey("chain");

    private final LongCounter invocationsTotal;
    private final LongCounter invocationsCompleted;
    private final LongCounter invocationsFailed;
    private final LongCounter actionsTotal;
    private final LongCounter actionsFailed;
    private final DoubleHistogram invocationDuration;
    private final AtomicLong activeInvocations = new AtomicLong(0);

    public WorkflowMetrics() {
        this(GlobalOpenTelemetry.get());
    }

    public WorkflowMetrics(OpenTelemetry openTelemetry) {
        Meter meter = openTelemetry.getMeter(METER_NAME);

        invocationsTotal = meter.counterBuilder("ripple.workflow.invocations.total")
                .setDescription("Total number of workflow invocations started")
                .setUnit("1")
                .build();

        invocationsCompleted = meter.counterBuilder("ripple.workflow.invocations.completed")
                .setDescription("Number of invocations that completed every action")
                .setUnit("1")
                .build();

        invocationsFailed = meter.counterBuilder("ripple.workflow.invocations.failed")
                .setDescription("Number of invocations that ended in error handling")
                .setUnit("1")
                .build();

        actionsTotal = meter.counterBuilder("ripple.workflow.actions.total")
                .setDescription("Total number of actions dispatched")
                .setUnit("1")
                .build();

        actionsFailed = meter.counterBuilder("ripple.workflow.actions.failed")
                .setDescription("Number of failed actions")
                .setUnit("1")
                .build();

        invocationDuration = meter.histogramBuilder("ripple.workflow.duration.seconds")
                .setDescription("Workflow invocation duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("ripple.workflow.active")
                .setDescription("Number of workflow invocations in flight")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeInvocations.get()));

        logger.info("WorkflowMetrics initialized");
    }

    @Override
    public void onInvocationStarted(WorkflowDefinition definition, ExecutionContext context) {
        invocationsTotal.add(1, Attributes.of(WORKFLOW_ID_KEY, definition.getId()));
        activeInvocations.incrementAndGet();
    }

    @Override
    public void onActionCompleted(WorkflowDefinition definition, ExecutionContext context,
                                  ActionResult result, boolean errorChain) {
        String chain = errorChain ? "error" : "main";
        actionsTotal.add(1, Attributes.of(WORKFLOW_ID_KEY, definition.getId(), CHAIN_KEY, chain));
        if (!result.isSuccessful()) {
            actionsFailed.add(1, Attributes.builder()
                    .put(WORKFLOW_ID_KEY, definition.getId())
                    .put(CHAIN_KEY, chain)
                    .put(FAILURE_TYPE_KEY, result.getErrorCode().orElse("unknown"))
                    .build());
        }
    }

    @Override
    public void onInvocationCompleted(WorkflowInvocation invocation) {
        activeInvocations.decrementAndGet();
        Attributes attrs = Attributes.of(WORKFLOW_ID_KEY, invocation.getDefinitionId());
        if (invocation.isSuccessful()) {
            invocationsCompleted.add(1, attrs);
        } else {
            invocationsFailed.add(1, Attributes.builder()
                    .putAll(attrs)
                    .put(FAILURE_TYPE_KEY, invocation.getError()
                            .map(error -> error.getType().code())
                            .orElse("unknown"))
                    .build());
        }
        invocationDuration.record(invocation.getDuration().toNanos() / 1_000_000_000.0, attrs);
    }

    /**
     * Invocations started but not yet completed, as seen by this listener.
     */
    public long getActiveInvocations() {
        return activeInvocations.get();
    }
}
