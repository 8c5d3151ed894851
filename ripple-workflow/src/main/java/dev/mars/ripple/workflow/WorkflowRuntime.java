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
import dev.mars.ripple.event.EventBus;
import dev.mars.ripple.event.InMemoryEventBus;
import dev.mars.ripple.workflow.observability.LoggingInvocationListener;
import dev.mars.ripple.workflow.observability.WorkflowMetrics;

import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Assembles an event bus, the two registries and an engine from one
 * {@link RippleConfiguration}, and connects them. Handlers are registered on
 * {@link #getActionRegistry()} and workflows loaded with {@link #loadWorkflows()} before
 * events are published.
 */
public class WorkflowRuntime implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(WorkflowRuntime.class.getName());

    private final RippleConfiguration configuration;
    private final EventBus eventBus;
    private final ActionRegistry actionRegistry;
    private final WorkflowRegistry workflowRegistry;
    private final EventDrivenWorkflowEngine engine;
    private final WorkflowLoader loader;

    public WorkflowRuntime() {
        this(new RippleConfiguration());
    }

    public WorkflowRuntime(RippleConfiguration configuration) {
        this(configuration, new InMemoryEventBus(configuration));
    }

    public WorkflowRuntime(RippleConfiguration configuration, EventBus eventBus) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");

        TemplateResolver templateResolver = new TemplateResolver();
        ConditionEvaluator conditionEvaluator = new ConditionEvaluator();
        this.actionRegistry = new ActionRegistry(templateResolver);
        this.workflowRegistry = new WorkflowRegistry(
                new WorkflowValidator(conditionEvaluator, templateResolver, actionRegistry));
        this.engine = new EventDrivenWorkflowEngine(workflowRegistry, actionRegistry, conditionEvaluator, configuration);
        this.loader = new WorkflowLoader(workflowRegistry);

        engine.addInvocationListener(new LoggingInvocationListener());
        if (configuration.isMetricsEnabled()) {
            engine.addInvocationListener(new WorkflowMetrics());
        }
        engine.connect(eventBus);
        logger.info("Workflow runtime started");
    }

    /**
     * Loads every document in the configured {@code ripple.workflow.dir}.
     */
    public WorkflowLoader.LoadReport loadWorkflows() {
        return loadWorkflows(configuration.getWorkflowDirectory());
    }

    public WorkflowLoader.LoadReport loadWorkflows(Path directory) {
        return loader.loadDirectory(directory);
    }

    public RippleConfiguration getConfiguration() {
        return configuration;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public ActionRegistry getActionRegistry() {
        return actionRegistry;
    }

    public WorkflowRegistry getWorkflowRegistry() {
        return workflowRegistry;
    }

    public EventDrivenWorkflowEngine getEngine() {
        return engine;
    }

    public WorkflowLoader getLoader() {
        return loader;
    }

    @Override
    public void close() {
        engine.shutdown();
        eventBus.close();
        logger.info("Workflow runtime stopped");
    }
}
