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

import dev.mars.ripple.core.exceptions.RippleException;

/**
 * A definition failed validation and was not registered. The registry is unchanged.
 */
public class WorkflowRegistrationException extends RippleException {

    private final String workflowId;
    private final transient ValidationResult validationResult;

    public WorkflowRegistrationException(String workflowId, ValidationResult validationResult) {
        super("Workflow '" + workflowId + "' rejected: " + validationResult.getErrorSummary());
        this.workflowId = workflowId;
        this.validationResult = validationResult;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
