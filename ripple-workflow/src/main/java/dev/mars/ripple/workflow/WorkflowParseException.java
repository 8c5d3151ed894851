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
 * A workflow document could not be turned into a {@link WorkflowDefinition}: it is not
 * well-formed JSON/YAML, or a required field is missing or has the wrong shape.
 */
public class WorkflowParseException extends RippleException {

    private final String workflowId;
    private final String fieldPath;

    public WorkflowParseException(String message) {
        this(null, null, message, null);
    }

    public WorkflowParseException(String message, Throwable cause) {
        this(null, null, message, cause);
    }

    public WorkflowParseException(String workflowId, String fieldPath, String message) {
        this(workflowId, fieldPath, message, null);
    }

    public WorkflowParseException(String workflowId, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.workflowId = workflowId;
        this.fieldPath = fieldPath;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        if (workflowId != null) {
            sb.append("Workflow '").append(workflowId).append("': ");
        }
        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }
        return sb.append(super.getMessage()).toString();
    }
}
