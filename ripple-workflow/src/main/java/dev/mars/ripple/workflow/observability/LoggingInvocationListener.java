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
import dev.mars.ripple.workflow.InvocationListener;
import dev.mars.ripple.workflow.WorkflowInvocation;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes one {@code key=value} line per finished invocation: the operator's audit trail.
 * Successful invocations log at INFO, failed ones at WARNING.
 * <pre>
 * workflow=funds_transfer_notification invocation=5f0c... event=financial_business.transaction.completed
 *   state=COMPLETED duration_ms=12 actions=[notify_admin:success,log_transaction:success,...]
 * </pre>
 */
public class LoggingInvocationListener implements InvocationListener {

    private static final Logger logger = Logger.getLogger(LoggingInvocationListener.class.getName());

    @Override
    public void onInvocationCompleted(WorkflowInvocation invocation) {
        Level level = invocation.isSuccessful() ? Level.INFO : Level.WARNING;
        if (logger.isLoggable(level)) {
            logger.log(level, format(invocation));
        }
    }

    static String format(WorkflowInvocation invocation) {
        StringBuilder line = new StringBuilder()
                .append("workflow=").append(invocation.getDefinitionId())
                .append(" version=").append(invocation.getDefinitionVersion())
                .append(" invocation=").append(invocation.getInvocationId())
                .append(" event=").append(invocation.getEvent().getType())
                .append(" event_id=").append(invocation.getEvent().getId())
                .append(" state=").append(invocation.getState())
                .append(" duration_ms=").append(invocation.getDuration().toMillis())
                .append(" actions=").append(outcomes(invocation.getActionResults()));
        if (!invocation.getErrorHandlerResults().isEmpty()) {
            line.append(" error_actions=").append(outcomes(invocation.getErrorHandlerResults()));
        }
        invocation.getError().ifPresent(error -> line
                .append(" error_type=").append(error.getType().code())
                .append(" failed_action=").append(error.getActionId())
                .append(" error=\"").append(error.getMessage().replace("\"", "'")).append('"'));
        return line.toString();
    }

    private static String outcomes(List<ActionResult> results) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < results.size(); i++) {
            ActionResult result = results.get(i);
            if (i > 0) {
                sb.append(',');
            }
            sb.append(result.getActionId()).append(':').append(result.getStatus().label());
            result.getErrorCode().ifPresent(code -> sb.append('(').append(code).append(')'));
        }
        return sb.append(']').toString();
    }
}
