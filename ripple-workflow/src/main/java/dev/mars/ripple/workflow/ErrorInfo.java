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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Describes the failure that moved an invocation into error handling. Exposed to the
 * error chain as {@code error.message}, {@code error.type} and {@code error.action_id}.
 */
public class ErrorInfo {

    private final String message;
    private final FailureType type;
    private final String actionId;

    public ErrorInfo(String message, FailureType type, String actionId) {
        this.message = message != null ? message : "";
        this.type = Objects.requireNonNull(type, "Failure type cannot be null");
        this.actionId = actionId;
    }

    public static ErrorInfo from(ActionResult failed) {
        return new ErrorInfo(
                failed.getError().orElse("Action '" + failed.getActionId() + "' failed"),
                failed.getFailureType().orElse(FailureType.HANDLER_FAILURE),
                failed.getActionId());
    }

    public String getMessage() {
        return message;
    }

    public FailureType getType() {
        return type;
    }

    public String getActionId() {
        return actionId;
    }

    Map<String, Object> toTemplateView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("message", message);
        view.put("type", type.code());
        view.put("action_id", actionId);
        return view;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ErrorInfo errorInfo = (ErrorInfo) o;
        return message.equals(errorInfo.message) && type == errorInfo.type &&
               Objects.equals(actionId, errorInfo.actionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, type, actionId);
    }

    @Override
    public String toString() {
        return "ErrorInfo{type=" + type.code() + ", actionId='" + actionId + "', message='" + message + "'}";
    }
}
