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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one action dispatch. Failures are data: a failed result carries the
 * error message and a stable {@link FailureType} code instead of an exception.
 */
public class ActionResult {

    public enum Status {
        SUCCESS, FAILURE;

        public String label() {
            return name().toLowerCase();
        }
    }

    private final String actionId;
    private final Status status;
    private final Map<String, Object> output;
    private final String error;
    private final FailureType failureType;
    private final Duration duration;

    public ActionResult(String actionId, Status status, Map<String, ?> output, String error,
                        FailureType failureType, Duration duration) {
        this.actionId = Objects.requireNonNull(actionId, "Action id cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.output = output != null ? Collections.unmodifiableMap(new LinkedHashMap<>(output)) : Map.of();
        this.error = error;
        this.failureType = status == Status.FAILURE
                ? (failureType != null ? failureType : FailureType.HANDLER_FAILURE)
                : null;
        this.duration = duration != null ? duration : Duration.ZERO;
    }

    public static ActionResult success(String actionId, Map<String, ?> output) {
        return new ActionResult(actionId, Status.SUCCESS, output, null, null, null);
    }

    public static ActionResult success(String actionId) {
        return success(actionId, Map.of());
    }

    public static ActionResult failure(String actionId, String error) {
        return new ActionResult(actionId, Status.FAILURE, Map.of(), error, FailureType.HANDLER_FAILURE, null);
    }

    public static ActionResult failure(String actionId, FailureType failureType, String error) {
        return new ActionResult(actionId, Status.FAILURE, Map.of(), error, failureType, null);
    }

    public String getActionId() {
        return actionId;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccessful() {
        return status == Status.SUCCESS;
    }

    public Map<String, Object> getOutput() {
        return output;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<FailureType> getFailureType() {
        return Optional.ofNullable(failureType);
    }

    /**
     * Stable failure code, e.g. {@code unknown_action_type}; empty for successful results.
     */
    public Optional<String> getErrorCode() {
        return getFailureType().map(FailureType::code);
    }

    public Duration getDuration() {
        return duration;
    }

    /**
     * Copy with a different action id and measured duration; used by the dispatcher to
     * normalise whatever a handler returned.
     */
    ActionResult withActionIdAndDuration(String newActionId, Duration newDuration) {
        return new ActionResult(newActionId, status, output, error, failureType, newDuration);
    }

    /**
     * Shape exposed to templates and conditions under {@code results.<action_id>}.
     */
    Map<String, Object> toTemplateView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("action_id", actionId);
        view.put("status", status.label());
        view.put("output", output);
        view.put("error", error);
        view.put("error_type", failureType != null ? failureType.code() : null);
        return view;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActionResult that = (ActionResult) o;
        return actionId.equals(that.actionId) && status == that.status &&
               output.equals(that.output) && Objects.equals(error, that.error) &&
               failureType == that.failureType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(actionId, status, output, error, failureType);
    }

    @Override
    public String toString() {
        return "ActionResult{" +
               "actionId='" + actionId + '\'' +
               ", status=" + status +
               (error != null ? ", error='" + error + '\'' + ", type=" + failureType.code() : "") +
               '}';
    }
}
