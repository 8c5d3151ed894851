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

/**
 * Why an action failed. The {@link #code()} is stable and is what templates see as
 * {@code error.type} and handlers see as {@link ActionResult#getErrorCode()}.
 */
public enum FailureType {

    /** A placeholder in the action was malformed, e.g. an opening <code>{{</code> with no close. */
    TEMPLATE_ERROR("template_error"),

    /** A trigger condition could not be parsed or evaluated. */
    CONDITION_ERROR("condition_error"),

    /** No handler is registered for the action type. */
    UNKNOWN_ACTION_TYPE("unknown_action_type"),

    /** The handler threw or returned a failed result. */
    HANDLER_FAILURE("handler_failure"),

    /** The invocation ran past its timeout. */
    TIMEOUT("timeout");

    private final String code;

    FailureType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static FailureType fromCode(String code) {
        for (FailureType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        return HANDLER_FAILURE;
    }
}
