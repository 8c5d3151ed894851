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
 * Thrown when a template value contains a malformed placeholder. Unresolvable paths
 * are not errors; they render as an empty string.
 */
public class TemplateException extends RuntimeException {

    private final String template;
    private final int position;

    public TemplateException(String template, int position, String message) {
        super(message + " at position " + position + " in '" + template + "'");
        this.template = template;
        this.position = position;
    }

    public String getTemplate() {
        return template;
    }

    public int getPosition() {
        return position;
    }
}
