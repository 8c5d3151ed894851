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

import java.nio.file.Path;

/**
 * Turns a workflow document into a {@link WorkflowDefinition}.
 */
public interface WorkflowDefinitionParser {

    WorkflowDefinition parse(Path file) throws WorkflowParseException;

    WorkflowDefinition parseFromString(String content) throws WorkflowParseException;

    /**
     * Semantic validation of an already parsed definition.
     */
    ValidationResult validate(WorkflowDefinition definition);

    /**
     * Checks that the raw document is well-formed and carries the required fields,
     * without building a definition.
     *
     * @param content the document text
     * @return validation result
     */
    ValidationResult validateSchema(String content);

    /**
     * Whether this parser handles the given file, judged by its extension.
     */
    boolean supports(Path file);
}
