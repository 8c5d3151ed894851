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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.Map;

/**
 * Parses JSON workflow documents with Jackson.
 */
public class JsonWorkflowDefinitionParser extends AbstractWorkflowDefinitionParser {

    private static final TypeReference<Map<String, Object>> TREE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JsonWorkflowDefinitionParser() {
        this(new WorkflowValidator());
    }

    public JsonWorkflowDefinitionParser(WorkflowValidator validator) {
        super(validator);
        this.objectMapper = new ObjectMapper();
    }

    @Override
    protected Map<String, Object> readTree(String content) throws WorkflowParseException {
        try {
            Map<String, Object> tree = objectMapper.readValue(content, TREE);
            if (tree == null) {
                throw new WorkflowParseException("Workflow document is empty");
            }
            return tree;
        } catch (JsonProcessingException e) {
            throw new WorkflowParseException("JSON parsing failed: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public boolean supports(Path file) {
        return file.getFileName().toString().toLowerCase().endsWith(".json");
    }
}
