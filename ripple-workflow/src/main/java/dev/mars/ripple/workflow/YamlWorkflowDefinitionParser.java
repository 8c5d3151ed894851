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

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.nio.file.Path;
import java.util.Map;

/**
 * Parses YAML workflow documents using SnakeYAML. The document shape is the same as
 * the JSON form.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlWorkflowDefinitionParser extends AbstractWorkflowDefinitionParser {

    private final Yaml yaml;

    public YamlWorkflowDefinitionParser() {
        this(new WorkflowValidator());
    }

    public YamlWorkflowDefinitionParser(WorkflowValidator validator) {
        super(validator);
        this.yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    @Override
    @SuppressWarnings("unchecked")
    protected Map<String, Object> readTree(String content) throws WorkflowParseException {
        Object document;
        try {
            document = yaml.load(content);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed: " + e.getMessage(), e);
        }
        if (!(document instanceof Map)) {
            throw new WorkflowParseException("Workflow document must be a mapping");
        }
        return (Map<String, Object>) document;
    }

    @Override
    public boolean supports(Path file) {
        String name = file.getFileName().toString().toLowerCase();
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
