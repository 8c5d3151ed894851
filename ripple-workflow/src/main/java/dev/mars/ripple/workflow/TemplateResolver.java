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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Substitutes {@code {{path}}} placeholders in template values using an
 * {@link ExecutionContext}.
 *
 * <p>Strings are scanned for {@code {{ ... }}} segments whose inner text is a dotted
 * path into {@link ExecutionContext#toTemplateScope()}. Maps and lists are resolved
 * recursively; other scalars pass through unchanged. Resolution is lenient: a path
 * that cannot be walked renders as an empty string. The only failure is a
 * <code>{{</code> with no closing <code>}}</code>, reported as a {@link TemplateException}.</p>
 *
 * <p>A string that consists of exactly one placeholder resolves to the referenced
 * value itself, keeping its type; placeholders embedded in text are rendered as
 * strings, with maps and lists written as JSON.</p>
 *
 * <p>Instances are stateless and thread-safe.</p>
 */
public class TemplateResolver {

    static final String OPEN = "{{";
    static final String CLOSE = "}}";

    private final ObjectMapper objectMapper;

    public TemplateResolver() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Resolves a template value (string, map, list or scalar) against a context.
     *
     * @throws TemplateException if a placeholder is not terminated
     */
    public Object resolve(Object value, ExecutionContext context) {
        Objects.requireNonNull(context, "Execution context cannot be null");
        return resolveValue(value, context.toTemplateScope());
    }

    /**
     * Resolves every value of a map, preserving key order.
     */
    public Map<String, Object> resolveMap(Map<String, ?> values, ExecutionContext context) {
        Objects.requireNonNull(context, "Execution context cannot be null");
        return resolveMap(values, context.toTemplateScope());
    }

    /**
     * Resolves a string, always rendering the result as text.
     */
    public String resolveString(String template, ExecutionContext context) {
        Objects.requireNonNull(context, "Execution context cannot be null");
        return resolveString(template, context.toTemplateScope());
    }

    String resolveString(String template, Map<String, Object> scope) {
        if (template == null) {
            return null;
        }
        return render(resolveText(template, scope));
    }

    Object resolveValue(Object value, Map<String, Object> scope) {
        if (value instanceof String text) {
            return resolveText(text, scope);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                resolved.put(String.valueOf(entry.getKey()), resolveValue(entry.getValue(), scope));
            }
            return resolved;
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            for (Object item : list) {
                resolved.add(resolveValue(item, scope));
            }
            return resolved;
        }
        return value;
    }

    Map<String, Object> resolveMap(Map<String, ?> values, Map<String, Object> scope) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        if (values != null) {
            for (Map.Entry<String, ?> entry : values.entrySet()) {
                resolved.put(entry.getKey(), resolveValue(entry.getValue(), scope));
            }
        }
        return resolved;
    }

    private Object resolveText(String template, Map<String, Object> scope) {
        int open = template.indexOf(OPEN);
        if (open < 0) {
            return template;
        }

        int close = findClose(template, open);
        if (open == 0 && close + CLOSE.length() == template.length()) {
            Object value = ContextPathResolver.resolve(scope, placeholderPath(template, open, close));
            return value != null ? value : "";
        }

        StringBuilder result = new StringBuilder(template.length());
        int cursor = 0;
        while (open >= 0) {
            close = findClose(template, open);
            result.append(template, cursor, open);
            Object value = ContextPathResolver.resolve(scope, placeholderPath(template, open, close));
            result.append(render(value));
            cursor = close + CLOSE.length();
            open = template.indexOf(OPEN, cursor);
        }
        result.append(template, cursor, template.length());
        return result.toString();
    }

    /**
     * Checks if a template contains any placeholder.
     */
    public boolean hasPlaceholders(String template) {
        return template != null && template.contains(OPEN);
    }

    /**
     * Gets every placeholder path referenced by a template, in order of appearance.
     *
     * @throws TemplateException if a placeholder is not terminated
     */
    public Set<String> getPlaceholderPaths(String template) {
        Set<String> paths = new LinkedHashSet<>();
        if (template == null) {
            return paths;
        }
        int open = template.indexOf(OPEN);
        while (open >= 0) {
            int close = findClose(template, open);
            paths.add(placeholderPath(template, open, close));
            open = template.indexOf(OPEN, close + CLOSE.length());
        }
        return paths;
    }

    private static int findClose(String template, int open) {
        int close = template.indexOf(CLOSE, open + OPEN.length());
        if (close < 0) {
            throw new TemplateException(template, open, "Unterminated placeholder");
        }
        return close;
    }

    private static String placeholderPath(String template, int open, int close) {
        String path = template.substring(open + OPEN.length(), close).trim();
        if (path.isEmpty()) {
            throw new TemplateException(template, open, "Empty placeholder");
        }
        return path;
    }

    private String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Map || value instanceof List) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return value.toString();
            }
        }
        return value.toString();
    }
}
