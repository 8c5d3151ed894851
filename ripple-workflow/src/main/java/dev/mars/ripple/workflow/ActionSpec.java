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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One step of an action chain.
 *
 * <p>{@code type} is the dispatch key into the {@link ActionRegistry}. {@code target},
 * {@code template}, {@code channel} and every value of {@code data} may contain
 * {@code {{path}}} placeholders which are resolved against the
 * {@link ExecutionContext} immediately before the handler is invoked.</p>
 */
public class ActionSpec {

    private final String id;
    private final String type;
    private final String target;
    private final String template;
    private final String channel;
    private final Map<String, Object> data;

    public ActionSpec(String id, String type, String target, String template, String channel,
                      Map<String, ?> data) {
        this.id = Objects.requireNonNull(id, "Action id cannot be null");
        this.type = Objects.requireNonNull(type, "Action type cannot be null");
        this.target = target;
        this.template = template;
        this.channel = channel;
        this.data = data != null ? copyMap(data) : Map.of();
    }

    public static Builder builder(String id, String type) {
        return new Builder(id, type);
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public Optional<String> getTarget() {
        return Optional.ofNullable(target);
    }

    public Optional<String> getTemplate() {
        return Optional.ofNullable(template);
    }

    public Optional<String> getChannel() {
        return Optional.ofNullable(channel);
    }

    public Map<String, Object> getData() {
        return data;
    }

    /**
     * Returns a copy carrying already substituted values; id and type are kept.
     */
    public ActionSpec withResolvedValues(String resolvedTarget, String resolvedTemplate,
                                         String resolvedChannel, Map<String, ?> resolvedData) {
        return new ActionSpec(id, type, resolvedTarget, resolvedTemplate, resolvedChannel, resolvedData);
    }

    private static Map<String, Object> copyMap(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            copy.put(entry.getKey(), copyValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                nested.put(String.valueOf(entry.getKey()), copyValue(entry.getValue()));
            }
            return Collections.unmodifiableMap(nested);
        }
        if (value instanceof List) {
            List<Object> nested = new ArrayList<>();
            for (Object item : (List<?>) value) {
                nested.add(copyValue(item));
            }
            return Collections.unmodifiableList(nested);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActionSpec that = (ActionSpec) o;
        return id.equals(that.id) &&
               type.equals(that.type) &&
               Objects.equals(target, that.target) &&
               Objects.equals(template, that.template) &&
               Objects.equals(channel, that.channel) &&
               data.equals(that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, target, template, channel, data);
    }

    @Override
    public String toString() {
        return "ActionSpec{" +
               "id='" + id + '\'' +
               ", type='" + type + '\'' +
               (target != null ? ", target='" + target + '\'' : "") +
               (channel != null ? ", channel='" + channel + '\'' : "") +
               '}';
    }

    public static class Builder {
        private final String id;
        private final String type;
        private String target;
        private String template;
        private String channel;
        private final Map<String, Object> data = new LinkedHashMap<>();

        private Builder(String id, String type) {
            this.id = id;
            this.type = type;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder template(String template) {
            this.template = template;
            return this;
        }

        public Builder channel(String channel) {
            this.channel = channel;
            return this;
        }

        public Builder data(String key, Object value) {
            this.data.put(key, value);
            return this;
        }

        public Builder data(Map<String, ?> data) {
            if (data != null) {
                this.data.putAll(data);
            }
            return this;
        }

        public ActionSpec build() {
            return new ActionSpec(id, type, target, template, channel, data);
        }
    }
}
