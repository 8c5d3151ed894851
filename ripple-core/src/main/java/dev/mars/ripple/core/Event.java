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

package dev.mars.ripple.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * An immutable fact published to the event bus.
 *
 * <p>An event is identified by its {@code type}. The payload is deep-copied on
 * construction, so nested maps and lists handed in by a producer can be reused or
 * mutated afterwards without affecting the published event. Every event carries an
 * {@code id}; producers may choose it by putting an {@code "id"} entry in the payload,
 * otherwise a random UUID is assigned.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class Event {

    public static final String ID_FIELD = "id";

    private final String id;
    private final String type;
    private final Map<String, Object> payload;
    private final Instant timestamp;

    public Event(String type, Map<String, ?> payload, Instant timestamp) {
        this.type = Objects.requireNonNull(type, "Event type cannot be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be blank");
        }
        this.payload = copyMap(payload != null ? payload : Map.of());
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        Object suppliedId = this.payload.get(ID_FIELD);
        this.id = suppliedId != null ? suppliedId.toString() : UUID.randomUUID().toString();
    }

    public static Event of(String type, Map<String, ?> payload) {
        return new Event(type, payload, Instant.now());
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    /**
     * Returns the unmodifiable payload. Nested maps and lists are unmodifiable too.
     */
    public Map<String, Object> getPayload() {
        return payload;
    }

    public Instant getTimestamp() {
        return timestamp;
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
        Event event = (Event) o;
        return Objects.equals(id, event.id) && Objects.equals(type, event.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type);
    }

    @Override
    public String toString() {
        return "Event{" +
               "id='" + id + '\'' +
               ", type='" + type + '\'' +
               ", timestamp=" + timestamp +
               ", payloadKeys=" + payload.keySet() +
               '}';
    }
}
