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

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventTest {

    @Test
    void testPayloadIsDeepCopied() {
        Map<String, Object> nested = new HashMap<>();
        nested.put("currency", "USD");
        List<Object> tags = new ArrayList<>(List.of("a"));
        Map<String, Object> payload = new HashMap<>();
        payload.put("details", nested);
        payload.put("tags", tags);

        Event event = Event.of("transaction.completed", payload);

        nested.put("currency", "EUR");
        tags.add("b");
        payload.put("extra", true);

        @SuppressWarnings("unchecked")
        Map<String, Object> details = (Map<String, Object>) event.getPayload().get("details");
        assertEquals("USD", details.get("currency"));
        assertEquals(List.of("a"), event.getPayload().get("tags"));
        assertFalse(event.getPayload().containsKey("extra"));
    }

    @Test
    void testPayloadIsUnmodifiable() {
        Event event = Event.of("account.created", Map.of("account_number", "A-1"));

        assertThrows(UnsupportedOperationException.class, () -> event.getPayload().put("x", 1));
    }

    @Test
    void testProducerSuppliedIdIsUsed() {
        Event event = Event.of("account.created", Map.of("id", "evt-42"));

        assertEquals("evt-42", event.getId());
    }

    @Test
    void testGeneratedIdWhenAbsent() {
        Event first = Event.of("account.created", Map.of());
        Event second = Event.of("account.created", Map.of());

        assertNotNull(first.getId());
        assertNotEquals(first.getId(), second.getId());
    }

    @Test
    void testNullPayloadAndTimestampDefaults() {
        Event event = new Event("heartbeat", null, null);

        assertTrue(event.getPayload().isEmpty());
        assertNotNull(event.getTimestamp());
        assertFalse(event.getTimestamp().isAfter(Instant.now()));
    }

    @Test
    void testNullValuesInPayloadAreKept() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("note", null);

        Event event = Event.of("note.cleared", payload);

        assertTrue(event.getPayload().containsKey("note"));
        assertNull(event.getPayload().get("note"));
    }

    @Test
    void testBlankTypeRejected() {
        assertThrows(IllegalArgumentException.class, () -> Event.of(" ", Map.of()));
        assertThrows(NullPointerException.class, () -> Event.of(null, Map.of()));
    }
}
