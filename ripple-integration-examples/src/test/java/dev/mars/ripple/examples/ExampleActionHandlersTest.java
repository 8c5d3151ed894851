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

package dev.mars.ripple.examples;

import dev.mars.ripple.workflow.ActionResult;
import dev.mars.ripple.workflow.ActionSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExampleActionHandlersTest {

    @Test
    void testNotificationFallsBackToTemplateAndTarget() {
        NotificationActionHandler handler = new NotificationActionHandler();
        ActionSpec spec = ActionSpec.builder("notify", "notification")
                .target("ops")
                .template("Nightly batch finished")
                .build();

        ActionResult result = handler.handle(spec, Map.of());

        assertTrue(result.isSuccessful());
        assertEquals("ops", result.getOutput().get("channel"));
        assertEquals("Nightly batch finished", handler.getOutbox("ops").get(0).getMessage());
    }

    @Test
    void testNotificationWithoutRecipientFails() {
        NotificationActionHandler handler = new NotificationActionHandler();
        ActionSpec spec = ActionSpec.builder("notify", "notification").build();

        assertThrows(IllegalArgumentException.class, () -> handler.handle(spec, Map.of("message", "hi")));
        assertTrue(handler.getOutbox().isEmpty());
    }

    @Test
    void testSystemLogDefaultsToAuditSink() {
        SystemLogActionHandler handler = new SystemLogActionHandler();

        ActionResult result = handler.handle(ActionSpec.builder("log", "system").build(), Map.of("message", "hello"));

        assertEquals(SystemLogActionHandler.DEFAULT_SINK, result.getOutput().get("sink"));
        assertEquals("hello", handler.getEntries("audit_log").get(0).get("message"));
        assertEquals("log", handler.getEntries("audit_log").get(0).get("action_id"));
    }

    @Test
    void testServiceHandlerForwardsOperation() throws Exception {
        ServiceActionHandler handler = new ServiceActionHandler();
        ServiceActionHandler.CounterService counters = new ServiceActionHandler.CounterService();
        handler.registerService("metrics", counters);
        ActionSpec spec = ActionSpec.builder("count", "service").target("metrics").build();

        handler.handle(spec, Map.of("action", "increment", "name", "logins"));
        ActionResult result = handler.handle(spec, Map.of("action", "increment", "name", "logins"));

        assertEquals(2L, result.getOutput().get("value"));
        assertEquals(2, counters.get("logins"));
    }

    @Test
    void testServiceHandlerRejectsUnknownService() {
        ServiceActionHandler handler = new ServiceActionHandler();
        ActionSpec spec = ActionSpec.builder("call", "service").target("billing").build();

        Exception e = assertThrows(IllegalArgumentException.class,
                () -> handler.handle(spec, Map.of("action", "charge")));
        assertEquals("No service named 'billing'", e.getMessage());
    }

    @ParameterizedTest
    @CsvSource({
            "0, small",
            "99.99, small",
            "100, medium",
            "999, medium",
            "1000, large",
            "250000, large",
            "not-a-number, small"
    })
    void testAmountRange(String amount, String expected) {
        assertEquals(expected, TransactionEventPublisher.amountRange(amount));
    }
}
