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

import dev.mars.ripple.core.Event;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ActionRegistryTest {

    @Mock
    private ActionHandler notificationHandler;

    private ActionRegistry registry;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        registry = new ActionRegistry();
        registry.register("notification", notificationHandler);
        context = ExecutionContext.forEvent(Event.of("financial_business.transaction.completed",
                Map.of("amount", 250, "currency", "USD", "transaction_id", "t1")));
    }

    @Test
    void testDispatchPassesResolvedValues() throws Exception {
        when(notificationHandler.handle(any(), anyMap())).thenReturn(ActionResult.success("ignored", Map.of("sent", true)));
        ActionSpec spec = ActionSpec.builder("notify_admin", "notification")
                .channel("{{event.currency}}-desk")
                .target("ops-{{event.transaction_id}}")
                .template("tx {{event.transaction_id}}")
                .data("message", "Moved {{event.amount}} {{event.currency}}")
                .data("amount", "{{event.amount}}")
                .build();

        ActionResult result = registry.dispatch(spec, context);

        ArgumentCaptor<ActionSpec> specCaptor = ArgumentCaptor.forClass(ActionSpec.class);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> dataCaptor = ArgumentCaptor.forClass(Map.class);
        verify(notificationHandler).handle(specCaptor.capture(), dataCaptor.capture());

        ActionSpec resolved = specCaptor.getValue();
        assertEquals("USD-desk", resolved.getChannel().orElseThrow());
        assertEquals("ops-t1", resolved.getTarget().orElseThrow());
        assertEquals("tx t1", resolved.getTemplate().orElseThrow());
        assertEquals("Moved 250 USD", dataCaptor.getValue().get("message"));
        assertEquals(250, dataCaptor.getValue().get("amount"));
        assertEquals(dataCaptor.getValue(), resolved.getData());

        assertTrue(result.isSuccessful());
        assertEquals("notify_admin", result.getActionId());
        assertEquals(Map.of("sent", true), result.getOutput());
        assertFalse(result.getErrorCode().isPresent());
    }

    @Test
    void testDispatchDoesNotRecordIntoContext() throws Exception {
        when(notificationHandler.handle(any(), anyMap())).thenReturn(ActionResult.success("n"));
        registry.dispatch(ActionSpec.builder("n", "notification").build(), context);
        assertTrue(context.getResults().isEmpty());
    }

    @Test
    void testUnknownActionTypeIsFailureData() {
        ActionResult result = registry.dispatch(ActionSpec.builder("call_crm", "crm").build(), context);

        assertFalse(result.isSuccessful());
        assertEquals("call_crm", result.getActionId());
        assertEquals(FailureType.UNKNOWN_ACTION_TYPE, result.getFailureType().orElseThrow());
        assertEquals("unknown_action_type", result.getErrorCode().orElseThrow());
        assertTrue(result.getError().orElseThrow().contains("crm"));
    }

    @Test
    void testHandlerExceptionIsCaptured() throws Exception {
        when(notificationHandler.handle(any(), anyMap())).thenThrow(new IOException("smtp unreachable"));

        ActionResult result = registry.dispatch(ActionSpec.builder("notify", "notification").build(), context);

        assertFalse(result.isSuccessful());
        assertEquals(FailureType.HANDLER_FAILURE, result.getFailureType().orElseThrow());
        assertEquals("smtp unreachable", result.getError().orElseThrow());
    }

    @Test
    void testRuntimeExceptionWithoutMessageIsCaptured() throws Exception {
        when(notificationHandler.handle(any(), anyMap())).thenThrow(new IllegalStateException());

        ActionResult result = registry.dispatch(ActionSpec.builder("notify", "notification").build(), context);

        assertEquals("handler_failure", result.getErrorCode().orElseThrow());
        assertEquals(IllegalStateException.class.getName(), result.getError().orElseThrow());
    }

    @Test
    void testReturnedFailureKeepsItsType() throws Exception {
        when(notificationHandler.handle(any(), anyMap()))
                .thenReturn(ActionResult.failure("whatever", "mailbox full"));

        ActionResult result = registry.dispatch(ActionSpec.builder("notify", "notification").build(), context);

        assertEquals("notify", result.getActionId());
        assertEquals("mailbox full", result.getError().orElseThrow());
        assertEquals(FailureType.HANDLER_FAILURE, result.getFailureType().orElseThrow());
    }

    @Test
    void testNullResultIsFailure() throws Exception {
        when(notificationHandler.handle(any(), anyMap())).thenReturn(null);

        ActionResult result = registry.dispatch(ActionSpec.builder("notify", "notification").build(), context);

        assertFalse(result.isSuccessful());
        assertEquals(FailureType.HANDLER_FAILURE, result.getFailureType().orElseThrow());
    }

    @Test
    void testMalformedTemplateIsTemplateError() {
        ActionSpec spec = ActionSpec.builder("notify", "notification")
                .data("message", "Amount {{event.amount")
                .build();

        ActionResult result = registry.dispatch(spec, context);

        assertEquals(FailureType.TEMPLATE_ERROR, result.getFailureType().orElseThrow());
        verifyNoInteractions(notificationHandler);
    }

    @Test
    void testRegistrationLifecycle() {
        ActionHandler other = (spec, data) -> ActionResult.success(spec.getId());
        registry.register("system", other);

        assertEquals(Set.of("notification", "system"), registry.getRegisteredTypes());
        assertTrue(registry.isRegistered("system"));
        assertSame(other, registry.getHandler("system").orElseThrow());

        assertTrue(registry.unregister("system"));
        assertFalse(registry.unregister("system"));
        assertFalse(registry.isRegistered("system"));
        assertFalse(registry.isRegistered(null));
    }

    @Test
    void testReRegisteringReplacesHandler() {
        ActionHandler replacement = (spec, data) -> ActionResult.success(spec.getId(), Map.of("v", 2));
        registry.register("notification", replacement);

        ActionResult result = registry.dispatch(ActionSpec.builder("n", "notification").build(), context);

        assertEquals(Map.of("v", 2), result.getOutput());
        verifyNoInteractions(notificationHandler);
    }

    @Test
    void testInvalidRegistrationRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", notificationHandler));
        assertThrows(NullPointerException.class, () -> registry.register("x", null));
    }

    @Test
    void testHandlerErrorIsCaptured() throws Exception {
        when(notificationHandler.handle(any(), anyMap())).thenThrow(new AssertionError("unexpected channel"));

        ActionResult result = registry.dispatch(ActionSpec.builder("notify", "notification").build(), context);

        assertFalse(result.isSuccessful());
        assertEquals(FailureType.HANDLER_FAILURE, result.getFailureType().orElseThrow());
        assertEquals("unexpected channel", result.getError().orElseThrow());
    }

    @Test
    void testVirtualMachineErrorPropagates() throws Exception {
        when(notificationHandler.handle(any(), anyMap())).thenThrow(new OutOfMemoryError("heap"));

        assertThrows(OutOfMemoryError.class,
                () -> registry.dispatch(ActionSpec.builder("notify", "notification").build(), context));
    }
}
