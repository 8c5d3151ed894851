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

package dev.mars.ripple.event;

import dev.mars.ripple.core.Event;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Ingress and egress boundary for events.
 *
 * <p>Publishing never blocks the caller on subscriber work: events are recorded in the
 * per-topic history immediately and delivered to subscribers asynchronously, in
 * publish order. A subscriber that throws is logged and does not affect the
 * publisher or any other subscriber.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface EventBus extends AutoCloseable {

    /**
     * Publishes a new event of the given type.
     *
     * @param eventType the event type, used as the topic
     * @param payload   event payload, copied on publish
     * @return the published event, carrying its assigned id and timestamp
     */
    Event publish(String eventType, Map<String, ?> payload);

    /**
     * Publishes an already constructed event.
     */
    void publish(Event event);

    /**
     * Subscribes a listener to one topic (event type).
     */
    void subscribe(String topic, EventListener listener);

    /**
     * Subscribes a listener to every topic.
     */
    void subscribeAll(EventListener listener);

    /**
     * Removes a listener from a topic.
     *
     * @return true if the listener was subscribed to that topic
     */
    boolean unsubscribe(String topic, EventListener listener);

    /**
     * Removes a listener previously registered with {@link #subscribeAll(EventListener)}.
     */
    boolean unsubscribeAll(EventListener listener);

    /**
     * Returns the retained history of a topic, oldest first.
     */
    List<Event> poll(String topic);

    /**
     * Returns retained events of a topic published strictly after {@code since}.
     */
    List<Event> poll(String topic, Instant since);

    /**
     * Clears the retained history of one topic.
     */
    void clearHistory(String topic);

    /**
     * Clears the retained history of every topic.
     */
    void clearHistory();

    @Override
    void close();
}
